package me.christianrobert.trylower.transformation.analysis;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.statement.CatchClause;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mapping from error type to the one catch clause that owns it within a single construct.
 *
 * <p>Built fresh per construct by {@link HandlerTableBuilder}; never shared. Iteration follows
 * clause declaration order.
 */
public class HandlerTable {

    private final Map<ErrorType, CatchClause> handlers;

    HandlerTable(Map<ErrorType, CatchClause> handlers) {
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(handlers));
    }

    /**
     * @return The owning clause, or null if no clause handles the type
     */
    public CatchClause get(ErrorType errorType) {
        return handlers.get(errorType);
    }

    public boolean handles(ErrorType errorType) {
        return handlers.containsKey(errorType);
    }

    public Set<ErrorType> getErrorTypes() {
        return handlers.keySet();
    }

    public int size() {
        return handlers.size();
    }

    @Override
    public String toString() {
        return "HandlerTable{" + handlers.keySet() + "}";
    }
}
