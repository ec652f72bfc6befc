package me.christianrobert.trylower.transformation.analysis;

import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCode;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCollector;
import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.statement.CatchClause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the catch clauses of one construct into a {@link HandlerTable}.
 *
 * <p>Clauses are keyed by their exact error type. A second clause for the same type reports
 * {@code E-DUPLICATE-HANDLER} naming both locations; the first declaration stays in the table.
 */
public class HandlerTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(HandlerTableBuilder.class);

    private final DiagnosticCollector diagnostics;

    public HandlerTableBuilder(DiagnosticCollector diagnostics) {
        if (diagnostics == null) {
            throw new IllegalArgumentException("Diagnostics cannot be null");
        }
        this.diagnostics = diagnostics;
    }

    public HandlerTable build(List<CatchClause> clauses) {
        if (clauses == null) {
            throw new IllegalArgumentException("Catch clauses cannot be null");
        }

        Map<ErrorType, CatchClause> handlers = new LinkedHashMap<>();
        for (CatchClause clause : clauses) {
            CatchClause first = handlers.putIfAbsent(clause.getErrorType(), clause);
            if (first != null) {
                diagnostics.report(DiagnosticCode.DUPLICATE_HANDLER, clause.getLocation(), List.of(first.getLocation()),
                        "error type " + clause.getErrorType() + " is already handled by the clause at "
                                + first.getLocation(),
                        clause.getErrorType().getName());
            }
        }

        log.debug("Built handler table with {} entries from {} clauses", handlers.size(), clauses.size());
        return new HandlerTable(handlers);
    }
}
