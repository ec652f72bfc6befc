package me.christianrobert.trylower.transformation.type;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.HostExpression;
import me.christianrobert.trylower.transformation.semantic.element.TypeRef;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, map-backed {@link TypeOracle} keyed by host expression id.
 * <p>
 * Used by hosts that precompute types in a separate pass, and by tests. Assignability is exact
 * nominal equality plus explicitly registered pairs (e.g. a host-level widening rule). There is
 * deliberately no subtype inference.
 * </p>
 */
public class SimpleTypeOracle implements TypeOracle {

    private final Map<String, TypeRef> valueTypes;
    private final Map<String, ErrorType> errorTypes;
    private final Set<String> assignablePairs;

    private SimpleTypeOracle(Builder builder) {
        this.valueTypes = Collections.unmodifiableMap(new HashMap<>(builder.valueTypes));
        this.errorTypes = Collections.unmodifiableMap(new HashMap<>(builder.errorTypes));
        this.assignablePairs = Collections.unmodifiableSet(new HashSet<>(builder.assignablePairs));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public TypeRef typeOf(HostExpression expression) {
        if (expression == null) {
            return TypeRef.UNKNOWN;
        }
        return valueTypes.getOrDefault(expression.getId(), TypeRef.UNKNOWN);
    }

    @Override
    public ErrorType errorTypeOf(HostExpression callSite) {
        if (callSite == null) {
            return null;
        }
        return errorTypes.get(callSite.getId());
    }

    @Override
    public boolean isAssignable(TypeRef from, TypeRef to) {
        if (from == null || to == null) {
            return false;
        }
        if (from.equals(to)) {
            return true;
        }
        return assignablePairs.contains(pairKey(from, to));
    }

    private static String pairKey(TypeRef from, TypeRef to) {
        return from.getCategory() + ":" + from.getName() + "->" + to.getCategory() + ":" + to.getName();
    }

    /**
     * Collects expression types before freezing them into an oracle.
     */
    public static class Builder {

        private final Map<String, TypeRef> valueTypes = new HashMap<>();
        private final Map<String, ErrorType> errorTypes = new HashMap<>();
        private final Set<String> assignablePairs = new HashSet<>();

        private Builder() {
        }

        /**
         * Registers the value type of a plain expression (or of a throw payload).
         */
        public Builder value(HostExpression expression, TypeRef type) {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(type, "type");
            valueTypes.put(expression.getId(), type);
            return this;
        }

        /**
         * Registers a fallible call site with its success and error types.
         */
        public Builder fallible(HostExpression callSite, TypeRef okType, ErrorType errorType) {
            Objects.requireNonNull(callSite, "callSite");
            Objects.requireNonNull(okType, "okType");
            Objects.requireNonNull(errorType, "errorType");
            valueTypes.put(callSite.getId(), okType);
            errorTypes.put(callSite.getId(), errorType);
            return this;
        }

        /**
         * Registers a one-directional assignability rule beyond equality.
         */
        public Builder assignable(TypeRef from, TypeRef to) {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            assignablePairs.add(pairKey(from, to));
            return this;
        }

        public SimpleTypeOracle build() {
            return new SimpleTypeOracle(this);
        }
    }
}
