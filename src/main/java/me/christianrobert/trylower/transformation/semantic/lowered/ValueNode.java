package me.christianrobert.trylower.transformation.semantic.lowered;

import me.christianrobert.trylower.transformation.semantic.element.HostExpression;

import java.util.Objects;

/**
 * Leaf producing a value: a host expression, a reference to a bound name, or unit.
 */
public class ValueNode extends LoweredNode {

    private static final ValueNode UNIT = new ValueNode(null, null);

    private final HostExpression expression;
    private final String reference;

    private ValueNode(HostExpression expression, String reference) {
        this.expression = expression;
        this.reference = reference;
    }

    public static ValueNode of(HostExpression expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Value expression cannot be null");
        }
        return new ValueNode(expression, null);
    }

    public static ValueNode reference(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Referenced name cannot be null or empty");
        }
        return new ValueNode(null, name);
    }

    public static ValueNode unit() {
        return UNIT;
    }

    public HostExpression getExpression() {
        return expression;
    }

    public String getReference() {
        return reference;
    }

    public boolean isExpression() {
        return expression != null;
    }

    public boolean isReference() {
        return reference != null;
    }

    public boolean isUnit() {
        return expression == null && reference == null;
    }

    @Override
    public <R> R accept(LoweredNodeVisitor<R> visitor) {
        return visitor.visitValue(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValueNode that = (ValueNode) o;
        return Objects.equals(expression, that.expression) && Objects.equals(reference, that.reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, reference);
    }

    @Override
    public String toString() {
        if (isExpression()) {
            return expression.getText();
        }
        return isReference() ? reference : "()";
    }
}
