package me.christianrobert.trylower.transformation.semantic.lowered;

import java.util.Objects;

/**
 * {@code let name = value in body}.
 */
public class LetNode extends LoweredNode {

    private final String name;
    private final LoweredNode value;
    private final LoweredNode body;

    public LetNode(String name, LoweredNode value, LoweredNode body) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Let binding name cannot be null or empty");
        }
        if (value == null || body == null) {
            throw new IllegalArgumentException("Let value and body cannot be null");
        }
        this.name = name;
        this.value = value;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public LoweredNode getValue() {
        return value;
    }

    public LoweredNode getBody() {
        return body;
    }

    @Override
    public <R> R accept(LoweredNodeVisitor<R> visitor) {
        return visitor.visitLet(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LetNode that = (LetNode) o;
        return name.equals(that.name) && value.equals(that.value) && body.equals(that.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, body);
    }

    @Override
    public String toString() {
        return "Let{" + name + " = " + value + " in " + body + "}";
    }
}
