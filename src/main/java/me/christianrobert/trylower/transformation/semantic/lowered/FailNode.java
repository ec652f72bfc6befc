package me.christianrobert.trylower.transformation.semantic.lowered;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.HostExpression;

import java.util.Objects;

/**
 * Terminates the nearest enclosing {@link ResultBlockNode} with {@code Err(payload)}.
 *
 * <p>Lowered form of a {@code throw} whose construct is itself a fallible statement of an
 * enclosing try scope: the error is observed by the enclosing dispatch instead of leaving
 * the function.
 */
public class FailNode extends LoweredNode {

    private final HostExpression payload;
    private final ErrorType errorType;

    public FailNode(HostExpression payload, ErrorType errorType) {
        if (payload == null || errorType == null) {
            throw new IllegalArgumentException("Fail payload and error type cannot be null");
        }
        this.payload = payload;
        this.errorType = errorType;
    }

    public HostExpression getPayload() {
        return payload;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    @Override
    public <R> R accept(LoweredNodeVisitor<R> visitor) {
        return visitor.visitFail(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FailNode that = (FailNode) o;
        return payload.equals(that.payload) && errorType.equals(that.errorType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(payload, errorType);
    }

    @Override
    public String toString() {
        return "Fail{" + payload + ": " + errorType + "}";
    }
}
