package me.christianrobert.trylower.transformation.semantic.lowered;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.HostExpression;

import java.util.Objects;

/**
 * Early return of {@code Err(payload)} from the enclosing function.
 *
 * <p>Lowered form of a {@code throw} whose construct sits directly in the function body.
 */
public class ReturnErrorNode extends LoweredNode {

    private final HostExpression payload;
    private final ErrorType errorType;

    public ReturnErrorNode(HostExpression payload, ErrorType errorType) {
        if (payload == null || errorType == null) {
            throw new IllegalArgumentException("Return payload and error type cannot be null");
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
        return visitor.visitReturnError(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReturnErrorNode that = (ReturnErrorNode) o;
        return payload.equals(that.payload) && errorType.equals(that.errorType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(payload, errorType);
    }

    @Override
    public String toString() {
        return "ReturnErr{" + payload + ": " + errorType + "}";
    }
}
