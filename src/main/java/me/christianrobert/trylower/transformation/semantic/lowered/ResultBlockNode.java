package me.christianrobert.trylower.transformation.semantic.lowered;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.TypeRef;

import java.util.Objects;

/**
 * A lowered construct evaluated as a result value.
 *
 * <p>Normal completion of {@code body} with value {@code v} yields {@code Ok(v)}; a
 * {@link FailNode} inside {@code body} yields {@code Err(payload)}. Used when a nested construct
 * is a fallible statement of an enclosing try scope.
 */
public class ResultBlockNode extends LoweredNode {

    private final LoweredNode body;
    private final TypeRef okType;
    private final ErrorType errorType;

    public ResultBlockNode(LoweredNode body, TypeRef okType, ErrorType errorType) {
        if (body == null || okType == null || errorType == null) {
            throw new IllegalArgumentException("Result block body and types cannot be null");
        }
        this.body = body;
        this.okType = okType;
        this.errorType = errorType;
    }

    public LoweredNode getBody() {
        return body;
    }

    public TypeRef getOkType() {
        return okType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    @Override
    public <R> R accept(LoweredNodeVisitor<R> visitor) {
        return visitor.visitResultBlock(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResultBlockNode that = (ResultBlockNode) o;
        return body.equals(that.body) && okType.equals(that.okType) && errorType.equals(that.errorType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(body, okType, errorType);
    }

    @Override
    public String toString() {
        return "ResultBlock<" + okType + ", " + errorType + ">{" + body + "}";
    }
}
