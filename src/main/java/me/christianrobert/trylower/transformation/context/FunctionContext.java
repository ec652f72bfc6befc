package me.christianrobert.trylower.transformation.context;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.TypeRef;

import java.util.Objects;

/**
 * Declared result signature of the enclosing function: {@code Result<OkType, OuterErrorType>}.
 *
 * <p>Every {@code throw} in the function's catch clauses must produce {@code outerErrorType}.
 */
public class FunctionContext {

    private final TypeRef okType;
    private final ErrorType outerErrorType;

    public FunctionContext(TypeRef okType, ErrorType outerErrorType) {
        if (okType == null) {
            throw new IllegalArgumentException("Ok type cannot be null");
        }
        if (outerErrorType == null) {
            throw new IllegalArgumentException("Outer error type cannot be null");
        }
        this.okType = okType;
        this.outerErrorType = outerErrorType;
    }

    public TypeRef getOkType() {
        return okType;
    }

    public ErrorType getOuterErrorType() {
        return outerErrorType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FunctionContext that = (FunctionContext) o;
        return okType.equals(that.okType) && outerErrorType.equals(that.outerErrorType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(okType, outerErrorType);
    }

    @Override
    public String toString() {
        return "Result<" + okType + ", " + outerErrorType + ">";
    }
}
