package me.christianrobert.trylower.transformation.desugar;

import me.christianrobert.trylower.transformation.semantic.element.ErrorType;

/**
 * Where the {@code throw}s of a construct's catch clauses go, and the error type they must carry.
 *
 * <pre>
 * fn f() -&gt; Result&lt;R, ErrorA&gt;
 *     try { ... } catch ...           -- functionReturn(ErrorA)
 *     let v: Local = try { ... } ...  -- operand of a try scope: enclosingResult(Local)
 * </pre>
 *
 * <p>A construct nested in a catch body is lowered with the destination of the construct owning
 * that body, so its throws leave through the same exit with the same type.
 */
public final class ThrowDestination {

    private final ThrowTarget target;
    private final ErrorType errorType;

    private ThrowDestination(ThrowTarget target, ErrorType errorType) {
        if (target == null || errorType == null) {
            throw new IllegalArgumentException("Throw target and error type cannot be null");
        }
        this.target = target;
        this.errorType = errorType;
    }

    /**
     * Throws return {@code Err} from the function; the type is the function's outer error type.
     */
    public static ThrowDestination functionReturn(ErrorType outerErrorType) {
        return new ThrowDestination(ThrowTarget.FUNCTION_RETURN, outerErrorType);
    }

    /**
     * Throws end the enclosing result block, whose error type is {@code resultErrorType}.
     */
    public static ThrowDestination enclosingResult(ErrorType resultErrorType) {
        return new ThrowDestination(ThrowTarget.ENCLOSING_RESULT, resultErrorType);
    }

    public ThrowTarget getTarget() {
        return target;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ThrowDestination that = (ThrowDestination) o;
        return target == that.target && errorType.equals(that.errorType);
    }

    @Override
    public int hashCode() {
        return 31 * target.hashCode() + errorType.hashCode();
    }

    @Override
    public String toString() {
        return target + "(" + errorType + ")";
    }
}
