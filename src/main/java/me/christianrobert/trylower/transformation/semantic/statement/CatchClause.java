package me.christianrobert.trylower.transformation.semantic.statement;

import me.christianrobert.trylower.transformation.semantic.SemanticNode;
import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

/**
 * {@code catch(ErrorType name) { ... }} - handler for exactly one error type.
 *
 * <p>The body evaluates either to a value of the try block's success type or to a
 * {@code throw} of the enclosing function's error type. The binding names the caught error
 * value and is visible in the body only.
 */
public class CatchClause implements SemanticNode {

    private final ErrorType errorType;
    private final String binding;
    private final Block body;
    private final SourceLocation location;

    public CatchClause(ErrorType errorType, String binding, Block body, SourceLocation location) {
        if (errorType == null) {
            throw new IllegalArgumentException("Catch clause error type cannot be null");
        }
        if (binding == null || binding.trim().isEmpty()) {
            throw new IllegalArgumentException("Catch clause binding cannot be null or empty");
        }
        if (body == null) {
            throw new IllegalArgumentException("Catch clause body cannot be null");
        }
        if (location == null) {
            throw new IllegalArgumentException("Catch clause location cannot be null");
        }
        this.errorType = errorType;
        this.binding = binding;
        this.body = body;
        this.location = location;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getBinding() {
        return binding;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return "CatchClause{errorType=" + errorType + ", binding='" + binding + "', location=" + location + "}";
    }
}
