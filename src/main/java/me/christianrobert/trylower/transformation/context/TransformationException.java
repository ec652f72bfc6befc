package me.christianrobert.trylower.transformation.context;

import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

/**
 * Internal failure of the lowering pass, as opposed to a problem in the user's code.
 *
 * <p>User errors are reported as diagnostics and never thrown. This exception signals a broken
 * assumption between pipeline stages or a tree the host should not have produced. It is rendered
 * like a diagnostic line so that hosts can print both the same way:
 * <pre>
 * main.src:12:5: internal error in load_config: Nested construct was not lowered before its parent
 * </pre>
 */
public class TransformationException extends RuntimeException {

    private final String functionName;  // Null when raised outside any function
    private final SourceLocation location;

    /**
     * Use {@link TransformationContext#failure} inside a function.
     */
    public TransformationException(String message, String functionName, SourceLocation location) {
        super(message);
        this.functionName = functionName;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    /**
     * Wraps an unexpected exception thrown while lowering a function.
     */
    public TransformationException(String functionName, Throwable cause) {
        super(cause != null ? cause.getMessage() : null, cause);
        this.functionName = functionName;
        this.location = SourceLocation.UNKNOWN;
    }

    public String getFunctionName() {
        return functionName;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(location).append(": internal error");
        if (functionName != null) {
            sb.append(" in ").append(functionName);
        }
        sb.append(": ").append(getMessage());
        if (getCause() != null) {
            sb.append(" (").append(getCause().getClass().getSimpleName()).append(")");
        }
        return sb.toString();
    }
}
