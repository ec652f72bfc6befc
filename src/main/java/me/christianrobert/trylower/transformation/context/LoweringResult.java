package me.christianrobert.trylower.transformation.context;

import me.christianrobert.trylower.transformation.diagnostic.Diagnostic;
import me.christianrobert.trylower.transformation.semantic.statement.Block;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of lowering one function.
 * Contains the lowered body and all diagnostics, or an error message if lowering aborted.
 * Optionally includes a formatted tree for debugging.
 *
 * <p>A function is successful when lowering ran to completion and no fatal diagnostic was
 * reported. Warnings never affect success. A failed function may still carry a body, in which
 * each failing construct is replaced by an error placeholder.
 */
public class LoweringResult {

    private final String functionName;
    private final boolean success;
    private final Block loweredBody;
    private final List<Diagnostic> diagnostics;
    private final String errorMessage;
    private final String debugTree;  // Optional (null by default)

    private LoweringResult(String functionName, boolean success, Block loweredBody, List<Diagnostic> diagnostics,
                           String errorMessage, String debugTree) {
        this.functionName = functionName;
        this.success = success;
        this.loweredBody = loweredBody;
        this.diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        this.errorMessage = errorMessage;
        this.debugTree = debugTree;
    }

    /**
     * Creates a result from a completed run; success is derived from the diagnostics.
     */
    public static LoweringResult completed(String functionName, Block loweredBody, List<Diagnostic> diagnostics) {
        return completedWithDebugTree(functionName, loweredBody, diagnostics, null);
    }

    /**
     * Creates a result from a completed run with a debug tree.
     */
    public static LoweringResult completedWithDebugTree(String functionName, Block loweredBody,
                                                        List<Diagnostic> diagnostics, String debugTree) {
        boolean fatal = diagnostics.stream().anyMatch(Diagnostic::isFatal);
        String message = fatal ? summarize(diagnostics) : null;
        return new LoweringResult(functionName, !fatal, loweredBody, diagnostics, message, debugTree);
    }

    /**
     * Creates a failed result for a run that aborted.
     */
    public static LoweringResult failure(String functionName, String errorMessage) {
        return new LoweringResult(functionName, false, null, List.of(), errorMessage, null);
    }

    /**
     * Creates a failed result from an exception.
     */
    public static LoweringResult failure(String functionName, TransformationException exception) {
        return new LoweringResult(functionName, false, null, List.of(), exception.getDetailedMessage(), null);
    }

    private static String summarize(List<Diagnostic> diagnostics) {
        return diagnostics.stream()
                .filter(Diagnostic::isFatal)
                .map(Diagnostic::format)
                .collect(Collectors.joining("\n"));
    }

    public String getFunctionName() {
        return functionName;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Block getLoweredBody() {
        return loweredBody;
    }

    public boolean hasLoweredBody() {
        return loweredBody != null;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(Diagnostic::isFatal).collect(Collectors.toList());
    }

    public List<Diagnostic> getWarnings() {
        return diagnostics.stream().filter(d -> !d.isFatal()).collect(Collectors.toList());
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getDebugTree() {
        return debugTree;
    }

    public boolean hasDebugTree() {
        return debugTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "LoweringResult{function='" + functionName + "', success=true, warnings=" + getWarnings().size() +
                    (debugTree != null ? ", hasDebugTree=true" : "") + "}";
        } else {
            return "LoweringResult{function='" + functionName + "', success=false, error='" + errorMessage + "'" +
                    (debugTree != null ? ", hasDebugTree=true" : "") + "}";
        }
    }
}
