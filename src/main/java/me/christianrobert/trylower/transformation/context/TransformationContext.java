package me.christianrobert.trylower.transformation.context;

import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCollector;
import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;
import me.christianrobert.trylower.transformation.semantic.statement.TryCatchStatement;
import me.christianrobert.trylower.transformation.type.TypeOracle;

/**
 * Provides the context for lowering the constructs of one function body.
 *
 * <p>Contains:
 * <ul>
 *   <li>The function's name and declared result signature</li>
 *   <li>The host type oracle (read-only, possibly shared with other workers)</li>
 *   <li>The run options</li>
 *   <li>Function-local state: the generator for fresh binding names</li>
 * </ul>
 *
 * <p>One context is created per function and is confined to the thread lowering it.
 */
public class TransformationContext {

    private final String functionName;
    private final FunctionContext functionContext;
    private final TypeOracle typeOracle;
    private final LoweringOptions options;

    // Function-local state (mutable)
    private int tempCounter;

    public TransformationContext(String functionName, FunctionContext functionContext, TypeOracle typeOracle,
                                 LoweringOptions options) {
        if (functionName == null || functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("Function name cannot be null or empty");
        }
        if (functionContext == null) {
            throw new IllegalArgumentException("Function context cannot be null");
        }
        if (typeOracle == null) {
            throw new IllegalArgumentException("Type oracle cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("Options cannot be null");
        }
        this.functionName = functionName;
        this.functionContext = functionContext;
        this.typeOracle = typeOracle;
        this.options = options;
    }

    public String getFunctionName() {
        return functionName;
    }

    public FunctionContext getFunctionContext() {
        return functionContext;
    }

    public TypeOracle getTypeOracle() {
        return typeOracle;
    }

    public LoweringOptions getOptions() {
        return options;
    }

    // ========== Construct Helpers ==========

    /**
     * Gets the error type of the result a construct evaluates to when it is a fallible operand of
     * an enclosing try scope: its declared override if present, otherwise the function's outer
     * error type. Constructs elsewhere never produce a result of their own; their throws carry
     * the type of wherever they leave to.
     */
    public ErrorType operandErrorType(TryCatchStatement construct) {
        if (construct.hasDeclaredErrorType()) {
            return construct.getDeclaredErrorType();
        }
        return functionContext.getOuterErrorType();
    }

    /**
     * Creates a fresh diagnostic collector for one construct, honouring the run options.
     */
    public DiagnosticCollector newCollector() {
        return new DiagnosticCollector(options.isUnreachableHandlerFatal());
    }

    /**
     * Creates an exception for an internal failure at a location of this function.
     */
    public TransformationException failure(SourceLocation location, String message) {
        return new TransformationException(message, functionName, location);
    }

    // ========== Fresh Names ==========

    /**
     * Generates a binding name unique within the function.
     * Names are numbered in visit order, so lowering the same input twice yields the same names.
     */
    public String freshName() {
        return options.getTempPrefix() + (tempCounter++);
    }

    /**
     * Restarts name numbering (for lowering another function with the same context settings).
     */
    public void resetNames() {
        tempCounter = 0;
    }
}
