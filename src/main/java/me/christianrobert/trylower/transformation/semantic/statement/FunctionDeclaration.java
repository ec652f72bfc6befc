package me.christianrobert.trylower.transformation.semantic.statement;

import me.christianrobert.trylower.transformation.semantic.SemanticNode;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;
import me.christianrobert.trylower.transformation.context.FunctionContext;

/**
 * A function whose body may contain try/catch constructs.
 *
 * <p>Functions are the batching unit for diagnostics and the unit of parallel work.
 */
public class FunctionDeclaration implements SemanticNode {

    private final String name;
    private final FunctionContext functionContext;
    private final Block body;
    private final SourceLocation location;

    public FunctionDeclaration(String name, FunctionContext functionContext, Block body, SourceLocation location) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Function name cannot be null or empty");
        }
        if (functionContext == null) {
            throw new IllegalArgumentException("Function context cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("Function body cannot be null");
        }
        if (location == null) {
            throw new IllegalArgumentException("Function location cannot be null");
        }
        this.name = name;
        this.functionContext = functionContext;
        this.body = body;
        this.location = location;
    }

    public String getName() {
        return name;
    }

    public FunctionContext getFunctionContext() {
        return functionContext;
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
        return "FunctionDeclaration{name='" + name + "', context=" + functionContext + "}";
    }
}
