package me.christianrobert.trylower.transformation.semantic.statement;

import me.christianrobert.trylower.transformation.semantic.SemanticNode;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;
import me.christianrobert.trylower.transformation.semantic.element.TypeRef;

import java.util.List;

/**
 * The try scope of a construct: statements executed front-to-back plus the success type the
 * block evaluates to when every statement succeeds.
 *
 * <p>Order is significant. The first failing statement short-circuits the remainder.
 */
public class TryBlock implements SemanticNode {

    private final Block body;
    private final TypeRef successType;

    public TryBlock(Block body, TypeRef successType) {
        if (body == null) {
            throw new IllegalArgumentException("Try body cannot be null");
        }
        if (successType == null) {
            throw new IllegalArgumentException("Success type cannot be null");
        }
        this.body = body;
        this.successType = successType;
    }

    public TryBlock(List<Statement> statements, TypeRef successType, SourceLocation location) {
        this(new Block(statements, location), successType);
    }

    public Block getBody() {
        return body;
    }

    public List<Statement> getStatements() {
        return body.getStatements();
    }

    public TypeRef getSuccessType() {
        return successType;
    }

    @Override
    public SourceLocation getLocation() {
        return body.getLocation();
    }

    @Override
    public String toString() {
        return "TryBlock{successType=" + successType + ", statements=" + body.getStatements() + "}";
    }
}
