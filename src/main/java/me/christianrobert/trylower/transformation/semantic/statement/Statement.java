package me.christianrobert.trylower.transformation.semantic.statement;

import me.christianrobert.trylower.transformation.semantic.SemanticNode;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

/**
 * Base class for statements in a function body, a try scope or a catch clause body.
 */
public abstract class Statement implements SemanticNode {

    private final SourceLocation location;

    protected Statement(SourceLocation location) {
        if (location == null) {
            throw new IllegalArgumentException("Statement location cannot be null");
        }
        this.location = location;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R> R accept(StatementVisitor<R> visitor);
}
