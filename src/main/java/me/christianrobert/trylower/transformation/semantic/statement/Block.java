package me.christianrobert.trylower.transformation.semantic.statement;

import me.christianrobert.trylower.transformation.semantic.SemanticNode;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

import java.util.List;

/**
 * Ordered statement sequence. The last statement is the block's value.
 */
public class Block implements SemanticNode {

    private final List<Statement> statements;
    private final SourceLocation location;

    public Block(List<Statement> statements, SourceLocation location) {
        if (statements == null) {
            throw new IllegalArgumentException("Statements cannot be null");
        }
        if (location == null) {
            throw new IllegalArgumentException("Block location cannot be null");
        }
        this.statements = List.copyOf(statements);
        this.location = location;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    /**
     * @return The last-evaluated statement, or null for an empty block
     */
    public Statement getTerminal() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return "Block{statements=" + statements + "}";
    }
}
