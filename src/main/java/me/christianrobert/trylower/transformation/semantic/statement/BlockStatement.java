package me.christianrobert.trylower.transformation.semantic.statement;

import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

/**
 * A nested ordinary block used as a statement.
 */
public class BlockStatement extends Statement {

    private final String binding;
    private final Block block;

    public BlockStatement(String binding, Block block, SourceLocation location) {
        super(location);
        if (block == null) {
            throw new IllegalArgumentException("Block cannot be null");
        }
        this.binding = binding;
        this.block = block;
    }

    public String getBinding() {
        return binding;
    }

    public Block getBlock() {
        return block;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public String toString() {
        return "BlockStatement{" + (binding != null ? "binding='" + binding + "', " : "") + "block=" + block + "}";
    }
}
