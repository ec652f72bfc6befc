package me.christianrobert.trylower.transformation.semantic.statement;

import me.christianrobert.trylower.transformation.semantic.element.HostExpression;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

/**
 * {@code if cond { ... } else { ... }} with host-owned condition.
 *
 * <p>Both branches are ordinary nested blocks. A missing else branch evaluates to unit.
 */
public class ConditionalStatement extends Statement {

    private final String binding;
    private final HostExpression condition;
    private final Block thenBlock;
    private final Block elseBlock;  // Optional, null if not present

    public ConditionalStatement(String binding, HostExpression condition, Block thenBlock, Block elseBlock,
                                SourceLocation location) {
        super(location);
        if (condition == null) {
            throw new IllegalArgumentException("Condition cannot be null");
        }
        if (thenBlock == null) {
            throw new IllegalArgumentException("Then block cannot be null");
        }
        this.binding = binding;
        this.condition = condition;
        this.thenBlock = thenBlock;
        this.elseBlock = elseBlock;
    }

    public String getBinding() {
        return binding;
    }

    public HostExpression getCondition() {
        return condition;
    }

    public Block getThenBlock() {
        return thenBlock;
    }

    public Block getElseBlock() {
        return elseBlock;
    }

    public boolean hasElseBlock() {
        return elseBlock != null;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public String toString() {
        return "ConditionalStatement{condition=" + condition + ", then=" + thenBlock +
                (elseBlock != null ? ", else=" + elseBlock : "") + "}";
    }
}
