package me.christianrobert.trylower.transformation.semantic.lowered;

import me.christianrobert.trylower.transformation.semantic.element.HostExpression;

import java.util.Objects;

/**
 * {@code if condition then ... else ...} carried over from an ordinary conditional.
 */
public class BranchNode extends LoweredNode {

    private final HostExpression condition;
    private final LoweredNode thenNode;
    private final LoweredNode elseNode;

    public BranchNode(HostExpression condition, LoweredNode thenNode, LoweredNode elseNode) {
        if (condition == null || thenNode == null || elseNode == null) {
            throw new IllegalArgumentException("Branch condition and arms cannot be null");
        }
        this.condition = condition;
        this.thenNode = thenNode;
        this.elseNode = elseNode;
    }

    public HostExpression getCondition() {
        return condition;
    }

    public LoweredNode getThenNode() {
        return thenNode;
    }

    public LoweredNode getElseNode() {
        return elseNode;
    }

    @Override
    public <R> R accept(LoweredNodeVisitor<R> visitor) {
        return visitor.visitBranch(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BranchNode that = (BranchNode) o;
        return condition.equals(that.condition) && thenNode.equals(that.thenNode) && elseNode.equals(that.elseNode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, thenNode, elseNode);
    }

    @Override
    public String toString() {
        return "Branch{" + condition + " ? " + thenNode + " : " + elseNode + "}";
    }
}
