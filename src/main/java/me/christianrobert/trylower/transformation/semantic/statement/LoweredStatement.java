package me.christianrobert.trylower.transformation.semantic.statement;

import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;
import me.christianrobert.trylower.transformation.semantic.lowered.LoweredNode;

import java.util.Objects;

/**
 * A try/catch construct after lowering, left in place of the original statement.
 *
 * <p>Downstream passes see only the lowered expression. Lowering a body that already contains
 * lowered statements leaves them untouched.
 */
public class LoweredStatement extends Statement {

    private final String binding;
    private final LoweredNode lowered;

    public LoweredStatement(String binding, LoweredNode lowered, SourceLocation location) {
        super(location);
        if (lowered == null) {
            throw new IllegalArgumentException("Lowered node cannot be null");
        }
        this.binding = binding;
        this.lowered = lowered;
    }

    public String getBinding() {
        return binding;
    }

    public LoweredNode getLowered() {
        return lowered;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLowered(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LoweredStatement that = (LoweredStatement) o;
        return Objects.equals(binding, that.binding) && lowered.equals(that.lowered);
    }

    @Override
    public int hashCode() {
        return Objects.hash(binding, lowered);
    }

    @Override
    public String toString() {
        return "LoweredStatement{" + (binding != null ? "binding='" + binding + "', " : "") + "lowered=" + lowered + "}";
    }
}
