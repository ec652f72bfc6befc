package me.christianrobert.trylower.transformation.semantic.statement;

import me.christianrobert.trylower.transformation.semantic.element.HostExpression;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

/**
 * {@code throw expr;} - wraps a newly constructed error value of the enclosing function's
 * declared error type.
 *
 * <p>Only legal inside a catch clause body, including ordinary blocks nested in it.
 */
public class ThrowStatement extends Statement {

    private final HostExpression payload;

    public ThrowStatement(HostExpression payload, SourceLocation location) {
        super(location);
        if (payload == null) {
            throw new IllegalArgumentException("Throw payload cannot be null");
        }
        this.payload = payload;
    }

    public static ThrowStatement of(HostExpression payload) {
        return new ThrowStatement(payload, payload.getLocation());
    }

    public HostExpression getPayload() {
        return payload;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitThrow(this);
    }

    @Override
    public String toString() {
        return "ThrowStatement{payload=" + payload + "}";
    }
}
