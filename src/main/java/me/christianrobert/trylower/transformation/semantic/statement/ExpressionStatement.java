package me.christianrobert.trylower.transformation.semantic.statement;

import me.christianrobert.trylower.transformation.semantic.element.HostExpression;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

/**
 * A statement evaluating a single host expression, optionally binding its value to a name.
 *
 * <p>The host parser sets the {@code fallible} marker on call sites its type system reports as
 * result-producing. Inside a try scope such a statement becomes a link of the dispatch chain;
 * everywhere else it is ordinary host code.
 *
 * <pre>
 * let config = load_config()?   -- fallible, binding "config"
 * log("starting")               -- plain, no binding
 * </pre>
 */
public class ExpressionStatement extends Statement {

    private final String binding;  // Optional, null if the value is not named
    private final HostExpression expression;
    private final boolean fallible;

    public ExpressionStatement(String binding, HostExpression expression, boolean fallible, SourceLocation location) {
        super(location);
        if (expression == null) {
            throw new IllegalArgumentException("Expression cannot be null");
        }
        if (binding != null && binding.trim().isEmpty()) {
            throw new IllegalArgumentException("Binding name cannot be empty");
        }
        this.binding = binding;
        this.expression = expression;
        this.fallible = fallible;
    }

    public static ExpressionStatement plain(String binding, HostExpression expression) {
        return new ExpressionStatement(binding, expression, false, expression.getLocation());
    }

    public static ExpressionStatement fallible(String binding, HostExpression expression) {
        return new ExpressionStatement(binding, expression, true, expression.getLocation());
    }

    public String getBinding() {
        return binding;
    }

    public boolean hasBinding() {
        return binding != null;
    }

    public HostExpression getExpression() {
        return expression;
    }

    public boolean isFallible() {
        return fallible;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpression(this);
    }

    @Override
    public String toString() {
        return "ExpressionStatement{" +
                (binding != null ? "binding='" + binding + "', " : "") +
                "expression=" + expression +
                (fallible ? ", fallible" : "") + "}";
    }
}
