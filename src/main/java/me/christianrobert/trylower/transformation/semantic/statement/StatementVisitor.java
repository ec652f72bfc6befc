package me.christianrobert.trylower.transformation.semantic.statement;

/**
 * Visitor over the closed set of statement kinds.
 *
 * @param <R> Result type of the visit
 */
public interface StatementVisitor<R> {

    R visitExpression(ExpressionStatement statement);

    R visitThrow(ThrowStatement statement);

    R visitBlock(BlockStatement statement);

    R visitConditional(ConditionalStatement statement);

    R visitTryCatch(TryCatchStatement statement);

    R visitLowered(LoweredStatement statement);
}
