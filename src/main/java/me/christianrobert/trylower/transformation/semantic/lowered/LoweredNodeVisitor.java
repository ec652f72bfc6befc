package me.christianrobert.trylower.transformation.semantic.lowered;

/**
 * Visitor over lowered node kinds.
 *
 * @param <R> Result type of the visit
 */
public interface LoweredNodeVisitor<R> {

    R visitLet(LetNode node);

    R visitValue(ValueNode node);

    R visitMatch(MatchNode node);

    R visitBranch(BranchNode node);

    R visitReturnError(ReturnErrorNode node);

    R visitFail(FailNode node);

    R visitResultBlock(ResultBlockNode node);

    R visitErrorPlaceholder(ErrorPlaceholderNode node);
}
