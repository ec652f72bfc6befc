package me.christianrobert.trylower.transformation.analysis;

import me.christianrobert.trylower.transformation.semantic.statement.Block;
import me.christianrobert.trylower.transformation.semantic.statement.BlockStatement;
import me.christianrobert.trylower.transformation.semantic.statement.CatchClause;
import me.christianrobert.trylower.transformation.semantic.statement.ConditionalStatement;
import me.christianrobert.trylower.transformation.semantic.statement.ExpressionStatement;
import me.christianrobert.trylower.transformation.semantic.statement.LoweredStatement;
import me.christianrobert.trylower.transformation.semantic.statement.Statement;
import me.christianrobert.trylower.transformation.semantic.statement.StatementVisitor;
import me.christianrobert.trylower.transformation.semantic.statement.ThrowStatement;
import me.christianrobert.trylower.transformation.semantic.statement.TryCatchStatement;

/**
 * Structural queries about throw scopes.
 *
 * <p>A catch clause body is a throw scope, including the ordinary blocks nested in it. A nested
 * construct in a catch body propagates its own handlers' throws outward, so they count for the
 * enclosing body too. A nested construct's try scope never does: whatever fails there is caught
 * by the nested construct itself.
 */
public final class ThrowScopes {

    private ThrowScopes() {
    }

    /**
     * @return true if any handler of the construct can end in a {@code throw}
     */
    public static boolean canThrow(TryCatchStatement construct) {
        for (CatchClause clause : construct.getCatchClauses()) {
            if (blockCanThrow(clause.getBody())) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if the block contains a reachable {@code throw} in its own throw scope
     */
    public static boolean blockCanThrow(Block block) {
        for (Statement statement : block.getStatements()) {
            if (statement.accept(CAN_THROW)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether a compound statement inside a try scope hides something that can fail:
     * a fallible expression statement or a nested construct whose handlers throw.
     */
    public static boolean containsFailurePoint(Statement statement) {
        return statement.accept(FAILURE_POINT);
    }

    private static final StatementVisitor<Boolean> CAN_THROW = new StatementVisitor<>() {
        @Override
        public Boolean visitExpression(ExpressionStatement statement) {
            return false;
        }

        @Override
        public Boolean visitThrow(ThrowStatement statement) {
            return true;
        }

        @Override
        public Boolean visitBlock(BlockStatement statement) {
            return blockCanThrow(statement.getBlock());
        }

        @Override
        public Boolean visitConditional(ConditionalStatement statement) {
            return blockCanThrow(statement.getThenBlock())
                    || (statement.hasElseBlock() && blockCanThrow(statement.getElseBlock()));
        }

        @Override
        public Boolean visitTryCatch(TryCatchStatement statement) {
            return canThrow(statement);
        }

        @Override
        public Boolean visitLowered(LoweredStatement statement) {
            return false;
        }
    };

    private static final StatementVisitor<Boolean> FAILURE_POINT = new StatementVisitor<>() {
        @Override
        public Boolean visitExpression(ExpressionStatement statement) {
            return statement.isFallible();
        }

        @Override
        public Boolean visitThrow(ThrowStatement statement) {
            return false;
        }

        @Override
        public Boolean visitBlock(BlockStatement statement) {
            return anyFailurePoint(statement.getBlock());
        }

        @Override
        public Boolean visitConditional(ConditionalStatement statement) {
            return anyFailurePoint(statement.getThenBlock())
                    || (statement.hasElseBlock() && anyFailurePoint(statement.getElseBlock()));
        }

        @Override
        public Boolean visitTryCatch(TryCatchStatement statement) {
            return canThrow(statement);
        }

        @Override
        public Boolean visitLowered(LoweredStatement statement) {
            return false;
        }
    };

    private static boolean anyFailurePoint(Block block) {
        for (Statement statement : block.getStatements()) {
            if (statement.accept(FAILURE_POINT)) {
                return true;
            }
        }
        return false;
    }
}
