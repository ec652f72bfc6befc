package me.christianrobert.trylower.transformation.util;

import me.christianrobert.trylower.transformation.semantic.lowered.BranchNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ErrorPlaceholderNode;
import me.christianrobert.trylower.transformation.semantic.lowered.FailNode;
import me.christianrobert.trylower.transformation.semantic.lowered.LetNode;
import me.christianrobert.trylower.transformation.semantic.lowered.LoweredNode;
import me.christianrobert.trylower.transformation.semantic.lowered.LoweredNodeVisitor;
import me.christianrobert.trylower.transformation.semantic.lowered.MatchNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ResultBlockNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ReturnErrorNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ValueNode;
import me.christianrobert.trylower.transformation.semantic.statement.Block;
import me.christianrobert.trylower.transformation.semantic.statement.LoweredStatement;
import me.christianrobert.trylower.transformation.semantic.statement.Statement;

/**
 * Formats lowered trees into human-readable, indented text.
 *
 * <p>Useful for debugging and for seeing how a construct was desugared.</p>
 *
 * <p>Example output:</p>
 * <pre>
 * match some_operation()
 *   Ok($t0) =&gt;
 *     $t0
 *   Err(e: ErrorB) =&gt;
 *     return Err(ErrorA::new("something went wrong"))
 * </pre>
 */
public class LoweredTreeFormatter {

    private static final String INDENT = "  ";
    private static final int MAX_TEXT_LENGTH = 60;

    /**
     * Formats a lowered tree into human-readable text.
     *
     * @param node Root of the lowered tree
     * @return Formatted string representation
     */
    public static String format(LoweredNode node) {
        if (node == null) {
            return "(null tree)";
        }
        StringBuilder sb = new StringBuilder();
        node.accept(new Printer(sb, 0));
        return sb.toString();
    }

    /**
     * Formats every lowered statement of a rewritten function body, one tree per statement.
     * Statements that were not lowered are listed by their location only.
     */
    public static String format(Block body) {
        if (body == null) {
            return "(null tree)";
        }
        StringBuilder sb = new StringBuilder();
        for (Statement statement : body.getStatements()) {
            if (statement instanceof LoweredStatement) {
                LoweredStatement lowered = (LoweredStatement) statement;
                sb.append("lowered @ ").append(statement.getLocation());
                if (lowered.getBinding() != null) {
                    sb.append(" -> ").append(lowered.getBinding());
                }
                sb.append("\n");
                lowered.getLowered().accept(new Printer(sb, 1));
            } else {
                sb.append(statement.getClass().getSimpleName()).append(" @ ").append(statement.getLocation()).append("\n");
            }
        }
        return sb.toString();
    }

    private static class Printer implements LoweredNodeVisitor<Void> {

        private final StringBuilder sb;
        private final int depth;

        Printer(StringBuilder sb, int depth) {
            this.sb = sb;
            this.depth = depth;
        }

        private Printer deeper() {
            return new Printer(sb, depth + 1);
        }

        private void line(String text) {
            for (int i = 0; i < depth; i++) {
                sb.append(INDENT);
            }
            sb.append(text).append("\n");
        }

        @Override
        public Void visitLet(LetNode node) {
            line("let " + node.getName() + " =");
            node.getValue().accept(deeper());
            line("in");
            node.getBody().accept(deeper());
            return null;
        }

        @Override
        public Void visitValue(ValueNode node) {
            line(truncate(node.toString()));
            return null;
        }

        @Override
        public Void visitMatch(MatchNode node) {
            line("match");
            node.getScrutinee().accept(deeper());
            line(INDENT + "Ok(" + node.getOkName() + ") =>");
            node.getOnOk().accept(new Printer(sb, depth + 2));
            line(INDENT + "Err(" + node.getErrName() + ": " + node.getErrorType() + ") =>");
            node.getOnErr().accept(new Printer(sb, depth + 2));
            return null;
        }

        @Override
        public Void visitBranch(BranchNode node) {
            line("if " + truncate(node.getCondition().getText()));
            node.getThenNode().accept(deeper());
            line("else");
            node.getElseNode().accept(deeper());
            return null;
        }

        @Override
        public Void visitReturnError(ReturnErrorNode node) {
            line("return Err(" + truncate(node.getPayload().getText()) + ")");
            return null;
        }

        @Override
        public Void visitFail(FailNode node) {
            line("fail Err(" + truncate(node.getPayload().getText()) + ")");
            return null;
        }

        @Override
        public Void visitResultBlock(ResultBlockNode node) {
            line("result<" + node.getOkType() + ", " + node.getErrorType() + ">");
            node.getBody().accept(deeper());
            return null;
        }

        @Override
        public Void visitErrorPlaceholder(ErrorPlaceholderNode node) {
            line("<error " + String.join(", ", node.getDiagnosticCodes()) + ">");
            return null;
        }
    }

    /**
     * Escapes and truncates text for display.
     */
    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        text = text.replace("\n", "\\n")
                   .replace("\r", "\\r")
                   .replace("\t", "\\t");
        if (text.length() > MAX_TEXT_LENGTH) {
            text = text.substring(0, MAX_TEXT_LENGTH) + "...";
        }
        return text;
    }
}
