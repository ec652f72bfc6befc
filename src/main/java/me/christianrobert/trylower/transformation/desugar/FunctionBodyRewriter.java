package me.christianrobert.trylower.transformation.desugar;

import me.christianrobert.trylower.transformation.analysis.ScopeTypeValidator;
import me.christianrobert.trylower.transformation.context.TransformationContext;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCollector;
import me.christianrobert.trylower.transformation.semantic.lowered.LoweredNode;
import me.christianrobert.trylower.transformation.semantic.statement.Block;
import me.christianrobert.trylower.transformation.semantic.statement.BlockStatement;
import me.christianrobert.trylower.transformation.semantic.statement.ConditionalStatement;
import me.christianrobert.trylower.transformation.semantic.statement.ExpressionStatement;
import me.christianrobert.trylower.transformation.semantic.statement.LoweredStatement;
import me.christianrobert.trylower.transformation.semantic.statement.Statement;
import me.christianrobert.trylower.transformation.semantic.statement.StatementVisitor;
import me.christianrobert.trylower.transformation.semantic.statement.ThrowStatement;
import me.christianrobert.trylower.transformation.semantic.statement.TryCatchStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces every top-level construct of a function body with its lowered form, in place.
 *
 * <p>Constructs are found in the body itself and in ordinary blocks and conditionals nested in
 * it; constructs nested inside other constructs are handled by {@link ConstructLowering}. All
 * other statements are kept as they are, so the rest of the compiler sees the same body with
 * only the try/catch syntax gone. Statements that are already lowered pass through unchanged.
 */
public class FunctionBodyRewriter {

    private static final Logger log = LoggerFactory.getLogger(FunctionBodyRewriter.class);

    private final TransformationContext context;
    private final DiagnosticCollector diagnostics;
    private final ConstructLowering constructLowering;
    private final ThrowDestination functionReturn;

    public FunctionBodyRewriter(TransformationContext context, DiagnosticCollector diagnostics) {
        if (context == null || diagnostics == null) {
            throw new IllegalArgumentException("Context and diagnostics cannot be null");
        }
        this.context = context;
        this.diagnostics = diagnostics;
        this.constructLowering = new ConstructLowering(context, diagnostics);
        this.functionReturn = ThrowDestination.functionReturn(context.getFunctionContext().getOuterErrorType());
    }

    public Block rewrite(Block body) {
        new ScopeTypeValidator(context, diagnostics).validateOutsideConstructs(body);
        Block rewritten = rewriteBlock(body);
        log.debug("Rewrote function body with {} top-level statements", rewritten.getStatements().size());
        return rewritten;
    }

    private Block rewriteBlock(Block block) {
        List<Statement> statements = new ArrayList<>(block.getStatements().size());
        for (Statement statement : block.getStatements()) {
            statements.add(statement.accept(rewriter));
        }
        return new Block(statements, block.getLocation());
    }

    private final StatementVisitor<Statement> rewriter = new StatementVisitor<>() {
        @Override
        public Statement visitExpression(ExpressionStatement statement) {
            return statement;
        }

        @Override
        public Statement visitThrow(ThrowStatement statement) {
            return statement;
        }

        @Override
        public Statement visitBlock(BlockStatement statement) {
            return new BlockStatement(statement.getBinding(), rewriteBlock(statement.getBlock()), statement.getLocation());
        }

        @Override
        public Statement visitConditional(ConditionalStatement statement) {
            Block elseBlock = statement.hasElseBlock() ? rewriteBlock(statement.getElseBlock()) : null;
            return new ConditionalStatement(statement.getBinding(), statement.getCondition(),
                    rewriteBlock(statement.getThenBlock()), elseBlock, statement.getLocation());
        }

        @Override
        public Statement visitTryCatch(TryCatchStatement statement) {
            LoweredNode lowered = constructLowering.lower(statement, functionReturn);
            return new LoweredStatement(statement.getBinding(), lowered, statement.getLocation());
        }

        @Override
        public Statement visitLowered(LoweredStatement statement) {
            return statement;
        }
    };
}
