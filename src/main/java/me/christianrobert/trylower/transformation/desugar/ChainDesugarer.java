package me.christianrobert.trylower.transformation.desugar;

import me.christianrobert.trylower.transformation.analysis.AnnotatedStatement;
import me.christianrobert.trylower.transformation.analysis.AnnotatedTryBlock;
import me.christianrobert.trylower.transformation.analysis.HandlerTable;
import me.christianrobert.trylower.transformation.context.TransformationContext;
import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.lowered.BranchNode;
import me.christianrobert.trylower.transformation.semantic.lowered.FailNode;
import me.christianrobert.trylower.transformation.semantic.lowered.LetNode;
import me.christianrobert.trylower.transformation.semantic.lowered.LoweredNode;
import me.christianrobert.trylower.transformation.semantic.lowered.MatchNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ReturnErrorNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ValueNode;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Rewrites a validated construct into a continuation chain.
 *
 * <p>Forward recursion over the annotated try scope {@code S_i..S_n}:
 * <pre>
 * plain S_i        =&gt;  let x_i = S_i in chain(i+1)
 * fallible S_i : E =&gt;  match S_i { Ok(x_i) =&gt; chain(i+1), Err(e) =&gt; handler[E] }
 * chain(n)         =&gt;  x_(n-1)          (unit for an empty try scope)
 * </pre>
 *
 * <p>The handler arm is the value of the whole nested expression, so a failure at {@code S_i}
 * makes the matched handler's result the construct's result and leaves {@code S_(i+1)..S_n}
 * unevaluated. Inside handler bodies a {@code throw} becomes a {@link ReturnErrorNode} or a
 * {@link FailNode} depending on the {@link ThrowDestination}, typed with the destination's error
 * type.
 *
 * <p>Nested constructs are lowered before the enclosing one and handed in through
 * {@code loweredNested}; this class only splices them in.
 */
public class ChainDesugarer {

    private static final Logger log = LoggerFactory.getLogger(ChainDesugarer.class);

    private final TransformationContext context;
    private final Map<TryCatchStatement, LoweredNode> loweredNested;

    /**
     * @param context       Function-level context (fresh names)
     * @param loweredNested Already lowered nested constructs, keyed by identity
     */
    public ChainDesugarer(TransformationContext context, Map<TryCatchStatement, LoweredNode> loweredNested) {
        if (context == null || loweredNested == null) {
            throw new IllegalArgumentException("Context and nested lowering map cannot be null");
        }
        this.context = context;
        this.loweredNested = loweredNested;
    }

    public LoweredNode desugar(TryCatchStatement construct, AnnotatedTryBlock annotated, HandlerTable table,
                               ThrowDestination destination) {
        log.debug("Desugaring construct at {} ({} statements, throws to {})",
                construct.getLocation(), annotated.getStatements().size(), destination);
        return chain(annotated.getStatements(), 0, null, table, new BodyLowering(destination));
    }

    // ========== Try Scope ==========

    private LoweredNode chain(List<AnnotatedStatement> statements, int index, String lastBound,
                              HandlerTable table, BodyLowering lowering) {
        if (index == statements.size()) {
            return lastBound == null ? ValueNode.unit() : ValueNode.reference(lastBound);
        }

        AnnotatedStatement annotated = statements.get(index);
        Statement statement = annotated.getStatement();
        String name = bindingOf(statement);
        LoweredNode value = statement.accept(lowering);

        if (!annotated.isFallible()) {
            return new LetNode(name, value, chain(statements, index + 1, name, table, lowering));
        }

        ErrorType errorType = annotated.getErrorType();
        CatchClause handler = table.get(errorType);
        if (handler == null) {
            throw context.failure(statement.getLocation(), "No handler for " + errorType + " in validated construct");
        }
        LoweredNode onOk = chain(statements, index + 1, name, table, lowering);
        LoweredNode onErr = lowering.block(handler.getBody());
        return new MatchNode(value, name, onOk, errorType, handler.getBinding(), onErr);
    }

    private String bindingOf(Statement statement) {
        String binding = statement.accept(BINDING);
        return binding != null ? binding : context.freshName();
    }

    private static final StatementVisitor<String> BINDING = new StatementVisitor<>() {
        @Override
        public String visitExpression(ExpressionStatement statement) {
            return statement.getBinding();
        }

        @Override
        public String visitThrow(ThrowStatement statement) {
            return null;
        }

        @Override
        public String visitBlock(BlockStatement statement) {
            return statement.getBinding();
        }

        @Override
        public String visitConditional(ConditionalStatement statement) {
            return statement.getBinding();
        }

        @Override
        public String visitTryCatch(TryCatchStatement statement) {
            return statement.getBinding();
        }

        @Override
        public String visitLowered(LoweredStatement statement) {
            return statement.getBinding();
        }
    };

    // ========== Ordinary Blocks and Handler Bodies ==========

    /**
     * Lowers ordinary code: every statement becomes the value it evaluates to.
     */
    private class BodyLowering implements StatementVisitor<LoweredNode> {

        private final ThrowDestination destination;

        BodyLowering(ThrowDestination destination) {
            this.destination = destination;
        }

        LoweredNode block(Block block) {
            return sequence(block.getStatements(), 0);
        }

        private LoweredNode sequence(List<Statement> statements, int index) {
            if (statements.isEmpty()) {
                return ValueNode.unit();
            }
            Statement statement = statements.get(index);
            LoweredNode value = statement.accept(this);
            // Nothing after a throw is reachable
            if (index == statements.size() - 1 || statement instanceof ThrowStatement) {
                return value;
            }
            return new LetNode(bindingOf(statement), value, sequence(statements, index + 1));
        }

        @Override
        public LoweredNode visitExpression(ExpressionStatement statement) {
            return ValueNode.of(statement.getExpression());
        }

        @Override
        public LoweredNode visitThrow(ThrowStatement statement) {
            if (destination.getTarget() == ThrowTarget.ENCLOSING_RESULT) {
                return new FailNode(statement.getPayload(), destination.getErrorType());
            }
            return new ReturnErrorNode(statement.getPayload(), destination.getErrorType());
        }

        @Override
        public LoweredNode visitBlock(BlockStatement statement) {
            return block(statement.getBlock());
        }

        @Override
        public LoweredNode visitConditional(ConditionalStatement statement) {
            LoweredNode thenNode = block(statement.getThenBlock());
            LoweredNode elseNode = statement.hasElseBlock() ? block(statement.getElseBlock()) : ValueNode.unit();
            return new BranchNode(statement.getCondition(), thenNode, elseNode);
        }

        @Override
        public LoweredNode visitTryCatch(TryCatchStatement statement) {
            LoweredNode lowered = loweredNested.get(statement);
            if (lowered == null) {
                throw context.failure(statement.getLocation(), "Nested construct was not lowered before its parent");
            }
            return lowered;
        }

        @Override
        public LoweredNode visitLowered(LoweredStatement statement) {
            return statement.getLowered();
        }
    }
}
