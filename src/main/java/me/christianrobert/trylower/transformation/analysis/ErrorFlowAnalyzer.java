package me.christianrobert.trylower.transformation.analysis;

import me.christianrobert.trylower.transformation.context.TransformationContext;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCode;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCollector;
import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.statement.BlockStatement;
import me.christianrobert.trylower.transformation.semantic.statement.ConditionalStatement;
import me.christianrobert.trylower.transformation.semantic.statement.ExpressionStatement;
import me.christianrobert.trylower.transformation.semantic.statement.LoweredStatement;
import me.christianrobert.trylower.transformation.semantic.statement.Statement;
import me.christianrobert.trylower.transformation.semantic.statement.StatementVisitor;
import me.christianrobert.trylower.transformation.semantic.statement.ThrowStatement;
import me.christianrobert.trylower.transformation.semantic.statement.TryBlock;
import me.christianrobert.trylower.transformation.semantic.statement.TryCatchStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tags every statement of a try scope as plain or fallible.
 *
 * <p>Classification rules:
 * <ul>
 *   <li>Expression statement with the host's fallible marker: fallible with the single static
 *       error type the type oracle reports for the call site. If the oracle has none,
 *       {@code E-UNRESOLVED-ERROR-TYPE} is reported and the construct is abandoned.</li>
 *   <li>Nested construct whose handlers can throw: fallible with the nested construct's
 *       operand error type (declared override, else the function's). A nested construct that cannot throw is plain.</li>
 *   <li>Ordinary block or conditional: plain, unless it hides a failure point, which cannot be
 *       linearized into the dispatch chain ({@code E-UNSUPPORTED-TRY-STATEMENT}).</li>
 *   <li>{@code throw}: plain here; the scope validator reports it.</li>
 * </ul>
 */
public class ErrorFlowAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ErrorFlowAnalyzer.class);

    private final TransformationContext context;
    private final DiagnosticCollector diagnostics;

    public ErrorFlowAnalyzer(TransformationContext context, DiagnosticCollector diagnostics) {
        if (context == null || diagnostics == null) {
            throw new IllegalArgumentException("Context and diagnostics cannot be null");
        }
        this.context = context;
        this.diagnostics = diagnostics;
    }

    public AnnotatedTryBlock analyze(TryBlock tryBlock) {
        if (tryBlock == null) {
            throw new IllegalArgumentException("Try block cannot be null");
        }
        log.debug("Analyzing error flow of try scope at {}", tryBlock.getLocation());

        List<AnnotatedStatement> annotated = new ArrayList<>();
        StatementClassifier classifier = new StatementClassifier();
        for (Statement statement : tryBlock.getStatements()) {
            AnnotatedStatement annotation = statement.accept(classifier);
            log.trace("{} -> {}", statement.getLocation(), annotation);
            annotated.add(annotation);
        }
        return new AnnotatedTryBlock(tryBlock, annotated);
    }

    private class StatementClassifier implements StatementVisitor<AnnotatedStatement> {

        @Override
        public AnnotatedStatement visitExpression(ExpressionStatement statement) {
            if (!statement.isFallible()) {
                return AnnotatedStatement.plain(statement);
            }
            ErrorType errorType = context.getTypeOracle().errorTypeOf(statement.getExpression());
            if (errorType == null) {
                diagnostics.report(DiagnosticCode.UNRESOLVED_ERROR_TYPE, statement.getLocation(),
                        "cannot resolve a static error type for fallible call '"
                                + statement.getExpression().getText() + "'");
                return AnnotatedStatement.unresolved(statement);
            }
            return AnnotatedStatement.fallible(statement, errorType);
        }

        @Override
        public AnnotatedStatement visitThrow(ThrowStatement statement) {
            return AnnotatedStatement.plain(statement);
        }

        @Override
        public AnnotatedStatement visitBlock(BlockStatement statement) {
            return compound(statement);
        }

        @Override
        public AnnotatedStatement visitConditional(ConditionalStatement statement) {
            return compound(statement);
        }

        @Override
        public AnnotatedStatement visitTryCatch(TryCatchStatement statement) {
            if (ThrowScopes.canThrow(statement)) {
                return AnnotatedStatement.fallible(statement, context.operandErrorType(statement));
            }
            return AnnotatedStatement.plain(statement);
        }

        @Override
        public AnnotatedStatement visitLowered(LoweredStatement statement) {
            return AnnotatedStatement.plain(statement);
        }

        private AnnotatedStatement compound(Statement statement) {
            if (ThrowScopes.containsFailurePoint(statement)) {
                diagnostics.report(DiagnosticCode.UNSUPPORTED_TRY_STATEMENT, statement.getLocation(),
                        "fallible statements nested in a block or conditional of a try scope cannot be dispatched;"
                                + " move them to the top level of the try block");
            }
            return AnnotatedStatement.plain(statement);
        }
    }
}
