package me.christianrobert.trylower.transformation.desugar;

import me.christianrobert.trylower.transformation.analysis.AnnotatedTryBlock;
import me.christianrobert.trylower.transformation.analysis.ErrorFlowAnalyzer;
import me.christianrobert.trylower.transformation.analysis.ExhaustivenessChecker;
import me.christianrobert.trylower.transformation.analysis.HandlerTable;
import me.christianrobert.trylower.transformation.analysis.HandlerTableBuilder;
import me.christianrobert.trylower.transformation.analysis.ScopeTypeValidator;
import me.christianrobert.trylower.transformation.analysis.ThrowScopes;
import me.christianrobert.trylower.transformation.context.TransformationContext;
import me.christianrobert.trylower.transformation.diagnostic.Diagnostic;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCollector;
import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.lowered.ErrorPlaceholderNode;
import me.christianrobert.trylower.transformation.semantic.lowered.LoweredNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ResultBlockNode;
import me.christianrobert.trylower.transformation.semantic.statement.Block;
import me.christianrobert.trylower.transformation.semantic.statement.BlockStatement;
import me.christianrobert.trylower.transformation.semantic.statement.CatchClause;
import me.christianrobert.trylower.transformation.semantic.statement.ConditionalStatement;
import me.christianrobert.trylower.transformation.semantic.statement.Statement;
import me.christianrobert.trylower.transformation.semantic.statement.TryCatchStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs the full pipeline for one construct, innermost constructs first.
 *
 * <p>Pipeline per construct:
 * <pre>
 * nested constructs (recursively) → error-flow analysis → handler table
 *     → exhaustiveness → scope &amp; type validation → chain desugaring
 * </pre>
 *
 * <p>Every stage runs even after a fatal diagnostic, so one run reports as much as possible.
 * A construct with any fatal diagnostic is replaced by an {@link ErrorPlaceholderNode}; the
 * enclosing construct still proceeds with the placeholder in place.
 *
 * <p>Handler tables and annotations are allocated per construct and discarded afterwards.
 */
public class ConstructLowering {

    private static final Logger log = LoggerFactory.getLogger(ConstructLowering.class);

    private final TransformationContext context;
    private final DiagnosticCollector functionDiagnostics;

    public ConstructLowering(TransformationContext context, DiagnosticCollector functionDiagnostics) {
        if (context == null || functionDiagnostics == null) {
            throw new IllegalArgumentException("Context and diagnostics cannot be null");
        }
        this.context = context;
        this.functionDiagnostics = functionDiagnostics;
    }

    /**
     * Lowers a construct whose throws leave through {@code destination}.
     *
     * @return The lowered expression (unwrapped), or a placeholder on fatal diagnostics
     */
    public LoweredNode lower(TryCatchStatement construct, ThrowDestination destination) {
        log.debug("Lowering construct at {} with {} catch clauses",
                construct.getLocation(), construct.getCatchClauses().size());

        // STEP 1: Nested constructs, bottom-up
        Map<TryCatchStatement, LoweredNode> nested = new IdentityHashMap<>();
        for (Statement statement : construct.getTryBlock().getStatements()) {
            if (statement instanceof TryCatchStatement) {
                lowerTryScopeOperand((TryCatchStatement) statement, destination, nested);
            } else {
                collectNested(statement, destination, nested);
            }
        }
        for (CatchClause clause : construct.getCatchClauses()) {
            collectNested(clause.getBody(), destination, nested);
        }

        // STEP 2: Analysis of this construct
        DiagnosticCollector local = context.newCollector();
        AnnotatedTryBlock annotated = new ErrorFlowAnalyzer(context, local).analyze(construct.getTryBlock());
        HandlerTable table = new HandlerTableBuilder(local).build(construct.getCatchClauses());
        new ExhaustivenessChecker(local).check(annotated, table, construct.getLocation());
        new ScopeTypeValidator(context, local).validateConstruct(construct, destination.getErrorType());
        functionDiagnostics.addAll(local);

        if (local.hasErrors()) {
            List<String> codes = local.getErrors().stream()
                    .map(Diagnostic::getDisplayCode)
                    .collect(Collectors.toList());
            log.warn("Construct at {} not lowered: {}", construct.getLocation(), codes);
            return new ErrorPlaceholderNode(construct.getLocation(), codes);
        }

        // STEP 3: Desugar
        return new ChainDesugarer(context, nested).desugar(construct, annotated, table, destination);
    }

    /**
     * A throwing operand gets a result block of its own; its throws end that block with the
     * operand's error type. An operand that cannot throw keeps the enclosing destination.
     */
    private void lowerTryScopeOperand(TryCatchStatement operand, ThrowDestination enclosing,
                                      Map<TryCatchStatement, LoweredNode> nested) {
        if (!ThrowScopes.canThrow(operand)) {
            nested.put(operand, lower(operand, enclosing));
            return;
        }
        ErrorType resultErrorType = context.operandErrorType(operand);
        LoweredNode body = lower(operand, ThrowDestination.enclosingResult(resultErrorType));
        if (body instanceof ErrorPlaceholderNode) {
            nested.put(operand, body);
            return;
        }
        nested.put(operand, new ResultBlockNode(body, operand.getTryBlock().getSuccessType(), resultErrorType));
    }

    private void collectNested(Block block, ThrowDestination destination, Map<TryCatchStatement, LoweredNode> nested) {
        for (Statement statement : block.getStatements()) {
            collectNested(statement, destination, nested);
        }
    }

    private void collectNested(Statement statement, ThrowDestination destination,
                               Map<TryCatchStatement, LoweredNode> nested) {
        if (statement instanceof TryCatchStatement) {
            nested.put((TryCatchStatement) statement, lower((TryCatchStatement) statement, destination));
        } else if (statement instanceof BlockStatement) {
            collectNested(((BlockStatement) statement).getBlock(), destination, nested);
        } else if (statement instanceof ConditionalStatement) {
            ConditionalStatement conditional = (ConditionalStatement) statement;
            collectNested(conditional.getThenBlock(), destination, nested);
            if (conditional.hasElseBlock()) {
                collectNested(conditional.getElseBlock(), destination, nested);
            }
        }
    }
}
