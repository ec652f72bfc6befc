package me.christianrobert.trylower.transformation.desugar;

import me.christianrobert.trylower.transformation.analysis.AnnotatedTryBlock;
import me.christianrobert.trylower.transformation.analysis.ErrorFlowAnalyzer;
import me.christianrobert.trylower.transformation.analysis.HandlerTable;
import me.christianrobert.trylower.transformation.analysis.HandlerTableBuilder;
import me.christianrobert.trylower.transformation.context.LoweringOptions;
import me.christianrobert.trylower.transformation.context.TransformationContext;
import me.christianrobert.trylower.transformation.context.TransformationException;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCollector;
import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.HostExpression;
import me.christianrobert.trylower.transformation.semantic.lowered.BranchNode;
import me.christianrobert.trylower.transformation.semantic.lowered.FailNode;
import me.christianrobert.trylower.transformation.semantic.lowered.LetNode;
import me.christianrobert.trylower.transformation.semantic.lowered.LoweredNode;
import me.christianrobert.trylower.transformation.semantic.lowered.MatchNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ReturnErrorNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ValueNode;
import me.christianrobert.trylower.transformation.semantic.statement.TryCatchStatement;
import me.christianrobert.trylower.transformation.type.SimpleTypeOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static me.christianrobert.trylower.transformation.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the chain construction itself, on constructs without nesting.
 */
class ChainDesugarerTest {

    private HostExpression open;
    private HostExpression parse;
    private HostExpression finish;
    private HostExpression fallbackB;
    private HostExpression fallbackC;
    private HostExpression wrapB;
    private TransformationContext context;

    @BeforeEach
    void setUp() {
        open = expr("open()", 2);
        parse = expr("parse(a)", 3);
        finish = expr("finish(b)", 4);
        fallbackB = expr("fallback_b", 6);
        fallbackC = expr("fallback_c", 8);
        wrapB = expr("ErrorA::from(e)", 6);

        SimpleTypeOracle oracle = SimpleTypeOracle.builder()
                .fallible(open, R, ERROR_B)
                .fallible(parse, R, ERROR_C)
                .value(finish, R)
                .value(fallbackB, R)
                .value(fallbackC, R)
                .value(wrapB, ERROR_A)
                .build();
        context = new TransformationContext("f", resultOf(R, ERROR_A), oracle, LoweringOptions.defaults());
    }

    private LoweredNode desugar(TryCatchStatement construct, ThrowDestination destination) {
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        AnnotatedTryBlock annotated = new ErrorFlowAnalyzer(context, diagnostics).analyze(construct.getTryBlock());
        HandlerTable table = new HandlerTableBuilder(diagnostics).build(construct.getCatchClauses());
        assertTrue(diagnostics.isEmpty(), () -> "unexpected diagnostics " + diagnostics.getDiagnostics());
        return new ChainDesugarer(context, Map.of()).desugar(construct, annotated, table, destination);
    }

    private TryCatchStatement threeStepConstruct() {
        return tryCatch(1, R, List.of(call("a", open), call("b", parse), value(finish)),
                catching(ERROR_B, "e", 5, value(fallbackB)),
                catching(ERROR_C, "e", 7, value(fallbackC)));
    }

    @Test
    void buildsNestedMatchesInTryScopeOrder() {
        LoweredNode lowered = desugar(threeStepConstruct(), ThrowDestination.functionReturn(ERROR_A));

        LoweredNode expected = new MatchNode(ValueNode.of(open), "a",
                new MatchNode(ValueNode.of(parse), "b",
                        new LetNode("$t0", ValueNode.of(finish), ValueNode.reference("$t0")),
                        ERROR_C, "e", ValueNode.of(fallbackC)),
                ERROR_B, "e", ValueNode.of(fallbackB));
        assertEquals(expected, lowered);
    }

    @Test
    void failureShortCircuitsRemainingStatements() {
        LoweredNode lowered = desugar(threeStepConstruct(), ThrowDestination.functionReturn(ERROR_A));
        LoweredTreeInterpreter interpreter = new LoweredTreeInterpreter(Set.of("parse(a)"), Set.of());

        LoweredTreeInterpreter.Outcome outcome = interpreter.run(lowered);

        assertEquals(LoweredTreeInterpreter.Kind.VALUE, outcome.kind);
        assertEquals("fallback_c", outcome.value);
        assertEquals(List.of("open()", "parse(a)", "fallback_c"), interpreter.getEvaluated());
    }

    @Test
    void allStepsSucceedingYieldsLastValue() {
        LoweredTreeInterpreter interpreter = new LoweredTreeInterpreter(Set.of(), Set.of());

        LoweredTreeInterpreter.Outcome outcome =
                interpreter.run(desugar(threeStepConstruct(), ThrowDestination.functionReturn(ERROR_A)));

        assertEquals("finish(b)", outcome.value);
        assertFalse(interpreter.getEvaluated().contains("fallback_b"));
    }

    @Test
    void throwInHandlerReturnsFromFunction() {
        TryCatchStatement construct = tryCatch(1, R, List.of(call(null, open)),
                catching(ERROR_B, "e", 5, raise(wrapB)));

        LoweredNode lowered = desugar(construct, ThrowDestination.functionReturn(ERROR_A));

        assertEquals(new MatchNode(ValueNode.of(open), "$t0", ValueNode.reference("$t0"),
                ERROR_B, "e", new ReturnErrorNode(wrapB, ERROR_A)), lowered);
        LoweredTreeInterpreter.Outcome outcome =
                new LoweredTreeInterpreter(Set.of("open()"), Set.of()).run(lowered);
        assertEquals(LoweredTreeInterpreter.Kind.RETURN_ERR, outcome.kind);
    }

    @Test
    void throwInHandlerFailsEnclosingResultWithItsErrorType() {
        ErrorType local = ErrorType.of("Local");
        TryCatchStatement construct = tryCatch(1, R, List.of(call(null, open)),
                catching(ERROR_B, "e", 5, raise(wrapB)));

        LoweredNode lowered = desugar(construct, ThrowDestination.enclosingResult(local));

        MatchNode match = (MatchNode) lowered;
        assertEquals(new FailNode(wrapB, local), match.getOnErr());
    }

    @Test
    void statementsAfterThrowInHandlerAreDropped() {
        TryCatchStatement construct = tryCatch(1, R, List.of(call(null, open)),
                catching(ERROR_B, "e", 5, raise(wrapB), value(fallbackB)));

        MatchNode match = (MatchNode) desugar(construct, ThrowDestination.functionReturn(ERROR_A));

        assertEquals(new ReturnErrorNode(wrapB, ERROR_A), match.getOnErr());
    }

    @Test
    void conditionalHandlerBecomesBranch() {
        HostExpression retry = expr("can_retry", 6);
        TryCatchStatement construct = tryCatch(1, R, List.of(call(null, open)),
                catching(ERROR_B, "e", 5, when(retry, block(6, value(fallbackB)), block(6, raise(wrapB)))));

        MatchNode match = (MatchNode) desugar(construct, ThrowDestination.functionReturn(ERROR_A));

        assertEquals(new BranchNode(retry, ValueNode.of(fallbackB), new ReturnErrorNode(wrapB, ERROR_A)),
                match.getOnErr());
        LoweredTreeInterpreter interpreter = new LoweredTreeInterpreter(Set.of("open()"), Set.of("can_retry"));
        assertEquals("fallback_b", interpreter.run(match).value);
    }

    @Test
    void emptyTryScopeEvaluatesToUnit() {
        TryCatchStatement construct = tryCatch(1, R, List.of());

        assertEquals(ValueNode.unit(), desugar(construct, ThrowDestination.functionReturn(ERROR_A)));
    }

    @Test
    void missingNestedLoweringIsAnInternalError() {
        TryCatchStatement inner = tryCatch(3, R, List.of(call(null, parse)),
                catching(ERROR_C, "c", 4, value(fallbackC)));
        TryCatchStatement outer = tryCatch(1, R, List.of(call(null, open)),
                catching(ERROR_B, "e", 5, inner));

        TransformationException e = assertThrows(TransformationException.class,
                () -> desugar(outer, ThrowDestination.functionReturn(ERROR_A)));

        assertEquals("f", e.getFunctionName());
        assertEquals(at(3), e.getLocation());
        assertEquals("main.src:3:1: internal error in f: Nested construct was not lowered before its parent",
                e.getDetailedMessage());
    }
}
