package me.christianrobert.trylower.transformation.desugar;

import me.christianrobert.trylower.transformation.context.LoweringOptions;
import me.christianrobert.trylower.transformation.context.TransformationContext;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCode;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCollector;
import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.HostExpression;
import me.christianrobert.trylower.transformation.semantic.lowered.ErrorPlaceholderNode;
import me.christianrobert.trylower.transformation.semantic.lowered.FailNode;
import me.christianrobert.trylower.transformation.semantic.lowered.LetNode;
import me.christianrobert.trylower.transformation.semantic.lowered.LoweredNode;
import me.christianrobert.trylower.transformation.semantic.lowered.MatchNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ResultBlockNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ReturnErrorNode;
import me.christianrobert.trylower.transformation.semantic.lowered.ValueNode;
import me.christianrobert.trylower.transformation.semantic.statement.TryCatchStatement;
import me.christianrobert.trylower.transformation.type.SimpleTypeOracle;
import me.christianrobert.trylower.transformation.util.LoweredTreeFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static me.christianrobert.trylower.transformation.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for nested constructs and per-construct failure handling.
 */
class ConstructLoweringTest {

    private static final ErrorType LOCAL = ErrorType.of("Local");

    private HostExpression open;
    private HostExpression parse;
    private HostExpression use;
    private HostExpression localError;
    private HostExpression outerError;
    private HostExpression fallback;
    private DiagnosticCollector diagnostics;
    private ConstructLowering lowering;

    @BeforeEach
    void setUp() {
        open = expr("open()", 3);
        parse = expr("parse()", 8);
        use = expr("use(v)", 6);
        localError = expr("Local::new()", 5);
        outerError = expr("ErrorA::new()", 9);
        fallback = expr("fallback", 7);

        SimpleTypeOracle oracle = SimpleTypeOracle.builder()
                .fallible(open, R, ERROR_B)
                .fallible(parse, R, ERROR_C)
                .value(use, R)
                .value(localError, LOCAL)
                .value(outerError, ERROR_A)
                .value(fallback, R)
                .build();
        diagnostics = new DiagnosticCollector();
        lowering = new ConstructLowering(
                new TransformationContext("f", resultOf(R, ERROR_A), oracle, LoweringOptions.defaults()), diagnostics);
    }

    private TryCatchStatement throwingInner() {
        return tryCatchAs("v", LOCAL, 2, R, List.of(call(null, open)),
                catching(ERROR_B, "b", 4, raise(localError)));
    }

    @Test
    void throwingConstructInTryScopeBecomesResultBlock() {
        TryCatchStatement outer = tryCatch(1, R, List.of(throwingInner(), value(use)),
                catching(LOCAL, "l", 7, value(fallback)));

        LoweredNode lowered = lowering.lower(outer, ThrowDestination.functionReturn(ERROR_A));

        LoweredNode inner = new ResultBlockNode(
                new MatchNode(ValueNode.of(open), "$t0", ValueNode.reference("$t0"),
                        ERROR_B, "b", new FailNode(localError, LOCAL)),
                R, LOCAL);
        LoweredNode expected = new MatchNode(inner, "v",
                new LetNode("$t1", ValueNode.of(use), ValueNode.reference("$t1")),
                LOCAL, "l", ValueNode.of(fallback));
        assertEquals(expected, lowered);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void innerThrowIsCaughtByOuterHandler() {
        TryCatchStatement outer = tryCatch(1, R, List.of(throwingInner(), value(use)),
                catching(LOCAL, "l", 7, value(fallback)));
        LoweredTreeInterpreter interpreter = new LoweredTreeInterpreter(Set.of("open()"), Set.of());

        LoweredTreeInterpreter.Outcome outcome = interpreter.run(lowering.lower(outer, ThrowDestination.functionReturn(ERROR_A)));

        assertEquals(LoweredTreeInterpreter.Kind.VALUE, outcome.kind);
        assertEquals("fallback", outcome.value);
        assertFalse(interpreter.getEvaluated().contains("use(v)"));
    }

    @Test
    void constructInHandlerInheritsThrowDestination() {
        TryCatchStatement inner = tryCatch(8, R, List.of(call(null, parse)),
                catching(ERROR_C, "c", 9, raise(outerError)));
        TryCatchStatement outer = tryCatch(1, R, List.of(call(null, open)),
                catching(ERROR_B, "b", 7, inner));

        MatchNode lowered = (MatchNode) lowering.lower(outer, ThrowDestination.functionReturn(ERROR_A));

        MatchNode handler = (MatchNode) lowered.getOnErr();
        assertEquals(new ReturnErrorNode(outerError, ERROR_A), handler.getOnErr());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void nonThrowingConstructInTryScopeIsPlain() {
        TryCatchStatement inner = tryCatchAs("v", null, 2, R, List.of(call(null, open)),
                catching(ERROR_B, "b", 4, value(fallback)));
        TryCatchStatement outer = tryCatch(1, R, List.of(inner, value(use)));

        LoweredNode lowered = lowering.lower(outer, ThrowDestination.functionReturn(ERROR_A));

        LetNode let = assertInstanceOf(LetNode.class, lowered);
        assertEquals("v", let.getName());
        assertInstanceOf(MatchNode.class, let.getValue());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void failedInnerConstructLeavesPlaceholderAndOuterProceeds() {
        // Inner scope produces ErrorC but only handles ErrorB
        TryCatchStatement inner = tryCatch(8, R, List.of(call(null, parse)),
                catching(ERROR_B, "b", 9, value(fallback)));
        TryCatchStatement outer = tryCatch(1, R, List.of(call(null, open)),
                catching(ERROR_B, "b", 7, inner));

        MatchNode lowered = (MatchNode) lowering.lower(outer, ThrowDestination.functionReturn(ERROR_A));

        ErrorPlaceholderNode placeholder = assertInstanceOf(ErrorPlaceholderNode.class, lowered.getOnErr());
        assertTrue(placeholder.getDiagnosticCodes().contains("E-MISSING-HANDLER(ErrorC)"));
        assertEquals(at(8), placeholder.getLocation());
        assertEquals(DiagnosticCode.MISSING_HANDLER, diagnostics.getErrors().get(0).getCode());
        assertEquals(1, diagnostics.getErrors().size());
    }

    @Test
    void allStagesReportBeforeGivingUp() {
        TryCatchStatement construct = tryCatch(1, R, List.of(call(null, open), call(null, parse)),
                catching(ERROR_B, "b", 7, value(fallback)),
                catching(ERROR_B, "again", 8, value(fallback)),
                catching(ERROR_D, "d", 9, raise(localError)));

        LoweredNode lowered = lowering.lower(construct, ThrowDestination.functionReturn(ERROR_A));

        assertInstanceOf(ErrorPlaceholderNode.class, lowered);
        List<DiagnosticCode> codes = diagnostics.getDiagnostics().stream().map(d -> d.getCode()).toList();
        assertTrue(codes.contains(DiagnosticCode.DUPLICATE_HANDLER));
        assertTrue(codes.contains(DiagnosticCode.MISSING_HANDLER));
        assertTrue(codes.contains(DiagnosticCode.UNREACHABLE_HANDLER));
        assertTrue(codes.contains(DiagnosticCode.THROW_TYPE_MISMATCH));
    }

    // ========== Error type overrides ==========

    @Test
    void overrideDoesNotChangeFunctionReturnType() {
        TryCatchStatement construct = tryCatchAs(null, LOCAL, 1, R, List.of(call(null, open)),
                catching(ERROR_B, "b", 4, raise(localError)));

        LoweredNode lowered = lowering.lower(construct, ThrowDestination.functionReturn(ERROR_A));

        ErrorPlaceholderNode placeholder = assertInstanceOf(ErrorPlaceholderNode.class, lowered);
        assertEquals(List.of("E-INVALID-ERROR-TYPE-OVERRIDE(ErrorA, Local)", "E-THROW-TYPE-MISMATCH(ErrorA, Local)"),
                placeholder.getDiagnosticCodes());
        assertEquals(2, diagnostics.getErrors().size());
    }

    @Test
    void overrideMatchingFunctionErrorTypeReturnsFunctionError() {
        TryCatchStatement construct = tryCatchAs(null, ERROR_A, 1, R, List.of(call(null, open)),
                catching(ERROR_B, "b", 4, raise(outerError)));

        MatchNode lowered = (MatchNode) lowering.lower(construct, ThrowDestination.functionReturn(ERROR_A));

        assertEquals(new ReturnErrorNode(outerError, ERROR_A), lowered.getOnErr());
        assertTrue(diagnostics.isEmpty());
    }

    private TryCatchStatement operandRethrowingFromNestedHandler(HostExpression payload) {
        TryCatchStatement rethrowing = tryCatch(8, R, List.of(call(null, parse)),
                catching(ERROR_C, "c", 9, raise(payload)));
        TryCatchStatement operand = tryCatchAs("v", LOCAL, 2, R, List.of(call(null, open)),
                catching(ERROR_B, "b", 4, rethrowing));
        return tryCatch(1, R, List.of(operand, value(use)),
                catching(LOCAL, "l", 7, value(fallback)));
    }

    @Test
    void constructInOperandHandlerThrowsOperandErrorType() {
        MatchNode lowered = (MatchNode) lowering.lower(operandRethrowingFromNestedHandler(localError),
                ThrowDestination.functionReturn(ERROR_A));

        assertTrue(diagnostics.isEmpty(), () -> "unexpected diagnostics " + diagnostics.getDiagnostics());
        ResultBlockNode operand = assertInstanceOf(ResultBlockNode.class, lowered.getScrutinee());
        assertEquals(LOCAL, operand.getErrorType());
        MatchNode operandBody = (MatchNode) operand.getBody();
        MatchNode nestedHandler = (MatchNode) operandBody.getOnErr();
        assertEquals(new FailNode(localError, LOCAL), nestedHandler.getOnErr());
    }

    @Test
    void constructInOperandHandlerMayNotThrowFunctionErrorType() {
        MatchNode lowered = (MatchNode) lowering.lower(operandRethrowingFromNestedHandler(outerError),
                ThrowDestination.functionReturn(ERROR_A));

        assertEquals(1, diagnostics.getErrors().size());
        assertEquals("E-THROW-TYPE-MISMATCH(Local, ErrorA)", diagnostics.getErrors().get(0).getDisplayCode());
        ResultBlockNode operand = assertInstanceOf(ResultBlockNode.class, lowered.getScrutinee());
        MatchNode operandBody = (MatchNode) operand.getBody();
        assertInstanceOf(ErrorPlaceholderNode.class, operandBody.getOnErr());
        assertFalse(LoweredTreeFormatter.format(lowered).contains("fail Err(ErrorA::new())"));
    }
}
