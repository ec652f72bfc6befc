package me.christianrobert.trylower.transformation.analysis;

import me.christianrobert.trylower.transformation.context.LoweringOptions;
import me.christianrobert.trylower.transformation.context.TransformationContext;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCode;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCollector;
import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.HostExpression;
import me.christianrobert.trylower.transformation.semantic.statement.TryBlock;
import me.christianrobert.trylower.transformation.semantic.statement.TryCatchStatement;
import me.christianrobert.trylower.transformation.type.SimpleTypeOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static me.christianrobert.trylower.transformation.AstFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for per-statement classification of try scopes.
 */
class ErrorFlowAnalyzerTest {

    private HostExpression openFile;
    private HostExpression parse;
    private HostExpression trim;
    private DiagnosticCollector diagnostics;
    private ErrorFlowAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        openFile = expr("open_file()", 2);
        parse = expr("parse(content)", 3);
        trim = expr("trim(content)", 4);

        SimpleTypeOracle oracle = SimpleTypeOracle.builder()
                .fallible(openFile, R, ERROR_B)
                .fallible(parse, R, ERROR_C)
                .value(trim, R)
                .build();

        diagnostics = new DiagnosticCollector();
        analyzer = new ErrorFlowAnalyzer(
                new TransformationContext("f", resultOf(R, ERROR_A), oracle, LoweringOptions.defaults()),
                diagnostics);
    }

    @Test
    void tagsPlainAndFallibleStatements() {
        TryBlock tryBlock = new TryBlock(List.of(call("content", openFile), value(trim), call(null, parse)), R, at(1));

        AnnotatedTryBlock annotated = analyzer.analyze(tryBlock);

        List<AnnotatedStatement> statements = annotated.getStatements();
        assertEquals(3, statements.size());
        assertEquals(AnnotatedStatement.Kind.FALLIBLE, statements.get(0).getKind());
        assertEquals(ERROR_B, statements.get(0).getErrorType());
        assertEquals(AnnotatedStatement.Kind.PLAIN, statements.get(1).getKind());
        assertNull(statements.get(1).getErrorType());
        assertEquals(ERROR_C, statements.get(2).getErrorType());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void producedErrorTypesAreDistinctInFirstOccurrenceOrder() {
        HostExpression reopen = expr("open_file()", 5);
        SimpleTypeOracle oracle = SimpleTypeOracle.builder()
                .fallible(openFile, R, ERROR_B)
                .fallible(parse, R, ERROR_C)
                .fallible(reopen, R, ERROR_B)
                .build();
        analyzer = new ErrorFlowAnalyzer(
                new TransformationContext("f", resultOf(R, ERROR_A), oracle, LoweringOptions.defaults()), diagnostics);

        AnnotatedTryBlock annotated = analyzer.analyze(
                new TryBlock(List.of(call(null, openFile), call(null, parse), call(null, reopen)), R, at(1)));

        assertEquals(List.of(ERROR_B, ERROR_C), List.copyOf(annotated.getProducedErrorTypes()));
    }

    @Test
    void unresolvedErrorTypeIsReported() {
        HostExpression mystery = expr("mystery()", 7);

        AnnotatedTryBlock annotated = analyzer.analyze(new TryBlock(List.of(call(null, mystery)), R, at(1)));

        assertEquals(AnnotatedStatement.Kind.UNRESOLVED, annotated.getStatements().get(0).getKind());
        assertEquals(1, diagnostics.getErrors().size());
        assertEquals(DiagnosticCode.UNRESOLVED_ERROR_TYPE, diagnostics.getErrors().get(0).getCode());
        assertEquals(at(7), diagnostics.getErrors().get(0).getLocation());
        assertTrue(annotated.getProducedErrorTypes().isEmpty());
    }

    @Test
    void nestedConstructThatThrowsIsFallibleWithItsDeclaredErrorType() {
        ErrorType inner = ErrorType.of("InnerError");
        TryCatchStatement nested = tryCatchAs("v", inner, 10, R,
                List.of(call(null, openFile)),
                catching(ERROR_B, "b", 11, raise(expr("InnerError::new()", 12))));

        AnnotatedTryBlock annotated = analyzer.analyze(new TryBlock(List.of(nested), R, at(9)));

        assertTrue(annotated.getStatements().get(0).isFallible());
        assertEquals(Set.of(inner), annotated.getProducedErrorTypes());
    }

    @Test
    void nestedConstructWithoutThrowsIsPlain() {
        TryCatchStatement nested = tryCatch(10, R,
                List.of(call(null, openFile)),
                catching(ERROR_B, "b", 11, value(trim)));

        AnnotatedTryBlock annotated = analyzer.analyze(new TryBlock(List.of(nested), R, at(9)));

        assertEquals(AnnotatedStatement.Kind.PLAIN, annotated.getStatements().get(0).getKind());
    }

    @Test
    void fallibleCallHiddenInConditionalIsUnsupported() {
        TryBlock tryBlock = new TryBlock(List.of(
                when(expr("ready", 3), block(3, call(null, openFile)), null)), R, at(1));

        analyzer.analyze(tryBlock);

        assertEquals(1, diagnostics.getErrors().size());
        assertEquals(DiagnosticCode.UNSUPPORTED_TRY_STATEMENT, diagnostics.getErrors().get(0).getCode());
    }

    @Test
    void conditionalWithOnlyPlainCodeIsAccepted() {
        TryBlock tryBlock = new TryBlock(List.of(
                when(expr("ready", 3), block(3, value(trim)), block(3, value(trim)))), R, at(1));

        AnnotatedTryBlock annotated = analyzer.analyze(tryBlock);

        assertEquals(AnnotatedStatement.Kind.PLAIN, annotated.getStatements().get(0).getKind());
        assertTrue(diagnostics.isEmpty());
    }
}
