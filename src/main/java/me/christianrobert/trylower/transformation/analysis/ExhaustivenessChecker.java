package me.christianrobert.trylower.transformation.analysis;

import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCode;
import me.christianrobert.trylower.transformation.diagnostic.DiagnosticCollector;
import me.christianrobert.trylower.transformation.semantic.element.ErrorType;
import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;
import me.christianrobert.trylower.transformation.semantic.statement.CatchClause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Cross-checks the error types flowing out of a try scope against its handler table.
 *
 * <ul>
 *   <li>Every produced type without a handler: {@code E-MISSING-HANDLER(type)}, fatal.</li>
 *   <li>Every handler whose type is never produced: {@code W-UNREACHABLE-HANDLER(type)},
 *       advisory unless the run escalates it.</li>
 * </ul>
 *
 * <p>Statements sharing an error type share one handler, so each missing type is reported
 * once, at its first producing statement.
 */
public class ExhaustivenessChecker {

    private static final Logger log = LoggerFactory.getLogger(ExhaustivenessChecker.class);

    private final DiagnosticCollector diagnostics;

    public ExhaustivenessChecker(DiagnosticCollector diagnostics) {
        if (diagnostics == null) {
            throw new IllegalArgumentException("Diagnostics cannot be null");
        }
        this.diagnostics = diagnostics;
    }

    /**
     * @return The required error types, in order of first occurrence
     */
    public Set<ErrorType> check(AnnotatedTryBlock annotated, HandlerTable table, SourceLocation constructLocation) {
        Set<ErrorType> required = annotated.getProducedErrorTypes();
        log.debug("Required error types {} against handlers {}", required, table.getErrorTypes());

        for (ErrorType errorType : required) {
            if (!table.handles(errorType)) {
                diagnostics.report(DiagnosticCode.MISSING_HANDLER, firstProducer(annotated, errorType),
                        List.of(constructLocation),
                        "no catch clause handles " + errorType + " produced in this try scope",
                        errorType.getName());
            }
        }

        for (ErrorType handled : table.getErrorTypes()) {
            if (!required.contains(handled)) {
                CatchClause clause = table.get(handled);
                diagnostics.report(DiagnosticCode.UNREACHABLE_HANDLER, clause.getLocation(),
                        "no statement in the try scope can fail with " + handled,
                        handled.getName());
            }
        }
        return required;
    }

    private SourceLocation firstProducer(AnnotatedTryBlock annotated, ErrorType errorType) {
        for (AnnotatedStatement statement : annotated.getStatements()) {
            if (statement.isFallible() && statement.getErrorType().equals(errorType)) {
                return statement.getStatement().getLocation();
            }
        }
        return annotated.getTryBlock().getLocation();
    }
}
