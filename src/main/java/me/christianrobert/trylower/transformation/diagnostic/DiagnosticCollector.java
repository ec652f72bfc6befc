package me.christianrobert.trylower.transformation.diagnostic;

import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accumulates diagnostics for one unit of work (a construct or a function).
 *
 * <p>Reporting is never fail-fast: analysis continues after a fatal diagnostic so a single run
 * surfaces as many independent problems as possible. Not thread-safe; every construct and every
 * function gets its own collector.
 */
public class DiagnosticCollector {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticCollector.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final boolean unreachableHandlerFatal;

    public DiagnosticCollector() {
        this(false);
    }

    /**
     * @param unreachableHandlerFatal Escalate {@code W-UNREACHABLE-HANDLER} to an error
     */
    public DiagnosticCollector(boolean unreachableHandlerFatal) {
        this.unreachableHandlerFatal = unreachableHandlerFatal;
    }

    public Diagnostic report(DiagnosticCode code, SourceLocation location, String message, String... arguments) {
        return report(code, location, List.of(), message, arguments);
    }

    public Diagnostic report(DiagnosticCode code, SourceLocation location, List<SourceLocation> related,
                             String message, String... arguments) {
        DiagnosticSeverity severity = code.getDefaultSeverity();
        if (code == DiagnosticCode.UNREACHABLE_HANDLER && unreachableHandlerFatal) {
            severity = DiagnosticSeverity.ERROR;
        }
        Diagnostic diagnostic = new Diagnostic(code, severity, message, List.of(arguments), location, related);
        diagnostics.add(diagnostic);
        log.debug("Reported {}", diagnostic.format());
        return diagnostic;
    }

    public void addAll(DiagnosticCollector other) {
        diagnostics.addAll(other.diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(Diagnostic::isFatal).collect(Collectors.toList());
    }

    public List<Diagnostic> getWarnings() {
        return diagnostics.stream().filter(d -> !d.isFatal()).collect(Collectors.toList());
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isFatal);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public boolean isUnreachableHandlerFatal() {
        return unreachableHandlerFatal;
    }
}
