package me.christianrobert.trylower.transformation.diagnostic;

import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

import java.util.List;

/**
 * A single diagnostic reported to the host.
 *
 * <p>Arguments are the parenthesized part of the host-facing form, e.g.
 * {@code E-THROW-TYPE-MISMATCH(ErrorA, ErrorB)}. Related locations point at other nodes
 * involved, such as the first declaration of a duplicated handler.
 */
public class Diagnostic {

    private final DiagnosticCode code;
    private final DiagnosticSeverity severity;
    private final String message;
    private final List<String> arguments;
    private final SourceLocation location;
    private final List<SourceLocation> relatedLocations;

    public Diagnostic(DiagnosticCode code, DiagnosticSeverity severity, String message, List<String> arguments,
                      SourceLocation location, List<SourceLocation> relatedLocations) {
        if (code == null) {
            throw new IllegalArgumentException("Diagnostic code cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("Diagnostic severity cannot be null");
        }
        if (location == null) {
            throw new IllegalArgumentException("Diagnostic location cannot be null");
        }
        this.code = code;
        this.severity = severity;
        this.message = message != null ? message : "";
        this.arguments = arguments != null ? List.copyOf(arguments) : List.of();
        this.location = location;
        this.relatedLocations = relatedLocations != null ? List.copyOf(relatedLocations) : List.of();
    }

    public DiagnosticCode getCode() {
        return code;
    }

    public DiagnosticSeverity getSeverity() {
        return severity;
    }

    public boolean isFatal() {
        return severity == DiagnosticSeverity.ERROR;
    }

    public String getMessage() {
        return message;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<SourceLocation> getRelatedLocations() {
        return relatedLocations;
    }

    /**
     * Host-facing identifier with arguments, e.g. {@code E-MISSING-HANDLER(ErrorC)}.
     */
    public String getDisplayCode() {
        if (arguments.isEmpty()) {
            return code.getCode();
        }
        return code.getCode() + "(" + String.join(", ", arguments) + ")";
    }

    /**
     * Gets a one-line rendering including locations.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(location).append(": ")
                .append(severity == DiagnosticSeverity.ERROR ? "error" : "warning")
                .append(" ").append(getDisplayCode());
        if (!message.isEmpty()) {
            sb.append(": ").append(message);
        }
        for (SourceLocation related : relatedLocations) {
            sb.append(" [see ").append(related).append("]");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Diagnostic{" + getDisplayCode() + " at " + location + "}";
    }
}
