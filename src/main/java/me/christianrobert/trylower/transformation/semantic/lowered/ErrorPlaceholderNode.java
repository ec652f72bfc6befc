package me.christianrobert.trylower.transformation.semantic.lowered;

import me.christianrobert.trylower.transformation.semantic.element.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * Stands in for a construct that failed analysis.
 *
 * <p>Downstream passes skip it instead of reporting follow-up errors. It carries the
 * diagnostic codes that caused the construct to be abandoned.
 */
public class ErrorPlaceholderNode extends LoweredNode {

    private final SourceLocation location;
    private final List<String> diagnosticCodes;

    public ErrorPlaceholderNode(SourceLocation location, List<String> diagnosticCodes) {
        if (location == null) {
            throw new IllegalArgumentException("Placeholder location cannot be null");
        }
        if (diagnosticCodes == null) {
            throw new IllegalArgumentException("Diagnostic codes cannot be null");
        }
        this.location = location;
        this.diagnosticCodes = List.copyOf(diagnosticCodes);
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<String> getDiagnosticCodes() {
        return diagnosticCodes;
    }

    @Override
    public <R> R accept(LoweredNodeVisitor<R> visitor) {
        return visitor.visitErrorPlaceholder(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ErrorPlaceholderNode that = (ErrorPlaceholderNode) o;
        return location.equals(that.location) && diagnosticCodes.equals(that.diagnosticCodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, diagnosticCodes);
    }

    @Override
    public String toString() {
        return "ErrorPlaceholder{" + location + ", " + diagnosticCodes + "}";
    }
}
