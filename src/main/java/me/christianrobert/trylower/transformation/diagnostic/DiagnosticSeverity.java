package me.christianrobert.trylower.transformation.diagnostic;

/**
 * Severity of a diagnostic. Only {@link #ERROR} blocks lowering of a construct.
 */
public enum DiagnosticSeverity {
    ERROR,
    WARNING
}
