package me.christianrobert.trylower.transformation.diagnostic;

/**
 * Pipeline stage a diagnostic originates from.
 */
public enum DiagnosticCategory {
    /** Error-flow analysis of the try scope. */
    STRUCTURAL,
    /** Handler table construction. */
    TABLE_CONSTRUCTION,
    /** Exhaustiveness of the handler table against the try scope. */
    COVERAGE,
    /** Throw placement and handler result types. */
    SCOPE_TYPE
}
