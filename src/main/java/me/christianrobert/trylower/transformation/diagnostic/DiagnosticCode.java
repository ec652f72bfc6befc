package me.christianrobert.trylower.transformation.diagnostic;

/**
 * Stable, host-facing diagnostic identifiers.
 *
 * <p>The code strings are part of the host contract and must not change.
 */
public enum DiagnosticCode {

    UNRESOLVED_ERROR_TYPE("E-UNRESOLVED-ERROR-TYPE", DiagnosticSeverity.ERROR, DiagnosticCategory.STRUCTURAL),
    UNSUPPORTED_TRY_STATEMENT("E-UNSUPPORTED-TRY-STATEMENT", DiagnosticSeverity.ERROR, DiagnosticCategory.STRUCTURAL),
    DUPLICATE_HANDLER("E-DUPLICATE-HANDLER", DiagnosticSeverity.ERROR, DiagnosticCategory.TABLE_CONSTRUCTION),
    MISSING_HANDLER("E-MISSING-HANDLER", DiagnosticSeverity.ERROR, DiagnosticCategory.COVERAGE),
    UNREACHABLE_HANDLER("W-UNREACHABLE-HANDLER", DiagnosticSeverity.WARNING, DiagnosticCategory.COVERAGE),
    INVALID_THROW_CONTEXT("E-INVALID-THROW-CONTEXT", DiagnosticSeverity.ERROR, DiagnosticCategory.SCOPE_TYPE),
    THROW_TYPE_MISMATCH("E-THROW-TYPE-MISMATCH", DiagnosticSeverity.ERROR, DiagnosticCategory.SCOPE_TYPE),
    INVALID_ERROR_TYPE_OVERRIDE("E-INVALID-ERROR-TYPE-OVERRIDE", DiagnosticSeverity.ERROR, DiagnosticCategory.SCOPE_TYPE),
    HANDLER_RETURN_MISMATCH("E-HANDLER-RETURN-MISMATCH", DiagnosticSeverity.ERROR, DiagnosticCategory.SCOPE_TYPE),
    TRY_RESULT_MISMATCH("E-TRY-RESULT-MISMATCH", DiagnosticSeverity.ERROR, DiagnosticCategory.SCOPE_TYPE);

    private final String code;
    private final DiagnosticSeverity defaultSeverity;
    private final DiagnosticCategory category;

    DiagnosticCode(String code, DiagnosticSeverity defaultSeverity, DiagnosticCategory category) {
        this.code = code;
        this.defaultSeverity = defaultSeverity;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public DiagnosticSeverity getDefaultSeverity() {
        return defaultSeverity;
    }

    public DiagnosticCategory getCategory() {
        return category;
    }
}
