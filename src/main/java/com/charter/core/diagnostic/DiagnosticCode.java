package com.charter.core.diagnostic;

/**
 * Stable diagnostic codes. The letter gives the severity, the first two digits
 * the area: 01 content, 02 lifecycle, 03 references, 04 signatures.
 */
public enum DiagnosticCode {

    // ── Content ──────────────────────────────────────────────────
    ARTIFACT_NOT_FOUND("E0102"),
    INVALID_VERSION("E0103"),
    RFC_NO_CHANGELOG("W0101"),
    CLAUSE_NO_SINCE("W0102"),
    ADR_NO_REFS("W0103"),
    ORPHANED_CLAUSE("W0104"),

    // ── Lifecycle ────────────────────────────────────────────────
    INVALID_TRANSITION("E0201"),
    FORBIDDEN_STATUS_PHASE("E0202"),
    ACCEPTANCE_CRITERIA_INCOMPLETE("E0203"),
    SUPERSEDED_BY_INVALID("E0204"),
    CLAUSE_INCONSISTENT("E0205"),
    CLAUSE_MISSING("E0206"),
    DELETE_NOT_ALLOWED("E0207"),
    STATUS_PHASE_WARNING("W0201"),
    AMENDMENT_UNRELEASED("W0202"),

    // ── References ───────────────────────────────────────────────
    DANGLING_REFERENCE("E0301"),
    REFERENCE_PROTECTED("E0302"),
    OUTDATED_REFERENCE("W0301"),
    STALE_REFERENCE("W0302"),

    // ── Signatures ───────────────────────────────────────────────
    TAMPER_OR_STALE("E0401"),
    SIGNATURE_MISSING("E0402");

    private final String code;

    DiagnosticCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public Severity severity() {
        return code.charAt(0) == 'E' ? Severity.ERROR : Severity.WARNING;
    }

    @Override
    public String toString() {
        return code;
    }
}
