package com.charter.core.diagnostic;

import java.util.Comparator;

/**
 * A single finding of a validation, resolution or verification pass.
 *
 * @param code       stable code; also determines the severity
 * @param message    human readable description
 * @param artifactId id of the offending artifact
 * @param location   file and line for findings outside the store, otherwise {@code null}
 */
public record Diagnostic(DiagnosticCode code, String message, String artifactId, String location) {

    /** Artifact id, then errors before warnings, then code, then message. */
    public static final Comparator<Diagnostic> ORDER = Comparator
            .comparing(Diagnostic::artifactId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Diagnostic::severity)
            .thenComparing(d -> d.code().code())
            .thenComparing(Diagnostic::message)
            .thenComparing(Diagnostic::location, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static Diagnostic of(DiagnosticCode code, String artifactId, String message) {
        return new Diagnostic(code, message, artifactId, null);
    }

    public Diagnostic at(String newLocation) {
        return new Diagnostic(code, message, artifactId, newLocation);
    }

    public Severity severity() {
        return code.severity();
    }

    public boolean isError() {
        return severity() == Severity.ERROR;
    }

    /** Single-line form: {@code error[E0301] WI-0001: message (src/Main.java:12)}. */
    public String format() {
        String label = severity() == Severity.ERROR ? "error" : "warning";
        String where = location == null ? "" : " (" + location + ")";
        return label + "[" + code.code() + "] " + artifactId + ": " + message + where;
    }
}
