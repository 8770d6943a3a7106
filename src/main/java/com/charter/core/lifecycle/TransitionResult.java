package com.charter.core.lifecycle;

import com.charter.core.diagnostic.Diagnostic;

import java.util.List;

/**
 * Outcome of a lifecycle operation.
 *
 * @param artifactId  the artifact the operation targeted
 * @param applied     whether the change was persisted
 * @param diagnostics why it was rejected, or warnings that did not block it
 */
public record TransitionResult(String artifactId, boolean applied, List<Diagnostic> diagnostics) {

    public TransitionResult {
        diagnostics = diagnostics.stream().sorted(Diagnostic.ORDER).toList();
    }

    public static TransitionResult applied(String artifactId, List<Diagnostic> warnings) {
        return new TransitionResult(artifactId, true, warnings);
    }

    public static TransitionResult rejected(String artifactId, List<Diagnostic> diagnostics) {
        return new TransitionResult(artifactId, false, diagnostics);
    }

    public static TransitionResult rejected(String artifactId, Diagnostic diagnostic) {
        return rejected(artifactId, List.of(diagnostic));
    }
}
