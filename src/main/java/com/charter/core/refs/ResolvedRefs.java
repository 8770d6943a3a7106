package com.charter.core.refs;

import com.charter.core.diagnostic.Diagnostic;

import java.util.List;

/**
 * Outcome of resolving the structured references of one artifact: either every
 * reference resolved, or the diagnostics of those that did not.
 *
 * @param artifactId  the artifact whose references were resolved
 * @param refs        resolved targets, in declaration order
 * @param diagnostics failures; empty when resolution succeeded
 */
public record ResolvedRefs(String artifactId, List<ArtifactState> refs, List<Diagnostic> diagnostics) {

    public ResolvedRefs {
        refs = List.copyOf(refs);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isResolved() {
        return diagnostics.isEmpty();
    }
}
