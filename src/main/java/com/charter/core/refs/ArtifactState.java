package com.charter.core.refs;

import com.charter.core.model.ArtifactKind;

/**
 * Whether an id is still a good reference target.
 *
 * @param id     artifact id, qualified for clauses
 * @param kind   artifact kind
 * @param reason why the artifact is outdated, {@code null} while it is active
 */
public record ArtifactState(String id, ArtifactKind kind, String reason) {

    public static ArtifactState active(String id, ArtifactKind kind) {
        return new ArtifactState(id, kind, null);
    }

    public static ArtifactState outdated(String id, ArtifactKind kind, String reason) {
        return new ArtifactState(id, kind, reason);
    }

    public boolean isOutdated() {
        return reason != null;
    }
}
