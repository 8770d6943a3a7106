package com.charter.core.edit;

/**
 * Thrown when a mutation request cannot be applied: unknown field, no or ambiguous
 * match, malformed value, or content that is locked.
 */
public class EditRejectedException extends RuntimeException {

    private final String artifactId;

    public EditRejectedException(String artifactId, String message) {
        super(artifactId + ": " + message);
        this.artifactId = artifactId;
    }

    public EditRejectedException(String artifactId, String message, Throwable cause) {
        super(artifactId + ": " + message, cause);
        this.artifactId = artifactId;
    }

    public String getArtifactId() {
        return artifactId;
    }
}
