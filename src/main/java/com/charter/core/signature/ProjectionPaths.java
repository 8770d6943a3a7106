package com.charter.core.signature;

import com.charter.core.model.ArtifactKind;

import java.nio.file.Path;

/**
 * Where the projection of an artifact lives under the docs output directory.
 */
public final class ProjectionPaths {

    private ProjectionPaths() {}

    public static Path of(Path docsRoot, ArtifactKind kind, String artifactId) {
        return docsRoot.resolve(kind.id()).resolve(artifactId + ".md");
    }

    /** Link from one projection to another, relative to the linking file. */
    public static String relativeLink(ArtifactKind kind, String artifactId) {
        return "../" + kind.id() + "/" + artifactId + ".md";
    }
}
