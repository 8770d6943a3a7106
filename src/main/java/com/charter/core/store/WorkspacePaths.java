package com.charter.core.store;

import java.nio.file.Path;

/**
 * Resolved locations of everything Charter reads or writes.
 *
 * @param projectRoot   root of the governed project
 * @param govRoot       governance store directory
 * @param docsRoot      output directory of rendered projections
 * @param changelogFile generated changelog
 */
public record WorkspacePaths(Path projectRoot, Path govRoot, Path docsRoot, Path changelogFile) {

    /** Default layout under one project root: {@code gov/}, {@code docs/}, {@code CHANGELOG.md}. */
    public static WorkspacePaths under(Path projectRoot) {
        return new WorkspacePaths(projectRoot, projectRoot.resolve("gov"),
                projectRoot.resolve("docs"), projectRoot.resolve("CHANGELOG.md"));
    }
}
