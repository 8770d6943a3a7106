package com.charter.core.refs;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Where and what to scan in the external source tree.
 *
 * @param enabled     whether the source tree is scanned at all
 * @param projectRoot directory the roots are resolved against
 * @param roots       directories to walk
 * @param extensions  file extensions to read, without dot
 * @param excludeDirs directory names skipped anywhere in the tree
 */
public record SourceScanOptions(boolean enabled, Path projectRoot, List<String> roots,
                                Set<String> extensions, Set<String> excludeDirs) {

    public SourceScanOptions {
        roots = List.copyOf(roots);
        extensions = Set.copyOf(extensions);
        excludeDirs = Set.copyOf(excludeDirs);
    }

    public static SourceScanOptions disabled() {
        return new SourceScanOptions(false, Path.of("."), List.of(), Set.of(), Set.of());
    }
}
