package com.charter.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * All releases, newest first.
 */
public record ReleaseLog(List<Release> releases) {

    public ReleaseLog {
        releases = releases == null ? List.of() : List.copyOf(releases);
    }

    public static ReleaseLog empty() {
        return new ReleaseLog(List.of());
    }

    public Optional<Release> find(String version) {
        return releases.stream().filter(r -> r.version().equals(version)).findFirst();
    }

    public boolean isReleased(String workItemId) {
        return releases.stream().anyMatch(r -> r.refs().contains(workItemId));
    }

    public ReleaseLog prepend(Release release) {
        List<Release> updated = new ArrayList<>();
        updated.add(release);
        updated.addAll(releases);
        return new ReleaseLog(updated);
    }
}
