package com.charter.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * One versioned entry of an RFC's own changelog.
 *
 * @param version semantic version this entry records
 * @param date    date the version was cut
 * @param summary one-line description
 * @param changes individual change notes
 */
public record ChangelogEntry(String version, LocalDate date, String summary, List<String> changes) {

    public ChangelogEntry {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }
}
