package com.charter.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A cut release and the work items it ships.
 *
 * @param version semantic version
 * @param date    release date
 * @param refs    ids of the work items included
 */
public record Release(String version, LocalDate date, List<String> refs) {

    public Release {
        refs = refs == null ? List.of() : List.copyOf(refs);
    }
}
