package com.charter.core.model;

import java.util.List;
import java.util.TreeSet;

/**
 * Ids of artifacts that were hard-deleted. Kept sorted.
 */
public record Tombstones(List<String> ids) {

    public Tombstones {
        ids = ids == null ? List.of() : List.copyOf(new TreeSet<>(ids));
    }

    public static Tombstones empty() {
        return new Tombstones(List.of());
    }

    public boolean contains(String id) {
        return ids.contains(id);
    }

    public Tombstones add(String id) {
        TreeSet<String> updated = new TreeSet<>(ids);
        updated.add(id);
        return new Tombstones(List.copyOf(updated));
    }
}
