package com.charter.core.model;

import java.util.List;

/**
 * An ordered group of clauses inside an RFC.
 *
 * @param title   section heading
 * @param clauses clause ids (unqualified) in reading order
 */
public record Section(String title, List<String> clauses) {

    public Section {
        clauses = clauses == null ? List.of() : List.copyOf(clauses);
    }

    public Section withClauses(List<String> updated) {
        return new Section(title, updated);
    }
}
