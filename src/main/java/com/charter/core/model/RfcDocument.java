package com.charter.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * An RFC together with every clause file stored under it.
 *
 * @param rfc     the RFC record
 * @param clauses clause records, including orphans not listed in any section
 */
public record RfcDocument(Rfc rfc, List<Clause> clauses) {

    public RfcDocument {
        clauses = clauses == null ? List.of() : List.copyOf(clauses);
    }

    public String id() {
        return rfc.id();
    }

    public Optional<Clause> clause(String clauseId) {
        return clauses.stream().filter(c -> c.id().equals(clauseId)).findFirst();
    }

    public List<Clause> clausesSortedById() {
        return clauses.stream().sorted(Comparator.comparing(Clause::id)).toList();
    }

    public RfcDocument withRfc(Rfc updated) {
        return new RfcDocument(updated, clauses);
    }

    /** Replaces the clause with the same id, or appends it when new. */
    public RfcDocument withClause(Clause clause) {
        List<Clause> updated = new ArrayList<>();
        boolean replaced = false;
        for (Clause existing : clauses) {
            if (existing.id().equals(clause.id())) {
                updated.add(clause);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(clause);
        }
        return new RfcDocument(rfc, updated);
    }
}
