package com.charter.core.model;

/**
 * An atomic statement inside an RFC, status-tracked on its own.
 *
 * @param id           identifier unique within the owning RFC, e.g. {@code C-SCOPE}
 * @param title        short title
 * @param kind         normative or informative
 * @param status       lifecycle status
 * @param text         clause body, may contain inline references
 * @param since        version the clause was introduced in, {@code null} until the first bump
 * @param supersededBy id of the clause of the same RFC that replaces this one
 */
public record Clause(
        String id,
        String title,
        ClauseKind kind,
        ClauseStatus status,
        String text,
        String since,
        String supersededBy
) {

    public Clause withStatus(ClauseStatus newStatus) {
        return new Clause(id, title, kind, newStatus, text, since, supersededBy);
    }

    public Clause withSupersededBy(String clauseId) {
        return new Clause(id, title, kind, ClauseStatus.SUPERSEDED, text, since, clauseId);
    }

    public Clause withSince(String version) {
        return new Clause(id, title, kind, status, text, version, supersededBy);
    }
}
