package com.charter.core.model;

/**
 * The four kinds of governed artifacts.
 * <p>
 * Clause ids are scoped by their RFC ({@code RFC-0001:C-NAME}); every other kind
 * is identified by its own prefix.
 */
public enum ArtifactKind {
    RFC("rfc", "RFC-"),
    CLAUSE("clause", null),
    ADR("adr", "ADR-"),
    WORK_ITEM("work", "WI-");

    /** Separator between an RFC id and a clause id in a qualified clause id. */
    public static final char CLAUSE_SEPARATOR = ':';

    private final String id;
    private final String prefix;

    ArtifactKind(String id, String prefix) {
        this.id = id;
        this.prefix = prefix;
    }

    public String id() {
        return id;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Infers the artifact kind from an id, or {@code null} when the id has no
     * recognised shape.
     */
    public static ArtifactKind ofId(String artifactId) {
        if (artifactId == null || artifactId.isBlank()) {
            return null;
        }
        if (artifactId.indexOf(CLAUSE_SEPARATOR) > 0) {
            return CLAUSE;
        }
        for (ArtifactKind kind : values()) {
            if (kind.prefix != null && artifactId.startsWith(kind.prefix)) {
                return kind;
            }
        }
        return null;
    }

    public static ArtifactKind fromId(String value) {
        for (ArtifactKind kind : values()) {
            if (kind.id.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown artifact kind: " + value);
    }

    public static String qualifyClause(String rfcId, String clauseId) {
        return rfcId + CLAUSE_SEPARATOR + clauseId;
    }

    @Override
    public String toString() {
        return id;
    }
}
