package com.charter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Keep-a-Changelog category of an acceptance criterion.
 * <p>
 * The category is written as a prefix on the criterion text ({@code "fix: Crash on
 * empty input"}). {@link #CHORE} entries are tracked like any other criterion but
 * never appear in a generated changelog.
 */
public enum ChangelogCategory {
    ADDED("add", "Added"),
    CHANGED("changed", "Changed"),
    DEPRECATED("deprecated", "Deprecated"),
    REMOVED("removed", "Removed"),
    FIXED("fix", "Fixed"),
    SECURITY("security", "Security"),
    CHORE("chore", null);

    private final String prefix;
    private final String heading;

    ChangelogCategory(String prefix, String heading) {
        this.prefix = prefix;
        this.heading = heading;
    }

    @JsonValue
    public String prefix() {
        return prefix;
    }

    /** Section heading in the changelog, {@code null} for categories that are never published. */
    public String heading() {
        return heading;
    }

    public boolean isPublished() {
        return heading != null;
    }

    @JsonCreator
    public static ChangelogCategory fromPrefix(String value) {
        for (ChangelogCategory category : values()) {
            if (category.prefix.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown changelog category: " + value);
    }

    /**
     * Splits a criterion text into its category and the remaining text.
     * <p>
     * Defined for every input. Text without a recognised prefix yields
     * {@link Parsed#prefixed()} {@code == false} and is filed under {@link #ADDED}:
     * an unprefixed criterion documents new behaviour unless stated otherwise.
     */
    public static Parsed parse(String text) {
        String raw = text == null ? "" : text.strip();
        int colon = raw.indexOf(':');
        if (colon > 0) {
            String candidate = raw.substring(0, colon).strip().toLowerCase(Locale.ROOT);
            for (ChangelogCategory category : values()) {
                if (category.prefix.equals(candidate)) {
                    return new Parsed(category, raw.substring(colon + 1).strip(), true);
                }
            }
        }
        return new Parsed(ADDED, raw, false);
    }

    /**
     * Result of {@link #parse(String)}.
     *
     * @param category the category, {@link #ADDED} when no prefix was present
     * @param text     the criterion text with the prefix removed
     * @param prefixed whether the category came from an explicit prefix
     */
    public record Parsed(ChangelogCategory category, String text, boolean prefixed) {}
}
