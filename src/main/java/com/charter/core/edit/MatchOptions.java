package com.charter.core.edit;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * How a pattern selects entries of a list field.
 * <p>
 * By default the pattern is a case-insensitive substring and must match exactly one
 * entry. {@code at} selects by position instead (negative counts from the end).
 *
 * @param at    position to select, {@code null} to match by pattern
 * @param exact require the whole entry to equal the pattern
 * @param regex treat the pattern as a regular expression
 * @param all   allow the pattern to select several entries
 */
public record MatchOptions(Integer at, boolean exact, boolean regex, boolean all) {

    public static MatchOptions defaults() {
        return new MatchOptions(null, false, false, false);
    }

    public static MatchOptions atIndex(int index) {
        return new MatchOptions(index, false, false, false);
    }

    public static MatchOptions exactly() {
        return new MatchOptions(null, true, false, false);
    }

    public static MatchOptions pattern() {
        return new MatchOptions(null, false, true, false);
    }

    public MatchOptions withAll() {
        return new MatchOptions(at, exact, regex, true);
    }

    /**
     * Selects entry positions.
     *
     * @throws EditRejectedException when nothing matches, when several entries match
     *                               without {@code all}, or when the pattern is invalid
     */
    public List<Integer> select(String artifactId, List<String> entries, String pattern) {
        return selectAny(artifactId, entries.stream().map(List::of).toList(), pattern);
    }

    /**
     * Selects entry positions where each entry may be written in several forms, such as
     * a criterion with and without its category prefix. An entry matches when any of
     * its forms does.
     */
    public List<Integer> selectAny(String artifactId, List<List<String>> entries, String pattern) {
        if (at != null) {
            int index = at < 0 ? entries.size() + at : at;
            if (index < 0 || index >= entries.size()) {
                throw new EditRejectedException(artifactId,
                        "index " + at + " out of range for " + entries.size() + " entries");
            }
            return List.of(index);
        }
        if (pattern == null || pattern.isEmpty()) {
            throw new EditRejectedException(artifactId, "a match pattern or an index is required");
        }
        Pattern compiled = null;
        if (regex) {
            try {
                compiled = Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new EditRejectedException(artifactId, "invalid pattern: " + e.getDescription(), e);
            }
        }
        String needle = pattern.toLowerCase(Locale.ROOT);
        List<Integer> selected = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            for (String form : entries.get(i)) {
                if (matches(form, pattern, needle, compiled)) {
                    selected.add(i);
                    break;
                }
            }
        }
        if (selected.isEmpty()) {
            throw new EditRejectedException(artifactId, "no entry matches '" + pattern + "'");
        }
        if (selected.size() > 1 && !all) {
            throw new EditRejectedException(artifactId,
                    selected.size() + " entries match '" + pattern + "'; narrow the pattern or select all");
        }
        return selected;
    }

    private boolean matches(String entry, String pattern, String needle, Pattern compiled) {
        if (compiled != null) {
            return compiled.matcher(entry).find();
        }
        if (exact) {
            return entry.equals(pattern);
        }
        return entry.toLowerCase(Locale.ROOT).contains(needle);
    }
}
