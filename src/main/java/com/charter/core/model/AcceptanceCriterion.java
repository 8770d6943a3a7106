package com.charter.core.model;

/**
 * One checklist entry gating completion of a work item.
 * <p>
 * When no category is stored, it is derived from a prefix on the text
 * ({@code "fix: ..."}) and the prefix is removed; {@code prefixed} remembers whether
 * the author wrote one.
 *
 * @param text     criterion text without category prefix
 * @param status   pending, done or cancelled
 * @param category changelog category
 * @param prefixed whether the author wrote the category as a prefix
 */
public record AcceptanceCriterion(String text, ChecklistStatus status, ChangelogCategory category, boolean prefixed) {

    public AcceptanceCriterion {
        status = status == null ? ChecklistStatus.PENDING : status;
        if (category == null) {
            ChangelogCategory.Parsed parsed = ChangelogCategory.parse(text);
            category = parsed.category();
            text = parsed.text();
            prefixed = parsed.prefixed();
        }
    }

    /** Creates a pending criterion, taking the category from a text prefix. */
    public static AcceptanceCriterion pending(String rawText) {
        return new AcceptanceCriterion(rawText, ChecklistStatus.PENDING, null, false);
    }

    public AcceptanceCriterion withStatus(ChecklistStatus newStatus) {
        return new AcceptanceCriterion(text, newStatus, category, prefixed);
    }

    /** Text as written by the author: the category prefix is restored only if one was given. */
    public String displayText() {
        return prefixed ? prefixedText() : text;
    }

    /** Text with its category prefix, whether or not the author wrote one. */
    public String prefixedText() {
        return category.prefix() + ": " + text;
    }
}
