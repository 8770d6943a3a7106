package com.charter.core.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A tracked unit of work. Completion is gated by its acceptance criteria.
 *
 * @param id                 identifier, e.g. {@code WI-0007} or {@code WI-2026-03-01-002}
 * @param title              short title
 * @param status             lifecycle status
 * @param created            creation date
 * @param started            date the item became active
 * @param completed          date the item reached done or cancelled
 * @param description        free text
 * @param notes              working notes
 * @param acceptanceCriteria ordered checklist
 * @param refs               ids of related artifacts
 */
public record WorkItem(
        String id,
        String title,
        WorkItemStatus status,
        LocalDate created,
        LocalDate started,
        LocalDate completed,
        String description,
        List<String> notes,
        List<AcceptanceCriterion> acceptanceCriteria,
        List<String> refs
) {

    public WorkItem {
        notes = notes == null ? List.of() : List.copyOf(notes);
        acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
        refs = refs == null ? List.of() : List.copyOf(refs);
    }

    /** Number of acceptance criteria neither done nor cancelled. */
    public long pendingCriteria() {
        return acceptanceCriteria.stream().filter(c -> c.status() == ChecklistStatus.PENDING).count();
    }

    /**
     * Moves to a new status, stamping the start or completion date when the
     * move enters {@code active} or a terminal status.
     */
    public WorkItem moveTo(WorkItemStatus target, LocalDate today) {
        LocalDate newStarted = target == WorkItemStatus.ACTIVE && started == null ? today : started;
        LocalDate newCompleted = target.isTerminal() ? today : completed;
        return new WorkItem(id, title, target, created, newStarted, newCompleted, description,
                notes, acceptanceCriteria, refs);
    }
}
