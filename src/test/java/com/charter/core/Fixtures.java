package com.charter.core;

import com.charter.core.model.AcceptanceCriterion;
import com.charter.core.model.Adr;
import com.charter.core.model.AdrStatus;
import com.charter.core.model.ChangelogEntry;
import com.charter.core.model.ChecklistStatus;
import com.charter.core.model.Clause;
import com.charter.core.model.ClauseKind;
import com.charter.core.model.ClauseStatus;
import com.charter.core.model.Rfc;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.RfcPhase;
import com.charter.core.model.RfcStatus;
import com.charter.core.model.Section;
import com.charter.core.model.WorkItem;
import com.charter.core.model.WorkItemStatus;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Small builders for governance records used across the core tests.
 */
public final class Fixtures {

    public static final LocalDate DAY = LocalDate.of(2026, 3, 1);

    private Fixtures() {}

    /** RFC with one "Specification" section listing every clause, in the given order. */
    public static RfcDocument rfc(String id, RfcStatus status, RfcPhase phase, Clause... clauses) {
        List<String> ids = Arrays.stream(clauses).map(Clause::id).toList();
        Rfc rfc = new Rfc(id, "Title of " + id, "0.1.0", status, phase, List.of("ana"), DAY, DAY,
                List.of(new Section("Specification", ids)),
                List.of(new ChangelogEntry("0.1.0", DAY, "Initial draft", List.of())),
                null);
        return new RfcDocument(rfc, List.of(clauses));
    }

    public static RfcDocument draftRfc(String id, Clause... clauses) {
        return rfc(id, RfcStatus.DRAFT, RfcPhase.SPEC, clauses);
    }

    public static Clause clause(String id, String text) {
        return new Clause(id, "Clause " + id, ClauseKind.NORMATIVE, ClauseStatus.ACTIVE, text, "0.1.0", null);
    }

    public static Adr adr(String id, AdrStatus status, String... refs) {
        return new Adr(id, "Decision " + id, status, DAY, "Context", "Decision", "Consequences",
                List.of(), List.of(refs), null);
    }

    public static WorkItem workItem(String id, WorkItemStatus status, AcceptanceCriterion... criteria) {
        return new WorkItem(id, "Work " + id, status, DAY, null, null, "", List.of(), List.of(criteria), List.of());
    }

    public static WorkItem workItemWithRefs(String id, WorkItemStatus status, String... refs) {
        return new WorkItem(id, "Work " + id, status, DAY, null, null, "", List.of(), List.of(), List.of(refs));
    }

    public static AcceptanceCriterion done(String text) {
        return AcceptanceCriterion.pending(text).withStatus(ChecklistStatus.DONE);
    }

    public static AcceptanceCriterion pending(String text) {
        return AcceptanceCriterion.pending(text);
    }
}
