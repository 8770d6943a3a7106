package com.charter.core.edit;

import com.charter.core.Fixtures;
import com.charter.core.model.AcceptanceCriterion;
import com.charter.core.model.Adr;
import com.charter.core.model.AdrStatus;
import com.charter.core.model.Alternative;
import com.charter.core.model.AlternativeStatus;
import com.charter.core.model.ChangelogCategory;
import com.charter.core.model.ChecklistStatus;
import com.charter.core.model.Clause;
import com.charter.core.model.ClauseKind;
import com.charter.core.model.ClauseStatus;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.WorkItem;
import com.charter.core.model.WorkItemStatus;
import com.charter.core.store.ArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactEditorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 4, 15);

    @TempDir
    Path tempDir;

    private ArtifactStore store;
    private ArtifactEditor editor;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(tempDir.resolve("gov"));
        editor = new ArtifactEditor(store,
                Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC));

        RfcDocument rfc = Fixtures.draftRfc("RFC-0001",
                Fixtures.clause("C-A", "Original text"),
                Fixtures.clause("C-OLD", "Old").withStatus(ClauseStatus.SUPERSEDED).withSupersededBy("C-A"));
        rfc.clauses().forEach(clause -> store.saveClause("RFC-0001", clause));
        store.saveRfc(rfc.rfc());

        store.saveAdr(new Adr("ADR-0001", "Storage format", AdrStatus.PROPOSED, Fixtures.DAY,
                "Context", "Decision", "Consequences",
                List.of(Alternative.considered("YAML"), Alternative.considered("TOML")),
                List.of(), null));

        store.saveWorkItem(new WorkItem("WI-0001", "Fix typo", WorkItemStatus.ACTIVE, Fixtures.DAY, Fixtures.DAY,
                null, "", List.of("first note", "second note", "unrelated"),
                List.of(AcceptanceCriterion.pending("fix: typo in header"),
                        AcceptanceCriterion.pending("chore: tests pass")),
                List.of()));
        store.saveWorkItem(Fixtures.workItem("WI-0002", WorkItemStatus.DONE, Fixtures.done("add: thing")));
    }

    private WorkItem item(String id) {
        return store.getWorkItem(id).orElseThrow();
    }

    // ── Scalars ────────────────────────────────────────────────────

    @Nested
    @DisplayName("setField")
    class SetField {

        @Test
        @DisplayName("replaces a top-level scalar")
        void setsTitle() {
            editor.setField("WI-0001", "title", "Fix typos");

            assertEquals("Fix typos", item("WI-0001").title());
        }

        @Test
        @DisplayName("replaces a field of a list entry")
        void setsNestedField() {
            editor.setField("ADR-0001", "alternatives[-1].rejection_reason", "Nobody knows it");

            Adr adr = store.getAdr("ADR-0001").orElseThrow();
            assertEquals("Nobody knows it", adr.alternatives().get(1).rejectionReason());
            assertNull(adr.alternatives().get(0).rejectionReason());
        }

        @Test
        @DisplayName("editing a clause saves the clause and touches its RFC")
        void editsClause() {
            editor.setField("RFC-0001:C-A", "text", "New text");

            RfcDocument rfc = store.getRfc("RFC-0001").orElseThrow();
            assertEquals("New text", rfc.clause("C-A").orElseThrow().text());
            assertEquals(TODAY, rfc.rfc().updated());
        }

        @Test
        @DisplayName("clause kind accepts its lowercase id")
        void setsClauseKind() {
            editor.setField("RFC-0001:C-A", "kind", "informative");

            Clause clause = store.getRfc("RFC-0001").orElseThrow().clause("C-A").orElseThrow();
            assertEquals(ClauseKind.INFORMATIVE, clause.kind());
        }

        @Test
        @DisplayName("rejects lifecycle fields, lists, blanks and bad versions")
        void rejections() {
            assertThrows(EditRejectedException.class, () -> editor.setField("WI-0001", "status", "done"));
            assertThrows(EditRejectedException.class, () -> editor.setField("WI-0001", "notes", "x"));
            assertThrows(EditRejectedException.class, () -> editor.setField("WI-0001", "title", " "));
            assertThrows(EditRejectedException.class, () -> editor.setField("RFC-0001", "version", "1.0"));
            assertThrows(EditRejectedException.class, () -> editor.setField("RFC-0001", "Title!", "x"));
            assertThrows(EditRejectedException.class, () -> editor.setField("ADR-0001", "alternatives[5].text", "x"));
            assertEquals("Fix typo", item("WI-0001").title());
        }

        @Test
        @DisplayName("rejects unknown artifacts")
        void unknownArtifact() {
            EditRejectedException e = assertThrows(EditRejectedException.class,
                    () -> editor.setField("WI-0404", "title", "x"));
            assertEquals("WI-0404", e.getArtifactId());
        }

        @Test
        @DisplayName("superseded clauses are locked")
        void lockedClause() {
            assertThrows(EditRejectedException.class, () -> editor.setField("RFC-0001:C-OLD", "text", "x"));
        }

        @Test
        @DisplayName("finished work items only accept notes")
        void finishedWorkItem() {
            assertThrows(EditRejectedException.class, () -> editor.setField("WI-0002", "title", "x"));

            editor.addToField("WI-0002", "notes", "shipped late");

            assertEquals(List.of("shipped late"), item("WI-0002").notes());
        }
    }

    // ── Lists ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("addToField and removeFromField")
    class Lists {

        @Test
        @DisplayName("new criteria are pending and take their category from the prefix")
        void addsCriterion() {
            editor.addToField("WI-0001", "acceptance_criteria", "security: escape input");

            AcceptanceCriterion added = item("WI-0001").acceptanceCriteria().get(2);
            assertEquals("escape input", added.text());
            assertEquals(ChangelogCategory.SECURITY, added.category());
            assertEquals(ChecklistStatus.PENDING, added.status());
        }

        @Test
        @DisplayName("refs must name existing artifacts and are not duplicated")
        void addsRef() {
            editor.addToField("WI-0001", "refs", "RFC-0001:C-A");

            assertEquals(List.of("RFC-0001:C-A"), item("WI-0001").refs());
            assertThrows(EditRejectedException.class, () -> editor.addToField("WI-0001", "refs", "RFC-0001:C-A"));
            assertThrows(EditRejectedException.class, () -> editor.addToField("WI-0001", "refs", "ADR-0404"));
        }

        @Test
        @DisplayName("an ambiguous substring is rejected")
        void ambiguous() {
            assertThrows(EditRejectedException.class,
                    () -> editor.removeFromField("WI-0001", "notes", "note", MatchOptions.defaults()));
            assertEquals(3, item("WI-0001").notes().size());
        }

        @Test
        @DisplayName("all removes every match")
        void removeAll() {
            int removed = editor.removeFromField("WI-0001", "notes", "NOTE", MatchOptions.defaults().withAll());

            assertEquals(2, removed);
            assertEquals(List.of("unrelated"), item("WI-0001").notes());
        }

        @Test
        @DisplayName("exact, regex and index selection")
        void selectors() {
            assertThrows(EditRejectedException.class,
                    () -> editor.removeFromField("WI-0001", "notes", "first", MatchOptions.exactly()));

            editor.removeFromField("WI-0001", "notes", "first note", MatchOptions.exactly());
            editor.removeFromField("WI-0001", "notes", "^sec", MatchOptions.pattern());
            editor.removeFromField("WI-0001", "notes", null, MatchOptions.atIndex(-1));

            assertTrue(item("WI-0001").notes().isEmpty());
        }

        @Test
        @DisplayName("an invalid regex is rejected")
        void invalidRegex() {
            assertThrows(EditRejectedException.class,
                    () -> editor.removeFromField("WI-0001", "notes", "([", MatchOptions.pattern()));
        }
    }

    // ── Checklists ─────────────────────────────────────────────────

    @Nested
    @DisplayName("tick")
    class Tick {

        @Test
        @DisplayName("marks the matching criterion done")
        void ticksCriterion() {
            int ticked = editor.tick("WI-0001", "acceptance_criteria", "tests", MatchOptions.defaults(),
                    ChecklistStatus.DONE);

            assertEquals(1, ticked);
            List<AcceptanceCriterion> criteria = item("WI-0001").acceptanceCriteria();
            assertEquals(ChecklistStatus.PENDING, criteria.get(0).status());
            assertEquals(ChecklistStatus.DONE, criteria.get(1).status());
            assertEquals(ChangelogCategory.CHORE, criteria.get(1).category());
        }

        @Test
        @DisplayName("exact match accepts the criterion as written, prefix included")
        void ticksExactWithPrefix() {
            editor.addToField("WI-0001", "acceptance_criteria", "chore: docs updated");

            int ticked = editor.tick("WI-0001", "acceptance_criteria", "chore: docs updated",
                    MatchOptions.exactly(), ChecklistStatus.DONE);

            assertEquals(1, ticked);
            AcceptanceCriterion criterion = item("WI-0001").acceptanceCriteria().get(2);
            assertEquals(ChecklistStatus.DONE, criterion.status());
            assertEquals("chore: docs updated", criterion.displayText());
            assertEquals(1, editor.removeFromField("WI-0001", "acceptance_criteria", "docs updated",
                    MatchOptions.exactly()));
        }

        @Test
        @DisplayName("maps checklist states onto ADR alternatives")
        void ticksAlternative() {
            editor.tick("ADR-0001", "alternatives", "toml", MatchOptions.defaults(), ChecklistStatus.CANCELLED);

            Adr adr = store.getAdr("ADR-0001").orElseThrow();
            assertEquals(AlternativeStatus.CONSIDERED, adr.alternatives().get(0).status());
            assertEquals(AlternativeStatus.REJECTED, adr.alternatives().get(1).status());
        }

        @Test
        @DisplayName("plain lists have nothing to tick")
        void notAChecklist() {
            assertThrows(EditRejectedException.class,
                    () -> editor.tick("WI-0001", "notes", "first", MatchOptions.defaults(), ChecklistStatus.DONE));
        }

        @Test
        @DisplayName("checklist states map to alternative states")
        void mapping() {
            assertEquals(AlternativeStatus.ACCEPTED, ArtifactEditor.alternativeStatus(ChecklistStatus.DONE));
            assertEquals(AlternativeStatus.CONSIDERED, ArtifactEditor.alternativeStatus(ChecklistStatus.PENDING));
            assertEquals(AlternativeStatus.REJECTED, ArtifactEditor.alternativeStatus(ChecklistStatus.CANCELLED));
        }
    }
}
