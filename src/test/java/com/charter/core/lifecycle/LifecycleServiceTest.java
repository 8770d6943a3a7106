package com.charter.core.lifecycle;

import com.charter.core.Fixtures;
import com.charter.core.diagnostic.DiagnosticCode;
import com.charter.core.edit.ArtifactEditor;
import com.charter.core.edit.EditRejectedException;
import com.charter.core.edit.MatchOptions;
import com.charter.core.ids.SequentialIdStrategy;
import com.charter.core.metrics.CharterMetrics;
import com.charter.core.model.Adr;
import com.charter.core.model.AdrStatus;
import com.charter.core.model.BumpLevel;
import com.charter.core.model.ChecklistStatus;
import com.charter.core.model.Clause;
import com.charter.core.model.ClauseStatus;
import com.charter.core.model.Release;
import com.charter.core.model.Rfc;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.RfcPhase;
import com.charter.core.model.RfcStatus;
import com.charter.core.model.WorkItem;
import com.charter.core.model.WorkItemStatus;
import com.charter.core.refs.PatternReferenceMatcher;
import com.charter.core.refs.ReferenceResolver;
import com.charter.core.refs.SourceScanOptions;
import com.charter.core.refs.SourceScanner;
import com.charter.core.signature.CanonicalSigner;
import com.charter.core.store.ArtifactStore;
import com.charter.core.validation.StateMachineValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
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

class LifecycleServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 4, 15);

    @TempDir
    Path tempDir;

    private final CanonicalSigner signer = new CanonicalSigner();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private ArtifactStore store;
    private ArtifactEditor editor;
    private LifecycleService lifecycle;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        store = new ArtifactStore(tempDir.resolve("gov"));
        editor = new ArtifactEditor(store, clock);
        ReferenceResolver resolver = new ReferenceResolver(PatternReferenceMatcher.defaults(),
                new SourceScanner(SourceScanOptions.disabled()));
        lifecycle = new LifecycleService(store, new StateMachineValidator(), resolver, signer,
                new SequentialIdStrategy(), new CharterMetrics(registry), clock);
    }

    private void seed(RfcDocument document) {
        document.clauses().forEach(clause -> store.saveClause(document.id(), clause));
        store.saveRfc(document.rfc());
    }

    private static boolean hasCode(TransitionResult result, DiagnosticCode code) {
        return result.diagnostics().stream().anyMatch(d -> d.code() == code);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Creation
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("creation")
    class Creation {

        @Test
        @DisplayName("a new RFC is a draft in spec with an initial changelog entry")
        void createsRfc() {
            Rfc rfc = lifecycle.createRfc("Storage", List.of("ana"));

            assertEquals("RFC-0001", rfc.id());
            assertEquals(RfcStatus.DRAFT, rfc.status());
            assertEquals("0.1.0", rfc.version());
            assertEquals(TODAY, rfc.created());
            assertEquals("Initial draft", rfc.changelog().get(0).summary());
            assertEquals("RFC-0002", lifecycle.createRfc("Second", List.of()).id());
        }

        @Test
        @DisplayName("a new clause is appended to the named section")
        void createsClause() {
            lifecycle.createRfc("Storage", List.of());

            Clause clause = lifecycle.createClause("RFC-0001", "scope", "Scope", "specification", null);

            assertEquals("C-SCOPE", clause.id());
            assertEquals(LifecycleService.CLAUSE_PLACEHOLDER, clause.text());
            RfcDocument document = store.getRfc("RFC-0001").orElseThrow();
            assertEquals(List.of("C-SCOPE"), document.rfc().sections().get(1).clauses());
            assertTrue(document.clause("C-SCOPE").isPresent());
        }

        @Test
        @DisplayName("an unknown section is created at the end")
        void createsSection() {
            lifecycle.createRfc("Storage", List.of());

            lifecycle.createClause("RFC-0001", "C-LIMITS", "Limits", "Constraints", null);

            RfcDocument document = store.getRfc("RFC-0001").orElseThrow();
            assertEquals("Constraints", document.rfc().sections().get(2).title());
        }

        @Test
        @DisplayName("duplicate and malformed clause ids are rejected")
        void rejectsClauseIds() {
            lifecycle.createRfc("Storage", List.of());
            lifecycle.createClause("RFC-0001", "C-A", "A", "Specification", null);

            assertThrows(EditRejectedException.class,
                    () -> lifecycle.createClause("RFC-0001", "c-a", "Again", "Specification", null));
            assertThrows(EditRejectedException.class,
                    () -> lifecycle.createClause("RFC-0001", "C-!", "Bad", "Specification", null));
            assertThrows(EditRejectedException.class,
                    () -> lifecycle.createClause("RFC-0404", "C-B", "B", "Specification", null));
        }

        @Test
        @DisplayName("ADRs start proposed and work items start queued")
        void createsAdrAndWorkItem() {
            Adr adr = lifecycle.createAdr("Use JSON");
            WorkItem item = lifecycle.createWorkItem("Fix typo");

            assertEquals("ADR-0001", adr.id());
            assertEquals(AdrStatus.PROPOSED, adr.status());
            assertEquals("WI-0001", item.id());
            assertEquals(WorkItemStatus.QUEUE, item.status());
            assertThrows(EditRejectedException.class, () -> lifecycle.createWorkItem(" "));
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // Transitions
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("transition")
    class Transition {

        @Test
        @DisplayName("a work item cannot be done until its criteria are ticked")
        void workItemWalkthrough() {
            String id = lifecycle.createWorkItem("Fix typo").id();
            editor.addToField(id, "acceptance_criteria", "chore: tests pass");

            assertTrue(lifecycle.transition(id, "active").applied());

            TransitionResult blocked = lifecycle.transition(id, "done");
            assertFalse(blocked.applied());
            assertTrue(hasCode(blocked, DiagnosticCode.ACCEPTANCE_CRITERIA_INCOMPLETE));
            assertEquals(WorkItemStatus.ACTIVE, store.getWorkItem(id).orElseThrow().status());

            editor.tick(id, "acceptance_criteria", "tests pass", MatchOptions.defaults(), ChecklistStatus.DONE);
            assertTrue(lifecycle.transition(id, "done").applied());

            WorkItem done = store.getWorkItem(id).orElseThrow();
            assertEquals(WorkItemStatus.DONE, done.status());
            assertEquals(TODAY, done.started());
            assertEquals(TODAY, done.completed());
        }

        @Test
        @DisplayName("edges not in the lifecycle are rejected")
        void invalidEdge() {
            String id = lifecycle.createWorkItem("Skip ahead").id();

            TransitionResult result = lifecycle.transition(id, "done");

            assertTrue(hasCode(result, DiagnosticCode.INVALID_TRANSITION));
            assertTrue(hasCode(lifecycle.transition(id, "finished"), DiagnosticCode.INVALID_TRANSITION));
        }

        @Test
        @DisplayName("unknown artifacts are reported, not thrown")
        void unknownArtifact() {
            TransitionResult result = lifecycle.transition("WI-0404", "active");

            assertFalse(result.applied());
            assertTrue(hasCode(result, DiagnosticCode.ARTIFACT_NOT_FOUND));
        }

        @Test
        @DisplayName("a draft RFC cannot leave spec, and going normative records its signature")
        void rfcLifecycle() {
            lifecycle.createRfc("Storage", List.of());

            assertTrue(hasCode(lifecycle.transition("RFC-0001", "impl"), DiagnosticCode.FORBIDDEN_STATUS_PHASE));
            assertTrue(lifecycle.transition("RFC-0001", "normative").applied());

            RfcDocument document = store.getRfc("RFC-0001").orElseThrow();
            assertEquals(RfcStatus.NORMATIVE, document.rfc().status());
            assertEquals(signer.contentSignature(document), document.rfc().releasedSignature());

            assertTrue(lifecycle.transition("RFC-0001", "impl").applied());
            assertEquals(RfcPhase.IMPL, store.getRfc("RFC-0001").orElseThrow().rfc().phase());
        }

        @Test
        @DisplayName("superseded is reached through supersede only")
        void supersededNeedsSuccessor() {
            seed(Fixtures.draftRfc("RFC-0001", Fixtures.clause("C-A", "a")));
            store.saveAdr(Fixtures.adr("ADR-0001", AdrStatus.ACCEPTED));

            assertTrue(hasCode(lifecycle.transition("RFC-0001:C-A", "superseded"),
                    DiagnosticCode.SUPERSEDED_BY_INVALID));
            assertTrue(hasCode(lifecycle.transition("ADR-0001", "superseded"),
                    DiagnosticCode.SUPERSEDED_BY_INVALID));
        }

        @Test
        @DisplayName("clauses can be deprecated")
        void deprecatesClause() {
            seed(Fixtures.draftRfc("RFC-0001", Fixtures.clause("C-A", "a")));

            assertTrue(lifecycle.transition("RFC-0001:C-A", "deprecated").applied());

            Clause clause = store.getRfc("RFC-0001").orElseThrow().clause("C-A").orElseThrow();
            assertEquals(ClauseStatus.DEPRECATED, clause.status());
        }

        @Test
        @DisplayName("outcomes are counted")
        void metrics() {
            lifecycle.createWorkItem("Count me");
            lifecycle.transition("WI-0001", "active");
            lifecycle.transition("WI-0001", "queue");

            assertEquals(1.0, registry.get("charter.transitions.total")
                    .tag("kind", "work").tag("outcome", "applied").counter().count());
            assertEquals(1.0, registry.get("charter.transitions.total")
                    .tag("kind", "work").tag("outcome", "rejected").counter().count());
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // Supersession
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("supersede")
    class Supersede {

        @BeforeEach
        void seedArtifacts() {
            seed(Fixtures.rfc("RFC-0001", RfcStatus.NORMATIVE, RfcPhase.SPEC,
                    Fixtures.clause("C-OLD", "old"), Fixtures.clause("C-NEW", "new")));
            seed(Fixtures.draftRfc("RFC-0002", Fixtures.clause("C-OTHER", "other")));
        }

        @Test
        @DisplayName("a clause points at its active successor")
        void supersedesClause() {
            TransitionResult result = lifecycle.supersede("RFC-0001:C-OLD", "RFC-0001:C-NEW");

            assertTrue(result.applied());
            Clause old = store.getRfc("RFC-0001").orElseThrow().clause("C-OLD").orElseThrow();
            assertEquals(ClauseStatus.SUPERSEDED, old.status());
            assertEquals("C-NEW", old.supersededBy());
        }

        @Test
        @DisplayName("successors must be another active clause of the same RFC")
        void rejectsClauseSuccessors() {
            assertTrue(hasCode(lifecycle.supersede("RFC-0001:C-OLD", "C-OLD"), DiagnosticCode.SUPERSEDED_BY_INVALID));
            assertTrue(hasCode(lifecycle.supersede("RFC-0001:C-OLD", "RFC-0002:C-OTHER"),
                    DiagnosticCode.SUPERSEDED_BY_INVALID));
            assertTrue(hasCode(lifecycle.supersede("RFC-0001:C-OLD", "C-MISSING"),
                    DiagnosticCode.SUPERSEDED_BY_INVALID));

            lifecycle.supersede("RFC-0001:C-NEW", "C-OLD");
            assertTrue(hasCode(lifecycle.supersede("RFC-0001:C-OLD", "C-NEW"), DiagnosticCode.SUPERSEDED_BY_INVALID));
        }

        @Test
        @DisplayName("an accepted ADR can be superseded by a live ADR")
        void supersedesAdr() {
            store.saveAdr(Fixtures.adr("ADR-0001", AdrStatus.ACCEPTED));
            store.saveAdr(Fixtures.adr("ADR-0002", AdrStatus.PROPOSED));
            store.saveAdr(Fixtures.adr("ADR-0003", AdrStatus.REJECTED));

            assertTrue(hasCode(lifecycle.supersede("ADR-0001", "ADR-0003"), DiagnosticCode.SUPERSEDED_BY_INVALID));
            assertTrue(lifecycle.supersede("ADR-0001", "ADR-0002").applied());

            Adr adr = store.getAdr("ADR-0001").orElseThrow();
            assertEquals(AdrStatus.SUPERSEDED, adr.status());
            assertEquals("ADR-0002", adr.supersededBy());
        }

        @Test
        @DisplayName("a proposed ADR cannot be superseded")
        void proposedAdr() {
            store.saveAdr(Fixtures.adr("ADR-0001", AdrStatus.PROPOSED));
            store.saveAdr(Fixtures.adr("ADR-0002", AdrStatus.ACCEPTED));

            assertTrue(hasCode(lifecycle.supersede("ADR-0001", "ADR-0002"), DiagnosticCode.INVALID_TRANSITION));
        }

        @Test
        @DisplayName("work items have no successors")
        void workItem() {
            store.saveWorkItem(Fixtures.workItem("WI-0001", WorkItemStatus.QUEUE));
            store.saveWorkItem(Fixtures.workItem("WI-0002", WorkItemStatus.QUEUE));

            assertTrue(hasCode(lifecycle.supersede("WI-0001", "WI-0002"), DiagnosticCode.INVALID_TRANSITION));
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // Versions and releases
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("bump and release")
    class BumpAndRelease {

        @Test
        @DisplayName("bump prepends a changelog entry, stamps since and records the signature")
        void bump() {
            lifecycle.createRfc("Storage", List.of());
            lifecycle.createClause("RFC-0001", "C-SCOPE", "Scope", "Specification", null);
            lifecycle.transition("RFC-0001", "normative");

            String version = lifecycle.bump("RFC-0001", BumpLevel.MINOR, "Add scope", List.of("New C-SCOPE"));

            assertEquals("0.2.0", version);
            RfcDocument document = store.getRfc("RFC-0001").orElseThrow();
            assertEquals("0.2.0", document.rfc().version());
            assertEquals("Add scope", document.rfc().changelog().get(0).summary());
            assertEquals(2, document.rfc().changelog().size());
            assertEquals("0.2.0", document.clause("C-SCOPE").orElseThrow().since());
            assertEquals(signer.contentSignature(document), document.rfc().releasedSignature());
        }

        @Test
        @DisplayName("bump needs a summary and an editable RFC")
        void bumpRejections() {
            seed(Fixtures.rfc("RFC-0001", RfcStatus.DEPRECATED, RfcPhase.STABLE));

            assertThrows(EditRejectedException.class,
                    () -> lifecycle.bump("RFC-0001", BumpLevel.PATCH, "", List.of()));
            assertThrows(EditRejectedException.class,
                    () -> lifecycle.bump("RFC-0001", BumpLevel.PATCH, "Too late", List.of()));
        }

        @Test
        @DisplayName("release collects every done work item not yet shipped")
        void release() {
            store.saveWorkItem(Fixtures.workItem("WI-0001", WorkItemStatus.DONE, Fixtures.done("fix: a")));
            store.saveWorkItem(Fixtures.workItem("WI-0002", WorkItemStatus.ACTIVE, Fixtures.pending("add: b")));

            Release release = lifecycle.release("1.0.0", null);

            assertEquals(new Release("1.0.0", TODAY, List.of("WI-0001")), release);
            assertEquals(release, store.loadReleases().releases().get(0));
            assertThrows(EditRejectedException.class, () -> lifecycle.release("1.1.0", null),
                    "nothing left to ship");
        }

        @Test
        @DisplayName("release versions must be valid, new and increasing")
        void releaseRejections() {
            store.saveWorkItem(Fixtures.workItem("WI-0001", WorkItemStatus.DONE, Fixtures.done("fix: a")));
            lifecycle.release("1.0.0", LocalDate.of(2026, 4, 1));
            store.saveWorkItem(Fixtures.workItem("WI-0002", WorkItemStatus.DONE, Fixtures.done("fix: b")));

            assertThrows(EditRejectedException.class, () -> lifecycle.release("v2", null));
            assertThrows(EditRejectedException.class, () -> lifecycle.release("1.0.0", null));
            assertThrows(EditRejectedException.class, () -> lifecycle.release("0.9.0", null));
            assertEquals(List.of("WI-0002"), lifecycle.release("1.0.1", null).refs());
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // Deletion
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("a referenced clause is protected")
        void protectedClause() {
            seed(Fixtures.draftRfc("RFC-0001", Fixtures.clause("C-A", "a"), Fixtures.clause("C-B", "b")));
            store.saveAdr(Fixtures.adr("ADR-0001", AdrStatus.PROPOSED, "RFC-0001:C-A"));

            TransitionResult result = lifecycle.delete("RFC-0001:C-A");

            assertFalse(result.applied());
            assertTrue(hasCode(result, DiagnosticCode.REFERENCE_PROTECTED));
            assertTrue(store.getRfc("RFC-0001").orElseThrow().clause("C-A").isPresent());
        }

        @Test
        @DisplayName("an inline mention does not protect, it is reported as stale")
        void mentionedWorkItem() {
            store.saveWorkItem(Fixtures.workItem("WI-0001", WorkItemStatus.QUEUE));
            lifecycle.createWorkItem("Follow-up");
            editor.setField("WI-0002", "description", "see [[WI-0001]]");

            TransitionResult result = lifecycle.delete("WI-0001");

            assertTrue(result.applied());
            assertTrue(store.getWorkItem("WI-0001").isEmpty());
            assertEquals(1, result.diagnostics().size());
            assertEquals(DiagnosticCode.STALE_REFERENCE, result.diagnostics().get(0).code());
            assertEquals("WI-0002", result.diagnostics().get(0).artifactId());
        }

        @Test
        @DisplayName("an unreferenced clause of a draft is removed and tombstoned")
        void deletesClause() {
            seed(Fixtures.draftRfc("RFC-0001", Fixtures.clause("C-A", "a"), Fixtures.clause("C-B", "b")));

            assertTrue(lifecycle.delete("RFC-0001:C-B").applied());

            RfcDocument document = store.getRfc("RFC-0001").orElseThrow();
            assertTrue(document.clause("C-B").isEmpty());
            assertEquals(List.of("C-A"), document.rfc().sections().get(0).clauses());
            assertTrue(store.loadTombstones().contains("RFC-0001:C-B"));
            assertThrows(EditRejectedException.class,
                    () -> lifecycle.createClause("RFC-0001", "C-B", "Again", "Specification", null));
        }

        @Test
        @DisplayName("clauses of a normative RFC are append-only")
        void normativeClause() {
            seed(Fixtures.rfc("RFC-0001", RfcStatus.NORMATIVE, RfcPhase.SPEC,
                    Fixtures.clause("C-A", "a")));

            assertTrue(hasCode(lifecycle.delete("RFC-0001:C-A"), DiagnosticCode.DELETE_NOT_ALLOWED));
        }

        @Test
        @DisplayName("only queued work items can be deleted, and their ids are not reused")
        void workItems() {
            store.saveWorkItem(Fixtures.workItem("WI-0001", WorkItemStatus.ACTIVE));
            store.saveWorkItem(Fixtures.workItem("WI-0002", WorkItemStatus.QUEUE));

            assertTrue(hasCode(lifecycle.delete("WI-0001"), DiagnosticCode.DELETE_NOT_ALLOWED));
            assertTrue(lifecycle.delete("WI-0002").applied());
            assertTrue(store.getWorkItem("WI-0002").isEmpty());
            assertEquals("WI-0003", lifecycle.createWorkItem("Next").id());
        }

        @Test
        @DisplayName("RFCs and ADRs are never deleted")
        void appendOnly() {
            seed(Fixtures.draftRfc("RFC-0001"));
            store.saveAdr(Fixtures.adr("ADR-0001", AdrStatus.PROPOSED));

            assertTrue(hasCode(lifecycle.delete("RFC-0001"), DiagnosticCode.DELETE_NOT_ALLOWED));
            assertTrue(hasCode(lifecycle.delete("ADR-0001"), DiagnosticCode.DELETE_NOT_ALLOWED));
        }
    }
}
