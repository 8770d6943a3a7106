package com.charter.core.lifecycle;

import com.charter.core.diagnostic.Diagnostic;
import com.charter.core.diagnostic.DiagnosticCode;
import com.charter.core.edit.EditRejectedException;
import com.charter.core.ids.IdStrategy;
import com.charter.core.logging.MdcContext;
import com.charter.core.metrics.CharterMetrics;
import com.charter.core.model.Adr;
import com.charter.core.model.AdrStatus;
import com.charter.core.model.ArtifactKind;
import com.charter.core.model.BumpLevel;
import com.charter.core.model.ChangelogEntry;
import com.charter.core.model.Clause;
import com.charter.core.model.ClauseKind;
import com.charter.core.model.ClauseStatus;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.Release;
import com.charter.core.model.Rfc;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.RfcPhase;
import com.charter.core.model.RfcStatus;
import com.charter.core.model.Section;
import com.charter.core.model.SemanticVersion;
import com.charter.core.model.WorkItem;
import com.charter.core.model.WorkItemStatus;
import com.charter.core.refs.ReferenceIndex;
import com.charter.core.refs.ReferenceResolver;
import com.charter.core.signature.CanonicalSigner;
import com.charter.core.store.ArtifactStore;
import com.charter.core.validation.AmendmentPolicy;
import com.charter.core.validation.StateMachineValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Creates artifacts and moves them through their lifecycles.
 * <p>
 * Every change is checked by the {@link StateMachineValidator} against a freshly
 * loaded snapshot before anything is written; a rejected change writes nothing.
 * When a change spans several files, child records are written before the parent
 * that lists them, and a parent stops listing a child before the child is removed.
 */
@Service
public class LifecycleService {

    private static final Logger log = LoggerFactory.getLogger(LifecycleService.class);

    static final String INITIAL_VERSION = "0.1.0";
    static final String CLAUSE_PLACEHOLDER = "To be written.";
    private static final Pattern CLAUSE_ID = Pattern.compile("C-[A-Z0-9][A-Z0-9_-]*");

    private final ArtifactStore store;
    private final StateMachineValidator validator;
    private final ReferenceResolver resolver;
    private final CanonicalSigner signer;
    private final IdStrategy ids;
    private final CharterMetrics metrics;
    private final Clock clock;

    public LifecycleService(ArtifactStore store, StateMachineValidator validator, ReferenceResolver resolver,
                            CanonicalSigner signer, IdStrategy ids, CharterMetrics metrics, Clock clock) {
        this.store = store;
        this.validator = validator;
        this.resolver = resolver;
        this.signer = signer;
        this.ids = ids;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ── Creation ─────────────────────────────────────────────────

    public Rfc createRfc(String title, List<String> owners) {
        requireText("RFC", "title", title);
        GovernanceIndex index = store.loadIndex();
        LocalDate today = today();
        String id = ids.nextId(ArtifactKind.RFC, index);
        Rfc rfc = new Rfc(id, title.strip(), INITIAL_VERSION, RfcStatus.DRAFT, RfcPhase.SPEC, owners,
                today, today,
                List.of(new Section("Summary", List.of()), new Section("Specification", List.of())),
                List.of(new ChangelogEntry(INITIAL_VERSION, today, "Initial draft", List.of())),
                null);
        store.saveRfc(rfc);
        log.info("Created {}: {}", id, rfc.title());
        return rfc;
    }

    /**
     * Adds a clause to an RFC and lists it at the end of a section, creating the
     * section when no section has that title.
     *
     * @param clauseName clause id such as {@code C-SCOPE}; the {@code C-} prefix is added when missing
     */
    public Clause createClause(String rfcId, String clauseName, String title, String sectionTitle, ClauseKind kind) {
        requireText(rfcId, "clause title", title);
        requireText(rfcId, "section", sectionTitle);
        GovernanceIndex index = store.loadIndex();
        RfcDocument document = index.rfc(rfcId)
                .orElseThrow(() -> new EditRejectedException(rfcId, "no such RFC"));
        AmendmentPolicy.rfcLock(document.rfc()).ifPresent(reason -> {
            throw new EditRejectedException(rfcId, reason);
        });

        String clauseId = normalizeClauseId(rfcId, clauseName);
        String qualified = ArtifactKind.qualifyClause(rfcId, clauseId);
        if (document.clause(clauseId).isPresent() || document.rfc().clauseIds().contains(clauseId)) {
            throw new EditRejectedException(rfcId, "clause " + clauseId + " already exists");
        }
        if (index.tombstones().contains(qualified)) {
            throw new EditRejectedException(rfcId, "clause id " + clauseId + " belonged to a deleted clause");
        }

        Clause clause = new Clause(clauseId, title.strip(), kind == null ? ClauseKind.NORMATIVE : kind,
                ClauseStatus.ACTIVE, CLAUSE_PLACEHOLDER, null, null);
        List<Section> sections = new ArrayList<>();
        boolean placed = false;
        for (Section section : document.rfc().sections()) {
            if (!placed && section.title().equalsIgnoreCase(sectionTitle.strip())) {
                List<String> clauses = new ArrayList<>(section.clauses());
                clauses.add(clauseId);
                sections.add(section.withClauses(clauses));
                placed = true;
            } else {
                sections.add(section);
            }
        }
        if (!placed) {
            sections.add(new Section(sectionTitle.strip(), List.of(clauseId)));
        }

        store.saveClause(rfcId, clause);
        store.saveRfc(document.rfc().withSections(sections).withUpdated(today()));
        log.info("Created clause {}", qualified);
        return clause;
    }

    public Adr createAdr(String title) {
        requireText("ADR", "title", title);
        GovernanceIndex index = store.loadIndex();
        String id = ids.nextId(ArtifactKind.ADR, index);
        Adr adr = new Adr(id, title.strip(), AdrStatus.PROPOSED, today(), "", "", "",
                List.of(), List.of(), null);
        store.saveAdr(adr);
        log.info("Created {}: {}", id, adr.title());
        return adr;
    }

    public WorkItem createWorkItem(String title) {
        requireText("WI", "title", title);
        GovernanceIndex index = store.loadIndex();
        String id = ids.nextId(ArtifactKind.WORK_ITEM, index);
        WorkItem item = new WorkItem(id, title.strip(), WorkItemStatus.QUEUE, today(), null, null, "",
                List.of(), List.of(), List.of());
        store.saveWorkItem(item);
        log.info("Created {}: {}", id, item.title());
        return item;
    }

    // ── Transitions ──────────────────────────────────────────────

    /**
     * Moves an artifact to a new status, or an RFC to a new phase. The target is the
     * lowercase state name, e.g. {@code normative}, {@code impl}, {@code done}.
     */
    public TransitionResult transition(String artifactId, String target) {
        MdcContext.setArtifact(artifactId, "transition");
        try {
            GovernanceIndex index = store.loadIndex();
            ArtifactKind kind = ArtifactKind.ofId(artifactId);
            if (kind == null || !index.contains(artifactId)) {
                return record(kind, notFound(artifactId));
            }
            TransitionResult result = switch (kind) {
                case RFC -> transitionRfc(index.rfc(artifactId).orElseThrow(), target);
                case CLAUSE -> transitionClause(index, artifactId, target);
                case ADR -> transitionAdr(index.adr(artifactId).orElseThrow(), target);
                case WORK_ITEM -> transitionWorkItem(index.workItem(artifactId).orElseThrow(), target);
            };
            if (result.applied()) {
                log.info("{} moved to {}", artifactId, target);
            } else {
                log.info("{} cannot move to {}: {} problem(s)", artifactId, target, result.diagnostics().size());
            }
            return record(kind, result);
        } finally {
            MdcContext.clear();
        }
    }

    private TransitionResult transitionRfc(RfcDocument document, String target) {
        Rfc rfc = document.rfc();
        Optional<RfcStatus> status = parse(target, RfcStatus::fromId);
        if (status.isPresent()) {
            List<Diagnostic> diagnostics = validator.checkRfcStatus(rfc, status.get());
            if (hasErrors(diagnostics)) {
                return TransitionResult.rejected(rfc.id(), diagnostics);
            }
            Rfc moved = rfc.withStatus(status.get()).withUpdated(today());
            if (status.get() == RfcStatus.NORMATIVE) {
                moved = moved.withReleasedSignature(signer.contentSignature(document.withRfc(moved)));
            }
            store.saveRfc(moved);
            return TransitionResult.applied(rfc.id(), diagnostics);
        }
        Optional<RfcPhase> phase = parse(target, RfcPhase::fromId);
        if (phase.isPresent()) {
            List<Diagnostic> diagnostics = validator.checkRfcPhase(rfc, phase.get());
            if (hasErrors(diagnostics)) {
                return TransitionResult.rejected(rfc.id(), diagnostics);
            }
            store.saveRfc(rfc.withPhase(phase.get()).withUpdated(today()));
            return TransitionResult.applied(rfc.id(), diagnostics);
        }
        return TransitionResult.rejected(rfc.id(), unknownTarget(rfc.id(), target));
    }

    private TransitionResult transitionClause(GovernanceIndex index, String qualifiedId, String target) {
        RfcDocument document = index.rfc(rfcIdOf(qualifiedId)).orElseThrow();
        Clause clause = index.clause(qualifiedId).orElseThrow();
        Optional<ClauseStatus> status = parse(target, ClauseStatus::fromId);
        if (status.isEmpty()) {
            return TransitionResult.rejected(qualifiedId, unknownTarget(qualifiedId, target));
        }
        if (status.get() == ClauseStatus.SUPERSEDED) {
            return TransitionResult.rejected(qualifiedId, Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID,
                    qualifiedId, "a clause is superseded by naming its successor; use supersede"));
        }
        Optional<String> lock = AmendmentPolicy.rfcLock(document.rfc());
        if (lock.isPresent()) {
            return TransitionResult.rejected(qualifiedId,
                    Diagnostic.of(DiagnosticCode.INVALID_TRANSITION, qualifiedId, lock.get()));
        }
        List<Diagnostic> diagnostics = validator.checkClauseStatus(qualifiedId, clause, status.get());
        if (hasErrors(diagnostics)) {
            return TransitionResult.rejected(qualifiedId, diagnostics);
        }
        store.saveClause(document.id(), clause.withStatus(status.get()));
        store.saveRfc(document.rfc().withUpdated(today()));
        return TransitionResult.applied(qualifiedId, diagnostics);
    }

    private TransitionResult transitionAdr(Adr adr, String target) {
        Optional<AdrStatus> status = parse(target, AdrStatus::fromId);
        if (status.isEmpty()) {
            return TransitionResult.rejected(adr.id(), unknownTarget(adr.id(), target));
        }
        if (status.get() == AdrStatus.SUPERSEDED) {
            return TransitionResult.rejected(adr.id(), Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID,
                    adr.id(), "an ADR is superseded by naming its successor; use supersede"));
        }
        List<Diagnostic> diagnostics = validator.checkAdrStatus(adr, status.get());
        if (hasErrors(diagnostics)) {
            return TransitionResult.rejected(adr.id(), diagnostics);
        }
        store.saveAdr(adr.withStatus(status.get()));
        return TransitionResult.applied(adr.id(), diagnostics);
    }

    private TransitionResult transitionWorkItem(WorkItem item, String target) {
        Optional<WorkItemStatus> status = parse(target, WorkItemStatus::fromId);
        if (status.isEmpty()) {
            return TransitionResult.rejected(item.id(), unknownTarget(item.id(), target));
        }
        List<Diagnostic> diagnostics = validator.checkWorkItemStatus(item, status.get());
        if (hasErrors(diagnostics)) {
            return TransitionResult.rejected(item.id(), diagnostics);
        }
        store.saveWorkItem(item.moveTo(status.get(), today()));
        return TransitionResult.applied(item.id(), diagnostics);
    }

    // ── Supersession ─────────────────────────────────────────────

    /**
     * Marks a clause or ADR as superseded by a successor of the same kind. A clause
     * can only be superseded by an active clause of the same RFC.
     */
    public TransitionResult supersede(String artifactId, String successorId) {
        MdcContext.setArtifact(artifactId, "supersede");
        try {
            GovernanceIndex index = store.loadIndex();
            ArtifactKind kind = ArtifactKind.ofId(artifactId);
            if (kind == null || !index.contains(artifactId)) {
                return record(kind, notFound(artifactId));
            }
            TransitionResult result = switch (kind) {
                case CLAUSE -> supersedeClause(index, artifactId, successorId);
                case ADR -> supersedeAdr(index, index.adr(artifactId).orElseThrow(), successorId);
                default -> TransitionResult.rejected(artifactId, Diagnostic.of(DiagnosticCode.INVALID_TRANSITION,
                        artifactId, "only clauses and ADRs can be superseded"));
            };
            if (result.applied()) {
                log.info("{} superseded by {}", artifactId, successorId);
            }
            return record(kind, result);
        } finally {
            MdcContext.clear();
        }
    }

    private TransitionResult supersedeClause(GovernanceIndex index, String qualifiedId, String successorId) {
        String rfcId = rfcIdOf(qualifiedId);
        RfcDocument document = index.rfc(rfcId).orElseThrow();
        Clause clause = index.clause(qualifiedId).orElseThrow();
        String successorLocal = successorId.startsWith(rfcId + ArtifactKind.CLAUSE_SEPARATOR)
                ? successorId.substring(rfcId.length() + 1)
                : successorId;
        if (successorLocal.indexOf(ArtifactKind.CLAUSE_SEPARATOR) >= 0) {
            return TransitionResult.rejected(qualifiedId, Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID,
                    qualifiedId, "successor " + successorId + " belongs to another RFC"));
        }
        if (successorLocal.equals(clause.id())) {
            return TransitionResult.rejected(qualifiedId, Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID,
                    qualifiedId, "clause cannot supersede itself"));
        }
        Optional<Clause> successor = document.clause(successorLocal);
        if (successor.isEmpty() || !successor.get().status().isActive()) {
            return TransitionResult.rejected(qualifiedId, Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID,
                    qualifiedId, "successor " + successorLocal + " is not an active clause of " + rfcId));
        }
        Optional<String> lock = AmendmentPolicy.rfcLock(document.rfc());
        if (lock.isPresent()) {
            return TransitionResult.rejected(qualifiedId,
                    Diagnostic.of(DiagnosticCode.INVALID_TRANSITION, qualifiedId, lock.get()));
        }
        List<Diagnostic> diagnostics = validator.checkClauseStatus(qualifiedId, clause, ClauseStatus.SUPERSEDED);
        if (hasErrors(diagnostics)) {
            return TransitionResult.rejected(qualifiedId, diagnostics);
        }
        store.saveClause(rfcId, clause.withSupersededBy(successorLocal));
        store.saveRfc(document.rfc().withUpdated(today()));
        return TransitionResult.applied(qualifiedId, diagnostics);
    }

    private TransitionResult supersedeAdr(GovernanceIndex index, Adr adr, String successorId) {
        Optional<Adr> successor = index.adr(successorId);
        if (successor.isEmpty() || successorId.equals(adr.id())) {
            return TransitionResult.rejected(adr.id(), Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID,
                    adr.id(), "successor " + successorId + " is not another existing ADR"));
        }
        AdrStatus successorStatus = successor.get().status();
        if (successorStatus == AdrStatus.REJECTED || successorStatus == AdrStatus.SUPERSEDED) {
            return TransitionResult.rejected(adr.id(), Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID,
                    adr.id(), "successor " + successorId + " is " + successorStatus));
        }
        List<Diagnostic> diagnostics = validator.checkAdrStatus(adr, AdrStatus.SUPERSEDED);
        if (hasErrors(diagnostics)) {
            return TransitionResult.rejected(adr.id(), diagnostics);
        }
        store.saveAdr(adr.withSupersededBy(successorId));
        return TransitionResult.applied(adr.id(), diagnostics);
    }

    // ── Versions and releases ────────────────────────────────────

    /**
     * Records a new RFC version: bumps the version, prepends a changelog entry, stamps
     * {@code since} on clauses that have none and records the released signature.
     *
     * @return the new version
     */
    public String bump(String rfcId, BumpLevel level, String summary, List<String> changes) {
        MdcContext.setArtifact(rfcId, "bump");
        try {
            requireText(rfcId, "summary", summary);
            GovernanceIndex index = store.loadIndex();
            RfcDocument document = index.rfc(rfcId)
                    .orElseThrow(() -> new EditRejectedException(rfcId, "no such RFC"));
            AmendmentPolicy.rfcLock(document.rfc()).ifPresent(reason -> {
                throw new EditRejectedException(rfcId, reason);
            });
            SemanticVersion current = SemanticVersion.parse(document.rfc().version())
                    .orElseThrow(() -> new EditRejectedException(rfcId,
                            "current version '" + document.rfc().version() + "' is not a semantic version"));
            String next = current.bump(level).toString();
            LocalDate today = today();

            RfcDocument bumped = document.withRfc(document.rfc().withRelease(next,
                    new ChangelogEntry(next, today, summary.strip(), changes == null ? List.of() : changes), today));
            List<Clause> stamped = new ArrayList<>();
            for (Clause clause : document.clauses()) {
                if (clause.since() == null) {
                    Clause withSince = clause.withSince(next);
                    stamped.add(withSince);
                    bumped = bumped.withClause(withSince);
                }
            }
            Rfc rfc = bumped.rfc().withReleasedSignature(signer.contentSignature(bumped));

            for (Clause clause : stamped) {
                store.saveClause(rfcId, clause);
            }
            store.saveRfc(rfc);
            log.info("Bumped {} {} -> {}", rfcId, current, next);
            return next;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Cuts a release containing every done work item not yet released.
     *
     * @throws EditRejectedException if the version is malformed, not newer than the
     *                               latest release, or nothing is ready to ship
     */
    public Release release(String version, LocalDate date) {
        MdcContext.setArtifact(version, "release");
        try {
            SemanticVersion parsed = SemanticVersion.parse(version)
                    .orElseThrow(() -> new EditRejectedException(version, "not a semantic version"));
            GovernanceIndex index = store.loadIndex();
            if (index.releases().find(parsed.toString()).isPresent()) {
                throw new EditRejectedException(version, "release already exists");
            }
            Optional<SemanticVersion> latest = index.releases().releases().stream()
                    .map(Release::version)
                    .map(SemanticVersion::parse)
                    .flatMap(Optional::stream)
                    .max(SemanticVersion::compareTo);
            if (latest.isPresent() && parsed.compareTo(latest.get()) <= 0) {
                throw new EditRejectedException(version, "must be newer than latest release " + latest.get());
            }
            List<String> shipped = index.workItems().stream()
                    .filter(item -> item.status() == WorkItemStatus.DONE)
                    .map(WorkItem::id)
                    .filter(id -> !index.releases().isReleased(id))
                    .toList();
            if (shipped.isEmpty()) {
                throw new EditRejectedException(version, "no completed work items to release");
            }
            Release release = new Release(parsed.toString(), date == null ? today() : date, shipped);
            store.saveReleases(index.releases().prepend(release));
            log.info("Released {} with {} work items", release.version(), shipped.size());
            return release;
        } finally {
            MdcContext.clear();
        }
    }

    // ── Deletion ─────────────────────────────────────────────────

    /**
     * Hard-deletes a clause of a draft RFC or a queued work item. Anything still named
     * in another artifact's {@code refs} or {@code superseded_by} is protected; inline
     * mentions are reported back as stale. Deleted ids are tombstoned.
     */
    public TransitionResult delete(String artifactId) {
        MdcContext.setArtifact(artifactId, "delete");
        try {
            GovernanceIndex index = store.loadIndex();
            ArtifactKind kind = ArtifactKind.ofId(artifactId);
            if (kind == null || !index.contains(artifactId)) {
                return record(kind, notFound(artifactId));
            }
            Optional<Diagnostic> notAllowed = switch (kind) {
                case CLAUSE -> index.rfc(rfcIdOf(artifactId))
                        .filter(doc -> doc.rfc().status() != RfcStatus.DRAFT)
                        .map(doc -> Diagnostic.of(DiagnosticCode.DELETE_NOT_ALLOWED, artifactId,
                                "clauses can only be deleted while the RFC is draft; " + doc.id() + " is "
                                        + doc.rfc().status()));
                case WORK_ITEM -> index.workItem(artifactId)
                        .filter(item -> item.status() != WorkItemStatus.QUEUE)
                        .map(item -> Diagnostic.of(DiagnosticCode.DELETE_NOT_ALLOWED, artifactId,
                                "only queued work items can be deleted; status is " + item.status()));
                default -> Optional.of(Diagnostic.of(DiagnosticCode.DELETE_NOT_ALLOWED, artifactId,
                        kind + " artifacts are append-only"));
            };
            if (notAllowed.isPresent()) {
                return record(kind, TransitionResult.rejected(artifactId, notAllowed.get()));
            }

            ReferenceIndex refs = resolver.index(index);
            Set<String> incoming = refs.incoming(artifactId);
            if (!incoming.isEmpty()) {
                return record(kind, TransitionResult.rejected(artifactId, Diagnostic.of(
                        DiagnosticCode.REFERENCE_PROTECTED, artifactId,
                        "still referenced by " + String.join(", ", incoming))));
            }

            List<Diagnostic> stale = refs.mentioners(artifactId).stream()
                    .filter(owner -> !owner.equals(artifactId))
                    .map(owner -> Diagnostic.of(DiagnosticCode.STALE_REFERENCE, owner,
                            "mentions deleted artifact " + artifactId))
                    .toList();

            if (kind == ArtifactKind.CLAUSE) {
                deleteClause(index, artifactId);
            } else {
                store.deleteWorkItem(artifactId);
            }
            store.saveTombstones(index.tombstones().add(artifactId));
            log.info("Deleted {} ({} stale mention(s) left)", artifactId, stale.size());
            return record(kind, TransitionResult.applied(artifactId, stale));
        } finally {
            MdcContext.clear();
        }
    }

    private void deleteClause(GovernanceIndex index, String qualifiedId) {
        String rfcId = rfcIdOf(qualifiedId);
        String clauseId = qualifiedId.substring(rfcId.length() + 1);
        RfcDocument document = index.rfc(rfcId).orElseThrow();
        List<Section> sections = document.rfc().sections().stream()
                .map(section -> section.withClauses(
                        section.clauses().stream().filter(id -> !id.equals(clauseId)).toList()))
                .toList();
        // parent stops listing the clause before the file goes away
        store.saveRfc(document.rfc().withSections(sections).withUpdated(today()));
        store.deleteClause(rfcId, clauseId);
    }

    // ── Helpers ──────────────────────────────────────────────────

    private TransitionResult record(ArtifactKind kind, TransitionResult result) {
        metrics.recordTransition(kind == null ? "unknown" : kind.id(), result.applied());
        return result;
    }

    private static TransitionResult notFound(String artifactId) {
        return TransitionResult.rejected(artifactId,
                Diagnostic.of(DiagnosticCode.ARTIFACT_NOT_FOUND, artifactId, "no such artifact"));
    }

    private static Diagnostic unknownTarget(String artifactId, String target) {
        return Diagnostic.of(DiagnosticCode.INVALID_TRANSITION, artifactId, "unknown target state '" + target + "'");
    }

    private static boolean hasErrors(List<Diagnostic> diagnostics) {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    private static <S> Optional<S> parse(String value, Function<String, S> parser) {
        try {
            return Optional.of(parser.apply(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String rfcIdOf(String qualifiedId) {
        return qualifiedId.substring(0, qualifiedId.indexOf(ArtifactKind.CLAUSE_SEPARATOR));
    }

    static String normalizeClauseId(String rfcId, String clauseName) {
        requireText(rfcId, "clause id", clauseName);
        String id = clauseName.strip().toUpperCase(Locale.ROOT);
        if (!id.startsWith("C-")) {
            id = "C-" + id;
        }
        if (!CLAUSE_ID.matcher(id).matches()) {
            throw new EditRejectedException(rfcId, "malformed clause id '" + clauseName + "'");
        }
        return id;
    }

    private static void requireText(String artifactId, String what, String value) {
        if (value == null || value.isBlank()) {
            throw new EditRejectedException(artifactId, what + " is required");
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
