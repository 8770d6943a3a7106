package com.charter.core.validation;

import com.charter.core.diagnostic.Diagnostic;
import com.charter.core.diagnostic.DiagnosticCode;
import com.charter.core.model.Adr;
import com.charter.core.model.AdrStatus;
import com.charter.core.model.ArtifactKind;
import com.charter.core.model.Clause;
import com.charter.core.model.ClauseStatus;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.Rfc;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.RfcPhase;
import com.charter.core.model.RfcStatus;
import com.charter.core.model.SemanticVersion;
import com.charter.core.model.WorkItem;
import com.charter.core.model.WorkItemStatus;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks lifecycle state and field invariants of governed artifacts.
 * <p>
 * Every method returns diagnostics and never throws for a rule violation: a pass over
 * the whole store reports every problem, not just the first. Proposed transitions are
 * checked through the {@code check*} methods before anything is persisted.
 */
@Service
public class StateMachineValidator {

    /** Validates every artifact in the snapshot. */
    public List<Diagnostic> validate(GovernanceIndex index) {
        return validate(index, null);
    }

    /**
     * Validates the artifacts of one kind, or all of them when {@code kind} is {@code null}.
     * Clauses are validated together with their RFC.
     */
    public List<Diagnostic> validate(GovernanceIndex index, ArtifactKind kind) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (kind == null || kind == ArtifactKind.RFC || kind == ArtifactKind.CLAUSE) {
            for (RfcDocument document : index.rfcs()) {
                diagnostics.addAll(validateRfc(document));
            }
        }
        if (kind == null || kind == ArtifactKind.ADR) {
            for (Adr adr : index.adrs()) {
                diagnostics.addAll(validateAdr(adr, index));
            }
        }
        if (kind == null || kind == ArtifactKind.WORK_ITEM) {
            for (WorkItem item : index.workItems()) {
                diagnostics.addAll(validateWorkItem(item));
            }
        }
        return diagnostics;
    }

    // ── Read-time invariants ─────────────────────────────────────

    public List<Diagnostic> validateRfc(RfcDocument document) {
        Rfc rfc = document.rfc();
        List<Diagnostic> diagnostics = new ArrayList<>(checkStatusPhase(rfc.id(), rfc.status(), rfc.phase()));

        if (!SemanticVersion.isValid(rfc.version())) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.INVALID_VERSION, rfc.id(),
                    "version '" + rfc.version() + "' is not a semantic version"));
        }
        if (rfc.changelog().isEmpty()) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.RFC_NO_CHANGELOG, rfc.id(), "RFC has no changelog entries"));
        }

        Set<String> listed = new HashSet<>();
        for (String clauseId : rfc.clauseIds()) {
            String qualified = ArtifactKind.qualifyClause(rfc.id(), clauseId);
            if (!listed.add(clauseId)) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.CLAUSE_INCONSISTENT, qualified,
                        "clause is listed more than once in the sections of " + rfc.id()));
            }
            if (document.clause(clauseId).isEmpty()) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.CLAUSE_MISSING, qualified,
                        "section lists clause " + clauseId + " but no clause file exists"));
            }
        }

        for (Clause clause : document.clauses()) {
            String qualified = ArtifactKind.qualifyClause(rfc.id(), clause.id());
            if (!listed.contains(clause.id())) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.ORPHANED_CLAUSE, qualified,
                        "clause is not listed in any section"));
            }
            if (clause.since() == null) {
                if (rfc.status() != RfcStatus.DRAFT) {
                    diagnostics.add(Diagnostic.of(DiagnosticCode.CLAUSE_NO_SINCE, qualified,
                            "clause has no 'since' version"));
                }
            } else if (!SemanticVersion.isValid(clause.since())) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.INVALID_VERSION, qualified,
                        "since '" + clause.since() + "' is not a semantic version"));
            }
            diagnostics.addAll(checkClauseSupersession(document, clause));
        }
        return diagnostics;
    }

    public List<Diagnostic> validateAdr(Adr adr, GovernanceIndex index) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (adr.refs().isEmpty()) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.ADR_NO_REFS, adr.id(), "ADR references no other artifact"));
        }
        if (adr.supersededBy() != null) {
            if (adr.status() != AdrStatus.SUPERSEDED) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID, adr.id(),
                        "superseded_by is set but status is " + adr.status()));
            }
            if (adr.supersededBy().equals(adr.id())) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID, adr.id(),
                        "ADR cannot supersede itself"));
            }
            index.adr(adr.supersededBy())
                    .filter(successor -> successor.status() == AdrStatus.REJECTED)
                    .ifPresent(successor -> diagnostics.add(Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID,
                            adr.id(), "superseded by rejected ADR " + successor.id())));
        }
        return diagnostics;
    }

    public List<Diagnostic> validateWorkItem(WorkItem item) {
        if (item.status() == WorkItemStatus.DONE) {
            return checkAcceptanceCriteria(item);
        }
        return List.of();
    }

    // ── Proposed transitions ─────────────────────────────────────

    public List<Diagnostic> checkRfcStatus(Rfc rfc, RfcStatus target) {
        if (!LifecycleRules.RFC_STATUS.allows(rfc.status(), target)) {
            return List.of(invalidTransition(rfc.id(), "RFC status", rfc.status(), target));
        }
        return checkStatusPhase(rfc.id(), target, rfc.phase());
    }

    public List<Diagnostic> checkRfcPhase(Rfc rfc, RfcPhase target) {
        if (!LifecycleRules.RFC_PHASE.allows(rfc.phase(), target)) {
            return List.of(invalidTransition(rfc.id(), "RFC phase", rfc.phase(), target));
        }
        if (rfc.status() != RfcStatus.NORMATIVE) {
            return List.of(Diagnostic.of(DiagnosticCode.FORBIDDEN_STATUS_PHASE, rfc.id(),
                    "phase cannot advance past spec while status is " + rfc.status()));
        }
        return checkStatusPhase(rfc.id(), rfc.status(), target);
    }

    public List<Diagnostic> checkAdrStatus(Adr adr, AdrStatus target) {
        if (!LifecycleRules.ADR_STATUS.allows(adr.status(), target)) {
            return List.of(invalidTransition(adr.id(), "ADR status", adr.status(), target));
        }
        return List.of();
    }

    public List<Diagnostic> checkClauseStatus(String qualifiedId, Clause clause, ClauseStatus target) {
        if (!LifecycleRules.CLAUSE_STATUS.allows(clause.status(), target)) {
            return List.of(invalidTransition(qualifiedId, "clause status", clause.status(), target));
        }
        return List.of();
    }

    public List<Diagnostic> checkWorkItemStatus(WorkItem item, WorkItemStatus target) {
        if (!LifecycleRules.WORK_ITEM_STATUS.allows(item.status(), target)) {
            return List.of(invalidTransition(item.id(), "work item status", item.status(), target));
        }
        if (target == WorkItemStatus.DONE) {
            return checkAcceptanceCriteria(item);
        }
        return List.of();
    }

    // ── Shared rules ─────────────────────────────────────────────

    List<Diagnostic> checkStatusPhase(String rfcId, RfcStatus status, RfcPhase phase) {
        return switch (StatusPhaseMatrix.compatibility(status, phase)) {
            case ALLOWED -> List.of();
            case WARN -> List.of(Diagnostic.of(DiagnosticCode.STATUS_PHASE_WARNING, rfcId,
                    "status " + status + " with phase " + phase + " is discouraged"));
            case FORBIDDEN -> List.of(Diagnostic.of(DiagnosticCode.FORBIDDEN_STATUS_PHASE, rfcId,
                    "status " + status + " cannot be combined with phase " + phase));
        };
    }

    private List<Diagnostic> checkAcceptanceCriteria(WorkItem item) {
        if (item.acceptanceCriteria().isEmpty()) {
            return List.of(Diagnostic.of(DiagnosticCode.ACCEPTANCE_CRITERIA_INCOMPLETE, item.id(),
                    "work item has no acceptance criteria"));
        }
        long pending = item.pendingCriteria();
        if (pending > 0) {
            return List.of(Diagnostic.of(DiagnosticCode.ACCEPTANCE_CRITERIA_INCOMPLETE, item.id(),
                    pending + " acceptance criteria still pending"));
        }
        return List.of();
    }

    private List<Diagnostic> checkClauseSupersession(RfcDocument document, Clause clause) {
        if (clause.supersededBy() == null) {
            return List.of();
        }
        String qualified = ArtifactKind.qualifyClause(document.id(), clause.id());
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (clause.status() != ClauseStatus.SUPERSEDED) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID, qualified,
                    "superseded_by is set but status is " + clause.status()));
        }
        String target = localClauseId(document.id(), clause.supersededBy());
        if (target.equals(clause.id())) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID, qualified,
                    "clause cannot supersede itself"));
        } else if (document.clause(target).isEmpty()) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.SUPERSEDED_BY_INVALID, qualified,
                    "superseding clause " + clause.supersededBy() + " does not exist in " + document.id()));
        }
        return diagnostics;
    }

    /** Accepts both {@code C-NEW} and {@code RFC-0001:C-NEW} forms of a same-RFC clause id. */
    static String localClauseId(String rfcId, String clauseRef) {
        String prefix = rfcId + ArtifactKind.CLAUSE_SEPARATOR;
        return clauseRef.startsWith(prefix) ? clauseRef.substring(prefix.length()) : clauseRef;
    }

    private static Diagnostic invalidTransition(String id, String what, Object from, Object to) {
        return Diagnostic.of(DiagnosticCode.INVALID_TRANSITION, id,
                "invalid " + what + " transition " + from + " -> " + to);
    }
}
