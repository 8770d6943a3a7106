package com.charter.core.refs;

import com.charter.core.model.AcceptanceCriterion;
import com.charter.core.model.Adr;
import com.charter.core.model.AdrStatus;
import com.charter.core.model.Alternative;
import com.charter.core.model.ArtifactKind;
import com.charter.core.model.ChangelogEntry;
import com.charter.core.model.Clause;
import com.charter.core.model.ClauseStatus;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.Rfc;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.RfcStatus;
import com.charter.core.model.WorkItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-memory, bidirectional reference graph of one store snapshot.
 * <p>
 * Maps every known id (clauses in qualified form) to its {@link ArtifactState}, and
 * every referenced id to the artifacts pointing at it, split into structural referrers
 * ({@code refs} and {@code superseded_by} fields) and content mentioners (inline
 * references in text fields).
 */
public final class ReferenceIndex {

    /**
     * A structured reference held in a field.
     *
     * @param ownerId  the referring artifact
     * @param field    field name, e.g. {@code refs}
     * @param targetId the referenced id as written
     */
    public record StructuralRef(String ownerId, String field, String targetId) {}

    /**
     * One free-text field that may contain inline mentions.
     *
     * @param ownerId the artifact owning the text
     * @param field   field name, e.g. {@code description}
     * @param text    the field value
     */
    public record ContentField(String ownerId, String field, String text) {}

    private final Map<String, ArtifactState> states;
    private final Map<String, Set<String>> structuralReferrers;
    private final Map<String, Set<String>> mentioners;
    private final List<StructuralRef> structuralRefs;
    private final List<ContentField> contentFields;
    private final ReferenceMatcher matcher;

    private ReferenceIndex(Map<String, ArtifactState> states,
                           Map<String, Set<String>> structuralReferrers,
                           Map<String, Set<String>> mentioners,
                           List<StructuralRef> structuralRefs,
                           List<ContentField> contentFields,
                           ReferenceMatcher matcher) {
        this.states = states;
        this.structuralReferrers = structuralReferrers;
        this.mentioners = mentioners;
        this.structuralRefs = structuralRefs;
        this.contentFields = contentFields;
        this.matcher = matcher;
    }

    public static ReferenceIndex build(GovernanceIndex index, ReferenceMatcher matcher) {
        Map<String, ArtifactState> states = new HashMap<>();
        List<StructuralRef> refs = new ArrayList<>();
        List<ContentField> fields = new ArrayList<>();

        for (RfcDocument document : index.rfcs()) {
            Rfc rfc = document.rfc();
            boolean rfcDeprecated = rfc.status() == RfcStatus.DEPRECATED;
            states.put(rfc.id(), rfcDeprecated
                    ? ArtifactState.outdated(rfc.id(), ArtifactKind.RFC, "RFC is deprecated")
                    : ArtifactState.active(rfc.id(), ArtifactKind.RFC));
            for (ChangelogEntry entry : rfc.changelog()) {
                add(fields, rfc.id(), "changelog.summary", entry.summary());
                entry.changes().forEach(change -> add(fields, rfc.id(), "changelog.changes", change));
            }

            for (Clause clause : document.clauses()) {
                String qualified = ArtifactKind.qualifyClause(rfc.id(), clause.id());
                states.put(qualified, clauseState(qualified, clause, rfcDeprecated));
                if (clause.supersededBy() != null) {
                    refs.add(new StructuralRef(qualified, "superseded_by", qualifySibling(rfc.id(), clause.supersededBy())));
                }
                add(fields, qualified, "title", clause.title());
                add(fields, qualified, "text", clause.text());
            }
        }

        for (Adr adr : index.adrs()) {
            states.put(adr.id(), adr.status() == AdrStatus.SUPERSEDED
                    ? ArtifactState.outdated(adr.id(), ArtifactKind.ADR, "ADR is superseded"
                            + (adr.supersededBy() == null ? "" : " by " + adr.supersededBy()))
                    : ArtifactState.active(adr.id(), ArtifactKind.ADR));
            adr.refs().forEach(ref -> refs.add(new StructuralRef(adr.id(), "refs", ref)));
            if (adr.supersededBy() != null) {
                refs.add(new StructuralRef(adr.id(), "superseded_by", adr.supersededBy()));
            }
            add(fields, adr.id(), "context", adr.context());
            add(fields, adr.id(), "decision", adr.decision());
            add(fields, adr.id(), "consequences", adr.consequences());
            for (Alternative alternative : adr.alternatives()) {
                add(fields, adr.id(), "alternatives.text", alternative.text());
                alternative.pros().forEach(pro -> add(fields, adr.id(), "alternatives.pros", pro));
                alternative.cons().forEach(con -> add(fields, adr.id(), "alternatives.cons", con));
                add(fields, adr.id(), "alternatives.rejection_reason", alternative.rejectionReason());
            }
        }

        for (WorkItem item : index.workItems()) {
            states.put(item.id(), ArtifactState.active(item.id(), ArtifactKind.WORK_ITEM));
            item.refs().forEach(ref -> refs.add(new StructuralRef(item.id(), "refs", ref)));
            add(fields, item.id(), "description", item.description());
            item.notes().forEach(note -> add(fields, item.id(), "notes", note));
            for (AcceptanceCriterion criterion : item.acceptanceCriteria()) {
                add(fields, item.id(), "acceptance_criteria", criterion.text());
            }
        }

        Map<String, Set<String>> structural = new HashMap<>();
        for (StructuralRef ref : refs) {
            structural.computeIfAbsent(ref.targetId(), k -> new TreeSet<>()).add(ref.ownerId());
        }
        Map<String, Set<String>> mentions = new HashMap<>();
        for (ContentField field : fields) {
            for (ReferenceMatcher.Mention mention : matcher.find(field.text())) {
                mentions.computeIfAbsent(mention.id(), k -> new TreeSet<>()).add(field.ownerId());
            }
        }

        return new ReferenceIndex(states, structural, mentions,
                List.copyOf(refs), List.copyOf(fields), matcher);
    }

    public Optional<ArtifactState> state(String id) {
        return Optional.ofNullable(states.get(id));
    }

    public boolean isKnown(String id) {
        return states.containsKey(id);
    }

    public Set<String> structuralReferrers(String id) {
        return Collections.unmodifiableSet(structuralReferrers.getOrDefault(id, Set.of()));
    }

    public Set<String> mentioners(String id) {
        return Collections.unmodifiableSet(mentioners.getOrDefault(id, Set.of()));
    }

    /**
     * Every other artifact whose {@code refs} or {@code superseded_by} point at {@code id}.
     * Inline mentions are not included; they go stale instead of blocking a delete.
     */
    public Set<String> incoming(String id) {
        Set<String> incoming = new TreeSet<>(structuralReferrers(id));
        incoming.remove(id);
        return incoming;
    }

    public List<StructuralRef> structuralRefs() {
        return structuralRefs;
    }

    public List<ContentField> contentFields() {
        return contentFields;
    }

    public ReferenceMatcher matcher() {
        return matcher;
    }

    private static ArtifactState clauseState(String qualified, Clause clause, boolean rfcDeprecated) {
        if (clause.status() == ClauseStatus.SUPERSEDED) {
            return ArtifactState.outdated(qualified, ArtifactKind.CLAUSE, "clause is superseded"
                    + (clause.supersededBy() == null ? "" : " by " + clause.supersededBy()));
        }
        if (clause.status() == ClauseStatus.DEPRECATED) {
            return ArtifactState.outdated(qualified, ArtifactKind.CLAUSE, "clause is deprecated");
        }
        if (rfcDeprecated) {
            return ArtifactState.outdated(qualified, ArtifactKind.CLAUSE, "parent RFC is deprecated");
        }
        return ArtifactState.active(qualified, ArtifactKind.CLAUSE);
    }

    private static String qualifySibling(String rfcId, String clauseRef) {
        return clauseRef.indexOf(ArtifactKind.CLAUSE_SEPARATOR) > 0
                ? clauseRef
                : ArtifactKind.qualifyClause(rfcId, clauseRef);
    }

    private static void add(List<ContentField> fields, String ownerId, String field, String text) {
        if (text != null && !text.isEmpty()) {
            fields.add(new ContentField(ownerId, field, text));
        }
    }
}
