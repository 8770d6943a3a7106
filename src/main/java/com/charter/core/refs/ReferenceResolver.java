package com.charter.core.refs;

import com.charter.core.diagnostic.Diagnostic;
import com.charter.core.diagnostic.DiagnosticCode;
import com.charter.core.model.ArtifactKind;
import com.charter.core.model.GovernanceIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates structured references and inline mentions against a snapshot.
 * <p>
 * Unknown ids are {@link DiagnosticCode#DANGLING_REFERENCE} errors; ids of deprecated
 * or superseded artifacts are {@link DiagnosticCode#OUTDATED_REFERENCE} warnings.
 * Inline mentions of deleted artifacts, in the store or in the source tree, are
 * {@link DiagnosticCode#STALE_REFERENCE} warnings.
 */
@Service
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final ReferenceMatcher matcher;
    private final SourceScanner sourceScanner;

    public ReferenceResolver(ReferenceMatcher matcher, SourceScanner sourceScanner) {
        this.matcher = matcher;
        this.sourceScanner = sourceScanner;
    }

    public ReferenceIndex index(GovernanceIndex index) {
        return ReferenceIndex.build(index, matcher);
    }

    /** Checks every {@code refs} entry and every inline mention in the store. */
    public List<Diagnostic> validate(GovernanceIndex index) {
        ReferenceIndex refs = index(index);
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (ReferenceIndex.StructuralRef ref : refs.structuralRefs()) {
            // same-RFC supersession is checked with the clause's lifecycle
            if (ArtifactKind.ofId(ref.ownerId()) == ArtifactKind.CLAUSE) {
                continue;
            }
            check(refs, ref.ownerId(), ref.field(), ref.targetId()).ifPresent(diagnostics::add);
        }
        for (ReferenceIndex.ContentField field : refs.contentFields()) {
            for (ReferenceMatcher.Mention mention : matcher.find(field.text())) {
                if (!refs.isKnown(mention.id()) && index.tombstones().contains(mention.id())) {
                    diagnostics.add(Diagnostic.of(DiagnosticCode.STALE_REFERENCE, field.ownerId(),
                            field.field() + " mentions deleted artifact " + mention.id()));
                } else {
                    check(refs, field.ownerId(), field.field(), mention.id()).ifPresent(diagnostics::add);
                }
            }
        }
        log.debug("Reference validation produced {} diagnostics", diagnostics.size());
        return diagnostics;
    }

    /** Checks mentions found in the external source tree, if scanning is enabled. */
    public List<Diagnostic> validateSources(GovernanceIndex index) {
        if (!sourceScanner.isEnabled()) {
            return List.of();
        }
        ReferenceIndex refs = index(index);
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (SourceMention mention : sourceScanner.scan(matcher)) {
            String id = mention.id();
            Optional<ArtifactState> state = refs.state(id);
            if (state.isEmpty()) {
                if (index.tombstones().contains(id)) {
                    diagnostics.add(Diagnostic.of(DiagnosticCode.STALE_REFERENCE, id,
                            "source mentions deleted artifact " + id).at(mention.location()));
                } else {
                    diagnostics.add(Diagnostic.of(DiagnosticCode.DANGLING_REFERENCE, id,
                            "source mentions unknown artifact " + id).at(mention.location()));
                }
            } else if (state.get().isOutdated()) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.OUTDATED_REFERENCE, id,
                        "source mentions " + id + ": " + state.get().reason()).at(mention.location()));
            }
        }
        return diagnostics;
    }

    /**
     * Resolves the structured references and inline mentions of one artifact.
     *
     * @return every target with its state, or the diagnostics of the references that failed
     */
    public ResolvedRefs resolveRefs(GovernanceIndex index, String artifactId) {
        if (!index.contains(artifactId)) {
            return new ResolvedRefs(artifactId, List.of(), List.of(Diagnostic.of(
                    DiagnosticCode.ARTIFACT_NOT_FOUND, artifactId, "no such artifact")));
        }
        ReferenceIndex refs = index(index);
        List<ArtifactState> resolved = new ArrayList<>();
        List<Diagnostic> failures = new ArrayList<>();
        List<String> targets = new ArrayList<>();
        for (ReferenceIndex.StructuralRef ref : refs.structuralRefs()) {
            if (ownedBy(ref.ownerId(), artifactId)) {
                targets.add(ref.targetId());
            }
        }
        for (ReferenceIndex.ContentField field : refs.contentFields()) {
            if (ownedBy(field.ownerId(), artifactId)) {
                matcher.find(field.text()).forEach(m -> targets.add(m.id()));
            }
        }
        for (String target : targets.stream().distinct().toList()) {
            refs.state(target).ifPresentOrElse(resolved::add, () -> failures.add(Diagnostic.of(
                    DiagnosticCode.DANGLING_REFERENCE, artifactId, "unknown reference " + target)));
        }
        return failures.isEmpty()
                ? new ResolvedRefs(artifactId, resolved, List.of())
                : new ResolvedRefs(artifactId, List.of(), failures);
    }

    private static Optional<Diagnostic> check(ReferenceIndex refs, String ownerId, String field, String targetId) {
        Optional<ArtifactState> state = refs.state(targetId);
        if (state.isEmpty()) {
            return Optional.of(Diagnostic.of(DiagnosticCode.DANGLING_REFERENCE, ownerId,
                    field + " references unknown artifact " + targetId));
        }
        if (state.get().isOutdated()) {
            return Optional.of(Diagnostic.of(DiagnosticCode.OUTDATED_REFERENCE, ownerId,
                    field + " references " + targetId + ": " + state.get().reason()));
        }
        return Optional.empty();
    }

    /** An RFC owns its clauses' references as well as its own. */
    private static boolean ownedBy(String ownerId, String artifactId) {
        return ownerId.equals(artifactId)
                || ownerId.startsWith(artifactId + ArtifactKind.CLAUSE_SEPARATOR);
    }
}
