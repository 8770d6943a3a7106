package com.charter.core.model;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Immutable, id-keyed snapshot of the whole governance store.
 * <p>
 * Loaded once per invocation and passed explicitly to every operation. The
 * {@code with*} methods return a new snapshot with one artifact replaced or added;
 * they assemble snapshots in memory without going through a store.
 */
public final class GovernanceIndex {

    private final Map<String, RfcDocument> rfcs;
    private final Map<String, Adr> adrs;
    private final Map<String, WorkItem> workItems;
    private final ReleaseLog releases;
    private final Tombstones tombstones;

    public GovernanceIndex(Collection<RfcDocument> rfcs,
                           Collection<Adr> adrs,
                           Collection<WorkItem> workItems,
                           ReleaseLog releases,
                           Tombstones tombstones) {
        this(toMap(rfcs, RfcDocument::id), toMap(adrs, Adr::id), toMap(workItems, WorkItem::id),
                releases, tombstones);
    }

    private GovernanceIndex(Map<String, RfcDocument> rfcs,
                            Map<String, Adr> adrs,
                            Map<String, WorkItem> workItems,
                            ReleaseLog releases,
                            Tombstones tombstones) {
        this.rfcs = rfcs;
        this.adrs = adrs;
        this.workItems = workItems;
        this.releases = releases == null ? ReleaseLog.empty() : releases;
        this.tombstones = tombstones == null ? Tombstones.empty() : tombstones;
    }

    public static GovernanceIndex empty() {
        return new GovernanceIndex(List.of(), List.of(), List.of(), ReleaseLog.empty(), Tombstones.empty());
    }

    public List<RfcDocument> rfcs() {
        return List.copyOf(rfcs.values());
    }

    public List<Adr> adrs() {
        return List.copyOf(adrs.values());
    }

    public List<WorkItem> workItems() {
        return List.copyOf(workItems.values());
    }

    public ReleaseLog releases() {
        return releases;
    }

    public Tombstones tombstones() {
        return tombstones;
    }

    public Optional<RfcDocument> rfc(String id) {
        return Optional.ofNullable(rfcs.get(id));
    }

    public Optional<Adr> adr(String id) {
        return Optional.ofNullable(adrs.get(id));
    }

    public Optional<WorkItem> workItem(String id) {
        return Optional.ofNullable(workItems.get(id));
    }

    /** Looks up a clause by its qualified id, {@code RFC-0001:C-NAME}. */
    public Optional<Clause> clause(String qualifiedId) {
        int separator = qualifiedId.indexOf(ArtifactKind.CLAUSE_SEPARATOR);
        if (separator <= 0) {
            return Optional.empty();
        }
        return rfc(qualifiedId.substring(0, separator))
                .flatMap(doc -> doc.clause(qualifiedId.substring(separator + 1)));
    }

    public boolean contains(String id) {
        ArtifactKind kind = ArtifactKind.ofId(id);
        if (kind == null) {
            return false;
        }
        return switch (kind) {
            case RFC -> rfcs.containsKey(id);
            case CLAUSE -> clause(id).isPresent();
            case ADR -> adrs.containsKey(id);
            case WORK_ITEM -> workItems.containsKey(id);
        };
    }

    public GovernanceIndex withRfc(RfcDocument document) {
        Map<String, RfcDocument> updated = new TreeMap<>(rfcs);
        updated.put(document.id(), document);
        return new GovernanceIndex(updated, adrs, workItems, releases, tombstones);
    }

    public GovernanceIndex withAdr(Adr adr) {
        Map<String, Adr> updated = new TreeMap<>(adrs);
        updated.put(adr.id(), adr);
        return new GovernanceIndex(rfcs, updated, workItems, releases, tombstones);
    }

    public GovernanceIndex withWorkItem(WorkItem item) {
        Map<String, WorkItem> updated = new TreeMap<>(workItems);
        updated.put(item.id(), item);
        return new GovernanceIndex(rfcs, adrs, updated, releases, tombstones);
    }

    /** Drops a work item and tombstones its id, as a delete does. */
    public GovernanceIndex withoutWorkItem(String id) {
        Map<String, WorkItem> updated = new TreeMap<>(workItems);
        updated.remove(id);
        return new GovernanceIndex(rfcs, adrs, updated, releases, tombstones.add(id));
    }

    public GovernanceIndex withReleases(ReleaseLog log) {
        return new GovernanceIndex(rfcs, adrs, workItems, log, tombstones);
    }

    private static <T> Map<String, T> toMap(Collection<T> values, Function<T, String> key) {
        Map<String, T> map = new TreeMap<>();
        for (T value : values) {
            map.put(key.apply(value), value);
        }
        return map;
    }
}
