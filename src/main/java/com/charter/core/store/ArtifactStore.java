package com.charter.core.store;

import com.charter.core.model.Adr;
import com.charter.core.model.Clause;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.ReleaseLog;
import com.charter.core.model.Rfc;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.Tombstones;
import com.charter.core.model.WorkItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Loads and persists governance records as JSON files under a root directory.
 * <p>
 * Layout:
 * <pre>
 * rfc/&lt;RFC-ID&gt;/rfc.json
 * rfc/&lt;RFC-ID&gt;/clauses/&lt;CLAUSE-ID&gt;.json
 * adr/&lt;ADR-ID&gt;.json
 * work/&lt;WI-ID&gt;.json
 * releases.json
 * tombstones.json
 * </pre>
 * Every write is atomic per file. The store holds no business logic and takes no locks.
 */
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private static final String JSON = ".json";

    private final Path root;
    private final ObjectMapper mapper;

    public ArtifactStore(Path root) {
        this.root = root;
        this.mapper = GovernanceJson.mapper();
    }

    public Path root() {
        return root;
    }

    /**
     * Reads the whole store into one snapshot.
     *
     * @throws SchemaException  if any record is malformed
     * @throws StoreIoException if the files cannot be read
     */
    public GovernanceIndex loadIndex() {
        GovernanceIndex index = new GovernanceIndex(loadRfcs(), loadAdrs(), loadWorkItems(),
                loadReleases(), loadTombstones());
        log.debug("Loaded {} RFCs, {} ADRs, {} work items from {}",
                index.rfcs().size(), index.adrs().size(), index.workItems().size(), root);
        return index;
    }

    // ── RFCs and clauses ─────────────────────────────────────────

    public List<RfcDocument> loadRfcs() {
        List<RfcDocument> documents = new ArrayList<>();
        for (Path dir : listDirectories(rfcRoot())) {
            Path file = dir.resolve("rfc.json");
            if (!Files.isRegularFile(file)) {
                continue;
            }
            documents.add(readRfcDocument(dir, file));
        }
        return documents;
    }

    public Optional<RfcDocument> getRfc(String rfcId) {
        Path dir = rfcRoot().resolve(rfcId);
        Path file = dir.resolve("rfc.json");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(readRfcDocument(dir, file));
    }

    public void saveRfc(Rfc rfc) {
        write(rfcRoot().resolve(rfc.id()).resolve("rfc.json"), rfc);
    }

    public void saveClause(String rfcId, Clause clause) {
        write(clausePath(rfcId, clause.id()), clause);
    }

    public void deleteClause(String rfcId, String clauseId) {
        AtomicFiles.delete(clausePath(rfcId, clauseId));
        log.debug("Deleted clause file {}:{}", rfcId, clauseId);
    }

    private RfcDocument readRfcDocument(Path dir, Path file) {
        Rfc rfc = read(file, Rfc.class);
        requireField(file, "id", rfc.id());
        requireField(file, "title", rfc.title());
        requireField(file, "version", rfc.version());
        requireField(file, "status", rfc.status());
        requireField(file, "phase", rfc.phase());
        if (!dir.getFileName().toString().equals(rfc.id())) {
            throw new SchemaException(file + ": id " + rfc.id() + " does not match directory " + dir.getFileName());
        }
        List<Clause> clauses = new ArrayList<>();
        for (Path clauseFile : listJsonFiles(dir.resolve("clauses"))) {
            Clause clause = read(clauseFile, Clause.class);
            requireField(clauseFile, "id", clause.id());
            requireField(clauseFile, "title", clause.title());
            requireField(clauseFile, "kind", clause.kind());
            requireField(clauseFile, "status", clause.status());
            requireField(clauseFile, "text", clause.text());
            if (!stem(clauseFile).equals(clause.id())) {
                throw new SchemaException(clauseFile + ": id " + clause.id() + " does not match file name");
            }
            clauses.add(clause);
        }
        return new RfcDocument(rfc, clauses);
    }

    private Path clausePath(String rfcId, String clauseId) {
        return rfcRoot().resolve(rfcId).resolve("clauses").resolve(clauseId + JSON);
    }

    private Path rfcRoot() {
        return root.resolve("rfc");
    }

    // ── ADRs ─────────────────────────────────────────────────────

    public List<Adr> loadAdrs() {
        List<Adr> adrs = new ArrayList<>();
        for (Path file : listJsonFiles(root.resolve("adr"))) {
            adrs.add(readAdr(file));
        }
        return adrs;
    }

    public Optional<Adr> getAdr(String adrId) {
        Path file = root.resolve("adr").resolve(adrId + JSON);
        return Files.isRegularFile(file) ? Optional.of(readAdr(file)) : Optional.empty();
    }

    private Adr readAdr(Path file) {
        Adr adr = read(file, Adr.class);
        requireField(file, "id", adr.id());
        requireField(file, "title", adr.title());
        requireField(file, "status", adr.status());
        requireMatchingName(file, adr.id());
        return adr;
    }

    public void saveAdr(Adr adr) {
        write(root.resolve("adr").resolve(adr.id() + JSON), adr);
    }

    // ── Work items ───────────────────────────────────────────────

    public List<WorkItem> loadWorkItems() {
        List<WorkItem> items = new ArrayList<>();
        for (Path file : listJsonFiles(root.resolve("work"))) {
            items.add(readWorkItem(file));
        }
        return items;
    }

    public Optional<WorkItem> getWorkItem(String workItemId) {
        Path file = root.resolve("work").resolve(workItemId + JSON);
        return Files.isRegularFile(file) ? Optional.of(readWorkItem(file)) : Optional.empty();
    }

    private WorkItem readWorkItem(Path file) {
        WorkItem item = read(file, WorkItem.class);
        requireField(file, "id", item.id());
        requireField(file, "title", item.title());
        requireField(file, "status", item.status());
        requireMatchingName(file, item.id());
        return item;
    }

    public void saveWorkItem(WorkItem item) {
        write(root.resolve("work").resolve(item.id() + JSON), item);
    }

    public void deleteWorkItem(String workItemId) {
        AtomicFiles.delete(root.resolve("work").resolve(workItemId + JSON));
        log.debug("Deleted work item file {}", workItemId);
    }

    // ── Releases and tombstones ──────────────────────────────────

    public ReleaseLog loadReleases() {
        Path file = root.resolve("releases.json");
        return Files.isRegularFile(file) ? read(file, ReleaseLog.class) : ReleaseLog.empty();
    }

    public void saveReleases(ReleaseLog releases) {
        write(root.resolve("releases.json"), releases);
    }

    public Tombstones loadTombstones() {
        Path file = root.resolve("tombstones.json");
        return Files.isRegularFile(file) ? read(file, Tombstones.class) : Tombstones.empty();
    }

    public void saveTombstones(Tombstones tombstones) {
        write(root.resolve("tombstones.json"), tombstones);
    }

    // ── File helpers ─────────────────────────────────────────────

    private <T> T read(Path file, Class<T> type) {
        String content = AtomicFiles.read(file);
        try {
            T value = mapper.readValue(content, type);
            if (value == null) {
                throw new SchemaException(file + ": empty document");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new SchemaException(file + ": " + e.getOriginalMessage(), e);
        }
    }

    private void write(Path file, Object value) {
        try {
            String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value) + "\n";
            AtomicFiles.write(file, json);
            log.debug("Saved {}", root.relativize(file));
        } catch (JsonProcessingException e) {
            throw new StoreIoException("Failed to serialize " + file, e);
        }
    }

    private static void requireField(Path file, String field, Object value) {
        if (value == null || (value instanceof String s && s.isBlank())) {
            throw new SchemaException(file + ": missing required field '" + field + "'");
        }
    }

    private static void requireMatchingName(Path file, String id) {
        if (!stem(file).equals(id)) {
            throw new SchemaException(file + ": id " + id + " does not match file name");
        }
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - JSON.length());
    }

    private static List<Path> listDirectories(Path dir) {
        return list(dir, Files::isDirectory);
    }

    private static List<Path> listJsonFiles(Path dir) {
        return list(dir, p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(JSON));
    }

    private static List<Path> list(Path dir, Predicate<Path> filter) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(filter)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new StoreIoException("Failed to list " + dir, e);
        }
    }
}
