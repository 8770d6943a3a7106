package com.charter.core.store;

import com.charter.core.Fixtures;
import com.charter.core.model.AdrStatus;
import com.charter.core.model.Clause;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.Release;
import com.charter.core.model.ReleaseLog;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.Tombstones;
import com.charter.core.model.WorkItem;
import com.charter.core.model.WorkItemStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactStoreTest {

    @TempDir
    Path root;

    private ArtifactStore store;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(root);
    }

    private void saveDocument(RfcDocument document) {
        document.clauses().forEach(clause -> store.saveClause(document.id(), clause));
        store.saveRfc(document.rfc());
    }

    // ── Round trips ──────────────────────────────────────────────

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        @DisplayName("rfc with clauses is read back equal")
        void rfcRoundTrip() {
            RfcDocument document = Fixtures.draftRfc("RFC-0001",
                    Fixtures.clause("C-B", "second"), Fixtures.clause("C-A", "first"));
            saveDocument(document);

            RfcDocument loaded = store.getRfc("RFC-0001").orElseThrow();
            assertEquals(document.rfc(), loaded.rfc());
            // clause files are listed by name
            assertEquals(List.of("C-A", "C-B"), loaded.clauses().stream().map(Clause::id).toList());
        }

        @Test
        @DisplayName("records are stored as snake_case json")
        void snakeCase() throws IOException {
            store.saveWorkItem(Fixtures.workItem("WI-0001", WorkItemStatus.QUEUE, Fixtures.pending("fix: crash")));

            String json = Files.readString(root.resolve("work/WI-0001.json"));
            assertTrue(json.contains("\"acceptance_criteria\""));
            assertTrue(json.contains("\"status\" : \"queue\""));
            assertTrue(json.endsWith("\n"));
        }

        @Test
        @DisplayName("loadIndex reads every kind sorted by id")
        void loadIndex() {
            store.saveAdr(Fixtures.adr("ADR-0002", AdrStatus.PROPOSED));
            store.saveAdr(Fixtures.adr("ADR-0001", AdrStatus.ACCEPTED, "RFC-0001"));
            store.saveWorkItem(Fixtures.workItem("WI-0001", WorkItemStatus.QUEUE));
            saveDocument(Fixtures.draftRfc("RFC-0001"));
            store.saveReleases(ReleaseLog.empty().prepend(new Release("1.0.0", Fixtures.DAY, List.of("WI-0001"))));
            store.saveTombstones(Tombstones.empty().add("WI-0009"));

            GovernanceIndex index = store.loadIndex();

            assertEquals(List.of("ADR-0001", "ADR-0002"), index.adrs().stream().map(a -> a.id()).toList());
            assertEquals(1, index.rfcs().size());
            assertEquals(1, index.workItems().size());
            assertTrue(index.releases().isReleased("WI-0001"));
            assertTrue(index.tombstones().contains("WI-0009"));
        }

        @Test
        @DisplayName("get returns empty for missing records")
        void missing() {
            assertTrue(store.getRfc("RFC-0404").isEmpty());
            assertTrue(store.getAdr("ADR-0404").isEmpty());
            assertTrue(store.getWorkItem("WI-0404").isEmpty());
        }

        @Test
        @DisplayName("an empty store loads as an empty index")
        void emptyStore() {
            GovernanceIndex index = store.loadIndex();
            assertTrue(index.rfcs().isEmpty());
            assertTrue(index.releases().releases().isEmpty());
        }

        @Test
        @DisplayName("save leaves no temporary files behind")
        void noTempFiles() throws IOException {
            store.saveWorkItem(Fixtures.workItem("WI-0001", WorkItemStatus.QUEUE));
            store.saveWorkItem(Fixtures.workItem("WI-0001", WorkItemStatus.ACTIVE));

            try (Stream<Path> files = Files.list(root.resolve("work"))) {
                assertEquals(List.of("WI-0001.json"), files.map(p -> p.getFileName().toString()).toList());
            }
            WorkItem loaded = store.getWorkItem("WI-0001").orElseThrow();
            assertEquals(WorkItemStatus.ACTIVE, loaded.status());
        }

        @Test
        @DisplayName("deleting a clause removes only its file")
        void deleteClause() {
            saveDocument(Fixtures.draftRfc("RFC-0001", Fixtures.clause("C-A", "a"), Fixtures.clause("C-B", "b")));
            store.deleteClause("RFC-0001", "C-A");

            assertFalse(Files.exists(root.resolve("rfc/RFC-0001/clauses/C-A.json")));
            assertTrue(Files.exists(root.resolve("rfc/RFC-0001/clauses/C-B.json")));
        }
    }

    // ── Schema errors ────────────────────────────────────────────

    @Nested
    @DisplayName("Schema errors")
    class SchemaErrors {

        @Test
        @DisplayName("malformed json is a schema error")
        void malformed() throws IOException {
            Files.createDirectories(root.resolve("work"));
            Files.writeString(root.resolve("work/WI-0001.json"), "{ not json");

            assertThrows(SchemaException.class, store::loadWorkItems);
        }

        @Test
        @DisplayName("missing required field is a schema error")
        void missingField() throws IOException {
            Files.createDirectories(root.resolve("adr"));
            Files.writeString(root.resolve("adr/ADR-0001.json"), "{\"id\": \"ADR-0001\", \"status\": \"proposed\"}");

            SchemaException e = assertThrows(SchemaException.class, store::loadAdrs);
            assertTrue(e.getMessage().contains("title"));
        }

        @Test
        @DisplayName("unknown status value is a schema error")
        void unknownStatus() throws IOException {
            Files.createDirectories(root.resolve("work"));
            Files.writeString(root.resolve("work/WI-0001.json"),
                    "{\"id\": \"WI-0001\", \"title\": \"t\", \"status\": \"blocked\"}");

            assertThrows(SchemaException.class, store::loadWorkItems);
        }

        @Test
        @DisplayName("single-record reads apply the same checks as loadIndex")
        void getValidates() throws IOException {
            Files.createDirectories(root.resolve("adr"));
            Files.writeString(root.resolve("adr/ADR-0001.json"), "{\"id\": \"ADR-0001\", \"status\": \"proposed\"}");
            Files.createDirectories(root.resolve("work"));
            Files.writeString(root.resolve("work/WI-0002.json"),
                    "{\"id\": \"WI-0001\", \"title\": \"t\", \"status\": \"queue\"}");

            SchemaException missing = assertThrows(SchemaException.class, () -> store.getAdr("ADR-0001"));
            assertTrue(missing.getMessage().contains("title"));
            SchemaException renamed = assertThrows(SchemaException.class, () -> store.getWorkItem("WI-0002"));
            assertTrue(renamed.getMessage().contains("does not match file name"));
        }

        @Test
        @DisplayName("clause id must match its file name")
        void clauseFileName() throws IOException {
            saveDocument(Fixtures.draftRfc("RFC-0001", Fixtures.clause("C-A", "a")));
            Path clauses = root.resolve("rfc/RFC-0001/clauses");
            Files.move(clauses.resolve("C-A.json"), clauses.resolve("C-Z.json"));

            assertThrows(SchemaException.class, store::loadRfcs);
        }
    }
}
