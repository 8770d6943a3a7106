package com.charter.core.render;

import com.charter.core.Fixtures;
import com.charter.core.metrics.CharterMetrics;
import com.charter.core.model.AdrStatus;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.WorkItemStatus;
import com.charter.core.refs.PatternReferenceMatcher;
import com.charter.core.refs.ReferenceResolver;
import com.charter.core.refs.SourceScanOptions;
import com.charter.core.refs.SourceScanner;
import com.charter.core.signature.CanonicalSigner;
import com.charter.core.signature.ProjectionHeader;
import com.charter.core.store.WorkspacePaths;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class RenderServiceTest {

    @TempDir
    Path tempDir;

    private final CanonicalSigner signer = new CanonicalSigner();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private RenderService service;
    private GovernanceIndex index;

    @BeforeEach
    void setUp() {
        ReferenceResolver resolver = new ReferenceResolver(PatternReferenceMatcher.defaults(),
                new SourceScanner(SourceScanOptions.disabled()));
        service = new RenderService(signer, resolver, new MarkdownRenderer(), new ChangelogRenderer(),
                new CharterMetrics(registry), WorkspacePaths.under(tempDir));
        index = GovernanceIndex.empty()
                .withRfc(Fixtures.draftRfc("RFC-0001", Fixtures.clause("C-A", "Text")))
                .withAdr(Fixtures.adr("ADR-0001", AdrStatus.PROPOSED, "RFC-0001:C-A"))
                .withWorkItem(Fixtures.workItem("WI-0001", WorkItemStatus.DONE, Fixtures.done("fix: Fix typo")));
    }

    @Test
    @DisplayName("renderAll writes one projection per artifact under its kind directory")
    void renderAll() {
        RenderReport report = service.renderAll(index);

        assertEquals(3, report.written().size());
        assertTrue(Files.isRegularFile(tempDir.resolve("docs/rfc/RFC-0001.md")));
        assertTrue(Files.isRegularFile(tempDir.resolve("docs/adr/ADR-0001.md")));
        assertTrue(Files.isRegularFile(tempDir.resolve("docs/work/WI-0001.md")));
    }

    @Test
    @DisplayName("a second render leaves every file unchanged")
    void idempotent() throws Exception {
        service.renderAll(index);
        String before = Files.readString(tempDir.resolve("docs/rfc/RFC-0001.md"));

        RenderReport again = service.renderAll(index);

        assertTrue(again.written().isEmpty());
        assertEquals(3, again.unchanged().size());
        assertEquals(before, Files.readString(tempDir.resolve("docs/rfc/RFC-0001.md")));
    }

    @Test
    @DisplayName("the projection header carries the artifact signature")
    void headerSignature() throws Exception {
        service.renderAll(index);

        String content = Files.readString(tempDir.resolve("docs/work/WI-0001.md"));
        ProjectionHeader header = ProjectionHeader.parse(content).orElseThrow();
        assertEquals("WI-0001", header.sourceId());
        assertEquals(signer.sign(index.workItem("WI-0001").orElseThrow()), header.signature());
    }

    @Test
    @DisplayName("a clause id renders its RFC")
    void clauseRendersRfc() {
        RenderReport report = service.renderOne(index, "RFC-0001:C-A");

        assertEquals(tempDir.resolve("docs/rfc/RFC-0001.md"), report.written().get(0));
    }

    @Test
    @DisplayName("unknown ids are rejected")
    void unknownId() {
        assertThrows(NoSuchElementException.class, () -> service.render(index, "RFC-0099"));
        assertThrows(NoSuchElementException.class, () -> service.render(index, "XYZ-1"));
    }

    @Test
    @DisplayName("changelog is written once and then left alone")
    void changelog() throws Exception {
        assertTrue(service.renderChangelog(index, false));
        assertFalse(service.renderChangelog(index, false));

        String content = Files.readString(tempDir.resolve("CHANGELOG.md"));
        assertTrue(content.contains("- Fix typo (WI-0001)"));
    }

    @Test
    @DisplayName("renders are counted by kind and outcome")
    void metrics() {
        service.renderAll(index);
        service.renderAll(index);

        assertEquals(6, registry.find("charter.render.total").counters().stream()
                .mapToDouble(Counter::count).sum());
    }
}
