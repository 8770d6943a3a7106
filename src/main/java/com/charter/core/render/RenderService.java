package com.charter.core.render;

import com.charter.core.logging.MdcContext;
import com.charter.core.metrics.CharterMetrics;
import com.charter.core.model.Adr;
import com.charter.core.model.ArtifactKind;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.WorkItem;
import com.charter.core.refs.ReferenceIndex;
import com.charter.core.refs.ReferenceResolver;
import com.charter.core.signature.CanonicalSigner;
import com.charter.core.signature.ProjectionPaths;
import com.charter.core.store.AtomicFiles;
import com.charter.core.store.WorkspacePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Signs artifacts and writes their markdown projections and the changelog.
 * Files are only rewritten when their content changes.
 */
@Service
public class RenderService {

    private static final Logger log = LoggerFactory.getLogger(RenderService.class);

    private final CanonicalSigner signer;
    private final ReferenceResolver resolver;
    private final MarkdownRenderer markdown;
    private final ChangelogRenderer changelog;
    private final CharterMetrics metrics;
    private final WorkspacePaths paths;

    public RenderService(CanonicalSigner signer, ReferenceResolver resolver, MarkdownRenderer markdown,
                         ChangelogRenderer changelog, CharterMetrics metrics, WorkspacePaths paths) {
        this.signer = signer;
        this.resolver = resolver;
        this.markdown = markdown;
        this.changelog = changelog;
        this.metrics = metrics;
        this.paths = paths;
    }

    /**
     * Renders one artifact to text without writing it. A clause id renders its RFC.
     *
     * @throws NoSuchElementException if no such artifact exists
     */
    public String render(GovernanceIndex index, String artifactId) {
        return render(index, resolver.index(index), artifactId);
    }

    /** Writes the projection of every artifact in the store. */
    public RenderReport renderAll(GovernanceIndex index) {
        ReferenceIndex refs = resolver.index(index);
        List<Path> written = new ArrayList<>();
        List<Path> unchanged = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        index.rfcs().forEach(doc -> ids.add(doc.id()));
        index.adrs().forEach(adr -> ids.add(adr.id()));
        index.workItems().forEach(item -> ids.add(item.id()));
        for (String id : ids) {
            Path target = projectionPath(id);
            if (write(target, render(index, refs, id), ArtifactKind.ofId(id))) {
                written.add(target);
            } else {
                unchanged.add(target);
            }
        }
        log.info("Rendered {} projections ({} updated)", ids.size(), written.size());
        return new RenderReport(written, unchanged);
    }

    /** Writes the projection of one artifact; a clause id writes its RFC. */
    public RenderReport renderOne(GovernanceIndex index, String artifactId) {
        String id = owningId(artifactId);
        String content = render(index, id);
        Path target = projectionPath(id);
        boolean changed = write(target, content, ArtifactKind.ofId(id));
        return changed ? new RenderReport(List.of(target), List.of()) : new RenderReport(List.of(), List.of(target));
    }

    /**
     * Regenerates the changelog file.
     *
     * @param force regenerate released sections instead of keeping them verbatim
     * @return whether the file content changed
     */
    public boolean renderChangelog(GovernanceIndex index, boolean force) {
        Path file = paths.changelogFile();
        String existing = Files.isRegularFile(file) ? AtomicFiles.read(file) : null;
        String content = changelog.render(index, existing, force);
        boolean changed = !content.equals(existing);
        if (changed) {
            AtomicFiles.write(file, content);
            log.info("Changelog written to {}", file);
        }
        metrics.recordRender("changelog", changed);
        return changed;
    }

    private String render(GovernanceIndex index, ReferenceIndex refs, String artifactId) {
        String id = owningId(artifactId);
        MdcContext.setArtifact(id, "render");
        try {
            ArtifactKind kind = ArtifactKind.ofId(id);
            if (kind == ArtifactKind.RFC) {
                RfcDocument document = require(index.rfc(id), id);
                return markdown.renderRfc(document, refs, signer.sign(document));
            }
            if (kind == ArtifactKind.ADR) {
                Adr adr = require(index.adr(id), id);
                return markdown.renderAdr(adr, refs, signer.sign(adr));
            }
            if (kind == ArtifactKind.WORK_ITEM) {
                WorkItem item = require(index.workItem(id), id);
                return markdown.renderWorkItem(item, refs, signer.sign(item));
            }
            throw new NoSuchElementException("Unknown artifact: " + artifactId);
        } finally {
            MdcContext.clear();
        }
    }

    private boolean write(Path target, String content, ArtifactKind kind) {
        boolean changed = !Files.isRegularFile(target) || !AtomicFiles.read(target).equals(content);
        if (changed) {
            AtomicFiles.write(target, content);
            log.debug("Wrote {}", target);
        }
        metrics.recordRender(kind.id(), changed);
        return changed;
    }

    private Path projectionPath(String id) {
        return ProjectionPaths.of(paths.docsRoot(), ArtifactKind.ofId(id), id);
    }

    private static String owningId(String artifactId) {
        int separator = artifactId.indexOf(ArtifactKind.CLAUSE_SEPARATOR);
        return separator > 0 ? artifactId.substring(0, separator) : artifactId;
    }

    private static <T> T require(Optional<T> value, String id) {
        return value.orElseThrow(() -> new NoSuchElementException("Unknown artifact: " + id));
    }
}
