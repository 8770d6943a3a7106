package com.charter.core.signature;

import com.charter.core.diagnostic.Diagnostic;
import com.charter.core.diagnostic.DiagnosticCode;
import com.charter.core.model.Adr;
import com.charter.core.model.ArtifactKind;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.RfcDocument;
import com.charter.core.model.WorkItem;
import com.charter.core.store.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compares the signature embedded in each rendered projection with the signature
 * of the current source record. Artifacts that were never rendered are skipped.
 */
@Service
public class SignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(SignatureVerifier.class);

    private final CanonicalSigner signer;

    public SignatureVerifier(CanonicalSigner signer) {
        this.signer = signer;
    }

    public List<Diagnostic> verify(GovernanceIndex index, Path docsRoot) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (RfcDocument document : index.rfcs()) {
            verifyOne(docsRoot, ArtifactKind.RFC, document.id(), signer.sign(document)).ifPresent(diagnostics::add);
        }
        for (Adr adr : index.adrs()) {
            verifyOne(docsRoot, ArtifactKind.ADR, adr.id(), signer.sign(adr)).ifPresent(diagnostics::add);
        }
        for (WorkItem item : index.workItems()) {
            verifyOne(docsRoot, ArtifactKind.WORK_ITEM, item.id(), signer.sign(item)).ifPresent(diagnostics::add);
        }
        return diagnostics;
    }

    Optional<Diagnostic> verifyOne(Path docsRoot, ArtifactKind kind, String id, String expected) {
        Path projection = ProjectionPaths.of(docsRoot, kind, id);
        if (!Files.isRegularFile(projection)) {
            return Optional.empty();
        }
        String location = projection.toString().replace('\\', '/');
        Optional<ProjectionHeader> header = ProjectionHeader.parse(AtomicFiles.read(projection));
        if (header.isEmpty() || header.get().signature() == null) {
            return Optional.of(Diagnostic.of(DiagnosticCode.SIGNATURE_MISSING, id,
                    "projection has no signature; re-render it").at(location));
        }
        if (!header.get().signature().equals(expected)) {
            log.debug("Signature mismatch for {}: projection {} source {}", id, header.get().signature(), expected);
            return Optional.of(Diagnostic.of(DiagnosticCode.TAMPER_OR_STALE, id,
                    "projection is stale or was edited by hand; re-render it").at(location));
        }
        return Optional.empty();
    }
}
