package com.charter.core.check;

import com.charter.core.diagnostic.Diagnostic;
import com.charter.core.diagnostic.DiagnosticCode;
import com.charter.core.diagnostic.Severity;
import com.charter.core.logging.MdcContext;
import com.charter.core.metrics.CharterMetrics;
import com.charter.core.model.ArtifactKind;
import com.charter.core.model.GovernanceIndex;
import com.charter.core.model.RfcDocument;
import com.charter.core.refs.ReferenceResolver;
import com.charter.core.signature.CanonicalSigner;
import com.charter.core.signature.SignatureVerifier;
import com.charter.core.store.WorkspacePaths;
import com.charter.core.validation.AmendmentPolicy;
import com.charter.core.validation.StateMachineValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the full verification pass: lifecycle invariants, references (including the
 * source tree) and projection signatures.
 */
@Service
public class CheckService {

    private static final Logger log = LoggerFactory.getLogger(CheckService.class);

    private final StateMachineValidator validator;
    private final ReferenceResolver resolver;
    private final SignatureVerifier verifier;
    private final CanonicalSigner signer;
    private final CharterMetrics metrics;
    private final WorkspacePaths paths;

    public CheckService(StateMachineValidator validator, ReferenceResolver resolver, SignatureVerifier verifier,
                        CanonicalSigner signer, CharterMetrics metrics, WorkspacePaths paths) {
        this.validator = validator;
        this.resolver = resolver;
        this.verifier = verifier;
        this.signer = signer;
        this.metrics = metrics;
        this.paths = paths;
    }

    public CheckReport check(GovernanceIndex index) {
        MdcContext.setOperation("check");
        long start = System.currentTimeMillis();
        try {
            List<Diagnostic> diagnostics = new ArrayList<>();
            diagnostics.addAll(validator.validate(index));
            diagnostics.addAll(amendments(index));
            diagnostics.addAll(resolver.validate(index));
            diagnostics.addAll(resolver.validateSources(index));
            diagnostics.addAll(verifier.verify(index, paths.docsRoot()));

            CheckReport report = new CheckReport(diagnostics);
            metrics.recordDiagnostics(Severity.ERROR, report.errorCount());
            metrics.recordDiagnostics(Severity.WARNING, report.warningCount());
            log.info("Check finished: {} errors, {} warnings", report.errorCount(), report.warningCount());
            return report;
        } finally {
            metrics.recordCheckDuration(System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    /**
     * Lifecycle and content invariants only, optionally restricted to one kind.
     *
     * @param kind {@code null} for every kind
     */
    public CheckReport validate(GovernanceIndex index, ArtifactKind kind) {
        List<Diagnostic> diagnostics = new ArrayList<>(validator.validate(index, kind));
        if (kind == null || kind == ArtifactKind.RFC) {
            diagnostics.addAll(amendments(index));
        }
        return new CheckReport(diagnostics);
    }

    private List<Diagnostic> amendments(GovernanceIndex index) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (RfcDocument document : index.rfcs()) {
            if (AmendmentPolicy.isAmended(document.rfc(), signer.contentSignature(document))) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.AMENDMENT_UNRELEASED, document.id(),
                        "content changed since v" + document.rfc().version() + "; bump the version to release it"));
            }
        }
        return diagnostics;
    }
}
