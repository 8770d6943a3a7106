package com.charter.dispatch.cli;

import com.charter.core.signature.CanonicalSigner;
import com.charter.core.store.ArtifactStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Optional;
import java.util.concurrent.Callable;

@Command(name = "sign", mixinStandardHelpOptions = true,
        description = "Print the canonical SHA-256 signature of an artifact")
@Component
public class SignCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "RFC, ADR or work item ID")
    private String artifactId;

    private final ArtifactStore store;
    private final CanonicalSigner signer;

    public SignCommand(ArtifactStore store, CanonicalSigner signer) {
        this.store = store;
        this.signer = signer;
    }

    @Override
    public Integer call() {
        Optional<String> signature = signer.sign(store.loadIndex(), artifactId);
        if (signature.isEmpty()) {
            ConsoleOutput.error("Artifact not found: " + artifactId);
            return CliExceptionHandler.EXIT_REJECTED;
        }
        System.out.println("sha256:" + signature.get());
        return 0;
    }
}
