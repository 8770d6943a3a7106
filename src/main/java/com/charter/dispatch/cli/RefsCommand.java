package com.charter.dispatch.cli;

import com.charter.core.refs.ArtifactState;
import com.charter.core.refs.ReferenceResolver;
import com.charter.core.refs.ResolvedRefs;
import com.charter.core.store.ArtifactStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: charter refs &lt;id&gt;
 * <p>
 * Lists what an artifact references, through {@code refs} and inline mentions,
 * with the state of each target.
 */
@Command(name = "refs", mixinStandardHelpOptions = true, description = "Resolve the references of an artifact")
@Component
public class RefsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Artifact ID")
    private String artifactId;

    private final ArtifactStore store;
    private final ReferenceResolver resolver;

    public RefsCommand(ArtifactStore store, ReferenceResolver resolver) {
        this.store = store;
        this.resolver = resolver;
    }

    @Override
    public Integer call() {
        ResolvedRefs resolved = resolver.resolveRefs(store.loadIndex(), artifactId);
        if (!resolved.isResolved()) {
            ConsoleOutput.diagnostics(resolved.diagnostics());
            return CliExceptionHandler.EXIT_REJECTED;
        }
        if (resolved.refs().isEmpty()) {
            ConsoleOutput.info(artifactId + " references nothing");
        }
        for (ArtifactState state : resolved.refs()) {
            if (state.isOutdated()) {
                ConsoleOutput.info(state.id() + " (outdated: " + state.reason() + ")");
            } else {
                ConsoleOutput.success(state.id());
            }
        }
        return 0;
    }
}
