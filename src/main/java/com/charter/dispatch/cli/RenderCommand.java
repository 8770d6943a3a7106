package com.charter.dispatch.cli;

import com.charter.core.model.GovernanceIndex;
import com.charter.core.render.RenderReport;
import com.charter.core.render.RenderService;
import com.charter.core.store.ArtifactStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: charter render [ID] [--changelog] [--force] [--stdout]
 * <p>
 * Without arguments writes every projection and the changelog. Only files whose
 * content changes are rewritten.
 */
@Command(name = "render", mixinStandardHelpOptions = true, description = "Render markdown projections")
@Component
public class RenderCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Artifact to render (a clause renders its RFC)")
    private String artifactId;

    @Option(names = {"--changelog", "-c"}, description = "Only regenerate the changelog")
    private boolean changelogOnly;

    @Option(names = {"--force", "-f"}, description = "Regenerate released changelog sections too")
    private boolean force;

    @Option(names = "--stdout", description = "Print the projection of ID instead of writing it")
    private boolean stdout;

    private final ArtifactStore store;
    private final RenderService renderService;

    public RenderCommand(ArtifactStore store, RenderService renderService) {
        this.store = store;
        this.renderService = renderService;
    }

    @Override
    public Integer call() {
        GovernanceIndex index = store.loadIndex();
        if (artifactId != null) {
            if (stdout) {
                System.out.print(renderService.render(index, artifactId));
                return 0;
            }
            print(renderService.renderOne(index, artifactId));
            return 0;
        }
        if (!changelogOnly) {
            RenderReport report = renderService.renderAll(index);
            print(report);
            ConsoleOutput.info(report.written().size() + " written, " + report.unchanged().size() + " unchanged");
        }
        boolean changed = renderService.renderChangelog(index, force);
        ConsoleOutput.info(changed ? "Changelog updated" : "Changelog unchanged");
        return 0;
    }

    private static void print(RenderReport report) {
        for (Path path : report.written()) {
            ConsoleOutput.fileChange(true, path.toString());
        }
        for (Path path : report.unchanged()) {
            ConsoleOutput.fileChange(false, path.toString());
        }
    }
}
