package com.charter.dispatch.cli;

import com.charter.core.lifecycle.LifecycleService;
import com.charter.core.model.Release;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.LocalDate;
import java.util.concurrent.Callable;

/**
 * CLI command: charter release &lt;version&gt; [--date yyyy-MM-dd]
 * <p>
 * Ships every done work item not yet released. Run {@code render --changelog}
 * afterwards to publish the section.
 */
@Command(name = "release", mixinStandardHelpOptions = true, description = "Cut a release of completed work")
@Component
public class ReleaseCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Semantic version, e.g. 1.2.0")
    private String version;

    @Option(names = {"--date", "-d"}, description = "Release date (default: today)")
    private LocalDate date;

    private final LifecycleService lifecycle;

    public ReleaseCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        Release release = lifecycle.release(version, date);
        ConsoleOutput.success("Released " + release.version() + " (" + release.date() + ")");
        release.refs().forEach(id -> ConsoleOutput.info("  " + id));
        return 0;
    }
}
