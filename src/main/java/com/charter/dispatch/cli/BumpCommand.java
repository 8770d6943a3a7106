package com.charter.dispatch.cli;

import com.charter.core.lifecycle.LifecycleService;
import com.charter.core.model.BumpLevel;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: charter bump &lt;rfc-id&gt; --level minor --summary "..." [--change "..."]...
 */
@Command(name = "bump", mixinStandardHelpOptions = true, description = "Record a new RFC version")
@Component
public class BumpCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "RFC ID")
    private String rfcId;

    @Option(names = {"--level", "-l"}, defaultValue = "patch",
            description = "patch, minor or major (default: ${DEFAULT-VALUE})")
    private String level;

    @Option(names = {"--summary", "-m"}, required = true, description = "Changelog summary")
    private String summary;

    @Option(names = {"--change", "-c"}, description = "Changelog bullet (repeatable)")
    private List<String> changes = new ArrayList<>();

    private final LifecycleService lifecycle;

    public BumpCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        BumpLevel bumpLevel;
        try {
            bumpLevel = BumpLevel.fromId(level);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid level: " + level + ". Valid levels: patch, minor, major");
            return CliExceptionHandler.EXIT_REJECTED;
        }
        String version = lifecycle.bump(rfcId, bumpLevel, summary, changes);
        ConsoleOutput.success(rfcId + " is now v" + version);
        return 0;
    }
}
