package com.charter.dispatch.cli;

import com.charter.core.config.CharterProperties;
import com.charter.core.lifecycle.LifecycleService;
import com.charter.core.model.Adr;
import com.charter.core.model.Clause;
import com.charter.core.model.ClauseKind;
import com.charter.core.model.Rfc;
import com.charter.core.model.WorkItem;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.List;

/**
 * CLI command: charter new rfc|clause|adr|work ...
 * <p>
 * Allocates an id and writes the new artifact in its initial state.
 */
@Command(name = "new", mixinStandardHelpOptions = true, description = "Create an artifact")
@Component
public class NewCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    private final LifecycleService lifecycle;
    private final CharterProperties properties;

    public NewCommand(LifecycleService lifecycle, CharterProperties properties) {
        this.lifecycle = lifecycle;
        this.properties = properties;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "rfc", mixinStandardHelpOptions = true, description = "Create a draft RFC")
    int rfc(@Parameters(index = "0", paramLabel = "TITLE") String title,
            @Option(names = {"--owner", "-o"}, description = "Owner (repeatable)") List<String> owners) {
        List<String> resolved = owners;
        if ((resolved == null || resolved.isEmpty()) && !properties.getDefaultOwner().isBlank()) {
            resolved = List.of(properties.getDefaultOwner());
        }
        Rfc rfc = lifecycle.createRfc(title, resolved);
        ConsoleOutput.success("Created " + rfc.id() + ": " + rfc.title());
        return 0;
    }

    @Command(name = "clause", mixinStandardHelpOptions = true, description = "Add a clause to an RFC")
    int clause(@Parameters(index = "0", paramLabel = "RFC-ID") String rfcId,
               @Parameters(index = "1", paramLabel = "CLAUSE-ID", description = "e.g. C-SCOPE") String clauseId,
               @Parameters(index = "2", paramLabel = "TITLE") String title,
               @Option(names = {"--section"}, defaultValue = "Specification",
                       description = "Section title (default: ${DEFAULT-VALUE})") String section,
               @Option(names = {"--informative"}, description = "Informative instead of normative") boolean informative) {
        Clause clause = lifecycle.createClause(rfcId, clauseId, title, section,
                informative ? ClauseKind.INFORMATIVE : ClauseKind.NORMATIVE);
        ConsoleOutput.success("Created " + rfcId + ":" + clause.id() + " in section " + section);
        return 0;
    }

    @Command(name = "adr", mixinStandardHelpOptions = true, description = "Propose an ADR")
    int adr(@Parameters(index = "0", paramLabel = "TITLE") String title) {
        Adr adr = lifecycle.createAdr(title);
        ConsoleOutput.success("Created " + adr.id() + ": " + adr.title());
        return 0;
    }

    @Command(name = "work", mixinStandardHelpOptions = true, description = "Queue a work item")
    int work(@Parameters(index = "0", paramLabel = "TITLE") String title) {
        WorkItem item = lifecycle.createWorkItem(title);
        ConsoleOutput.success("Created " + item.id() + ": " + item.title());
        return 0;
    }
}
