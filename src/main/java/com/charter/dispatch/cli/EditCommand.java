package com.charter.dispatch.cli;

import com.charter.core.edit.ArtifactEditor;
import com.charter.core.edit.MatchOptions;
import com.charter.core.model.ChecklistStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: charter edit &lt;id&gt; &lt;field&gt; (--set V | --add V | --remove P | --tick P)
 * <p>
 * List entries are selected by a case-insensitive substring unless {@code --exact},
 * {@code --regex} or {@code --at} says otherwise.
 */
@Command(name = "edit", mixinStandardHelpOptions = true, description = "Edit a field of an artifact")
@Component
public class EditCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Artifact ID (clauses as RFC-0001:C-NAME)")
    private String artifactId;

    @Parameters(index = "1", description = "Field name, or name[i].sub for nested fields")
    private String field;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Action action;

    @Option(names = "--at", description = "Select the entry at this index (negative counts from the end)")
    private Integer at;

    @Option(names = "--exact", description = "Pattern must equal the whole entry")
    private boolean exact;

    @Option(names = "--regex", description = "Pattern is a regular expression")
    private boolean regex;

    @Option(names = "--all", description = "Apply to every matching entry")
    private boolean all;

    @Option(names = "--status", defaultValue = "done",
            description = "Status set by --tick: done, pending, cancelled (default: ${DEFAULT-VALUE})")
    private String status;

    static class Action {
        @Option(names = "--set", description = "Replace a scalar field") String set;
        @Option(names = "--add", description = "Append to a list field") String add;
        @Option(names = "--remove", description = "Remove matching list entries") String remove;
        @Option(names = "--tick", description = "Set the status of matching checklist entries") String tick;
    }

    private final ArtifactEditor editor;

    public EditCommand(ArtifactEditor editor) {
        this.editor = editor;
    }

    @Override
    public Integer call() {
        if (action.set != null) {
            editor.setField(artifactId, field, action.set);
            ConsoleOutput.success(artifactId + ": " + field + " updated");
        } else if (action.add != null) {
            editor.addToField(artifactId, field, action.add);
            ConsoleOutput.success(artifactId + ": added to " + field);
        } else if (action.remove != null) {
            int removed = editor.removeFromField(artifactId, field, action.remove, matchOptions());
            ConsoleOutput.success(artifactId + ": removed " + removed + " from " + field);
        } else {
            ChecklistStatus target;
            try {
                target = ChecklistStatus.fromId(status);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Invalid status: " + status + ". Valid: done, pending, cancelled");
                return CliExceptionHandler.EXIT_REJECTED;
            }
            int ticked = editor.tick(artifactId, field, action.tick, matchOptions(), target);
            ConsoleOutput.success(artifactId + ": " + ticked + " entr" + (ticked == 1 ? "y" : "ies")
                    + " marked " + target);
        }
        return 0;
    }

    private MatchOptions matchOptions() {
        return new MatchOptions(at, exact, regex, all);
    }
}
