package com.charter.dispatch.cli;

import com.charter.core.check.CheckReport;
import com.charter.core.check.CheckService;
import com.charter.core.model.ArtifactKind;
import com.charter.core.store.ArtifactStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: charter check [--strict] [--kind rfc|adr|work]
 * <p>
 * Without {@code --kind} runs the full pass: lifecycle invariants, references,
 * source-tree mentions and projection signatures. With {@code --kind} only the
 * lifecycle and content rules of that kind are checked.
 */
@Command(name = "check", mixinStandardHelpOptions = true, description = "Verify the governance store")
@Component
public class CheckCommand implements Callable<Integer> {

    @Option(names = {"--strict", "-s"}, description = "Treat warnings as errors")
    private boolean strict;

    @Option(names = {"--kind", "-k"}, description = "Only validate one kind: rfc, clause, adr, work")
    private String kind;

    private final ArtifactStore store;
    private final CheckService checkService;

    public CheckCommand(ArtifactStore store, CheckService checkService) {
        this.store = store;
        this.checkService = checkService;
    }

    @Override
    public Integer call() {
        CheckReport report;
        if (kind == null) {
            report = checkService.check(store.loadIndex());
        } else {
            ArtifactKind selected;
            try {
                selected = ArtifactKind.fromId(kind);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Invalid kind: " + kind + ". Valid kinds: rfc, clause, adr, work");
                return CliExceptionHandler.EXIT_REJECTED;
            }
            report = checkService.validate(store.loadIndex(), selected);
        }

        ConsoleOutput.diagnostics(report.diagnostics());
        ConsoleOutput.summary(report.errorCount(), report.warningCount());
        if (report.passed(strict)) {
            ConsoleOutput.success("Check passed");
        } else {
            ConsoleOutput.error("Check failed" + (strict && report.errorCount() == 0 ? " (strict)" : ""));
        }
        return report.exitCode(strict);
    }
}
