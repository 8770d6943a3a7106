package com.charter.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Charter.
 */
@Command(
        name = "charter",
        mixinStandardHelpOptions = true,
        version = "Charter 0.1.0",
        description = "Keeps RFCs, ADRs and work items consistent, signed and rendered",
        subcommands = {
                CheckCommand.class,
                RenderCommand.class,
                NewCommand.class,
                EditCommand.class,
                MoveCommand.class,
                SupersedeCommand.class,
                BumpCommand.class,
                ReleaseCommand.class,
                DeleteCommand.class,
                RefsCommand.class,
                SignCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CharterCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
