package com.charter.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CharterCommand charterCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(CharterCommand charterCommand, IFactory factory) {
        this.charterCommand = charterCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = CliExceptionHandler.commandLine(charterCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
