package com.charter.dispatch.cli;

import com.charter.core.lifecycle.TransitionResult;

/**
 * Prints a lifecycle outcome and turns it into an exit code.
 */
final class TransitionOutput {

    private TransitionOutput() {}

    static int report(TransitionResult result, String successMessage) {
        ConsoleOutput.diagnostics(result.diagnostics());
        if (result.applied()) {
            ConsoleOutput.success(successMessage);
            return 0;
        }
        ConsoleOutput.error(result.artifactId() + ": rejected");
        return CliExceptionHandler.EXIT_REJECTED;
    }
}
