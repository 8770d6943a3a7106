package com.charter.dispatch.cli;

import com.charter.core.edit.EditRejectedException;
import com.charter.core.store.SchemaException;
import com.charter.core.store.StoreIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

import java.util.NoSuchElementException;

/**
 * Maps core exceptions onto exit codes: rejected input exits with 1, an unreadable
 * or unwritable store with 2. Anything else propagates.
 */
public class CliExceptionHandler implements IExecutionExceptionHandler {

    public static final int EXIT_REJECTED = 1;
    public static final int EXIT_FATAL = 2;

    private static final Logger log = LoggerFactory.getLogger(CliExceptionHandler.class);

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult)
            throws Exception {
        if (ex instanceof EditRejectedException || ex instanceof NoSuchElementException) {
            ConsoleOutput.error(ex.getMessage());
            return EXIT_REJECTED;
        }
        if (ex instanceof SchemaException || ex instanceof StoreIoException) {
            log.error("Governance store unusable", ex);
            ConsoleOutput.error("Store error: " + ex.getMessage());
            return EXIT_FATAL;
        }
        throw ex;
    }

    /** Root command line with the exit-code mapping installed. */
    public static CommandLine commandLine(Object command, CommandLine.IFactory factory) {
        return new CommandLine(command, factory).setExecutionExceptionHandler(new CliExceptionHandler());
    }
}
