package com.charter.dispatch.cli;

import com.charter.core.diagnostic.Diagnostic;
import com.charter.core.diagnostic.Severity;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the Charter CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CHARTER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CHARTER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void fileChange(boolean written, String path) {
        String symbol = written ? "@|fg(green) ~|@" : "@|faint =|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  " + symbol + " " + path));
    }

    public static void diagnostic(Diagnostic diagnostic) {
        String color = diagnostic.severity() == Severity.ERROR ? "fg(red)" : "fg(yellow)";
        String text = diagnostic.format();
        int split = text.indexOf(']') + 1;
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + " " + text.substring(0, split) + "|@" + text.substring(split)));
    }

    public static void diagnostics(List<Diagnostic> diagnostics) {
        diagnostics.forEach(ConsoleOutput::diagnostic);
    }

    public static void summary(long errors, long warnings) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                (errors > 0 ? "@|fg(red) " : "@|fg(green) ") + errors + " error" + (errors != 1 ? "s" : "") + "|@, "
                        + (warnings > 0 ? "@|fg(yellow) " : "@|fg(green) ") + warnings + " warning"
                        + (warnings != 1 ? "s" : "") + "|@"));
    }
}
