package com.charter.core.check;

import com.charter.core.diagnostic.Diagnostic;
import com.charter.core.diagnostic.Severity;

import java.util.List;

/**
 * Outcome of a verification pass.
 *
 * @param diagnostics every problem found, in {@link Diagnostic#ORDER}
 */
public record CheckReport(List<Diagnostic> diagnostics) {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;

    public CheckReport {
        diagnostics = diagnostics.stream().sorted(Diagnostic.ORDER).toList();
    }

    public long errorCount() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.ERROR).count();
    }

    public long warningCount() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.WARNING).count();
    }

    /** In strict mode warnings fail the check as well. */
    public boolean passed(boolean strict) {
        return errorCount() == 0 && (!strict || warningCount() == 0);
    }

    public int exitCode(boolean strict) {
        return passed(strict) ? EXIT_OK : EXIT_FAILED;
    }
}
