package com.charter.core.diagnostic;

/**
 * Diagnostic severity. Declaration order is the reporting order.
 */
public enum Severity {
    ERROR,
    WARNING
}
