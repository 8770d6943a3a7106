package com.charter.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Charter-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOperation(String operation) {
        MDC.put("operation", operation);
    }

    public static void setArtifact(String artifactId, String operation) {
        MDC.put("artifactId", artifactId);
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("artifactId");
        MDC.remove("operation");
    }
}
