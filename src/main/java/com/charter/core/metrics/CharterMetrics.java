package com.charter.core.metrics;

import com.charter.core.diagnostic.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for governance checks, renders and transitions.
 */
@Service
public class CharterMetrics {

    private final MeterRegistry registry;

    public CharterMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCheckDuration(long ms) {
        Timer.builder("charter.check.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Adds the diagnostics of one pass to the per-severity counter.
     *
     * @param severity error or warning
     * @param count    number of diagnostics with that severity
     */
    public void recordDiagnostics(Severity severity, long count) {
        Counter.builder("charter.diagnostics.total")
                .description("Diagnostics reported by check passes")
                .tag("severity", severity.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment(count);
    }

    public void recordRender(String kind, boolean changed) {
        Counter.builder("charter.render.total")
                .tag("kind", kind)
                .tag("changed", String.valueOf(changed))
                .register(registry)
                .increment();
    }

    /**
     * @param kind    artifact kind, e.g. {@code rfc}
     * @param applied whether the transition was persisted
     */
    public void recordTransition(String kind, boolean applied) {
        Counter.builder("charter.transitions.total")
                .description("Lifecycle operations by outcome")
                .tag("kind", kind)
                .tag("outcome", applied ? "applied" : "rejected")
                .register(registry)
                .increment();
    }
}
