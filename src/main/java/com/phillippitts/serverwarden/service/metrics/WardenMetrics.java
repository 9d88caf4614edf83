package com.phillippitts.serverwarden.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the orchestration loop.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Tick duration</li>
 *   <li>Executed actions by kind and outcome</li>
 *   <li>Auto-recovery attempts</li>
 *   <li>Warnings sent and status transitions</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class WardenMetrics {

    private static final String METRIC_PREFIX = "warden";

    private final MeterRegistry registry;

    public WardenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTick(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".tick.duration")
                .description("Time taken by one orchestration tick")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param action  action name (restart, stop, update, periodic-restart, start, backup)
     * @param success whether it succeeded
     */
    public void recordAction(String action, boolean success) {
        Counter.builder(METRIC_PREFIX + ".actions")
                .description("Number of executed actions")
                .tag("action", action)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void incrementRecoveryAttempt() {
        Counter.builder(METRIC_PREFIX + ".recovery.attempts")
                .description("Number of automatic restart attempts")
                .register(registry)
                .increment();
    }

    /**
     * @param source which timer fired it (scheduled or periodic)
     */
    public void incrementWarning(String source) {
        Counter.builder(METRIC_PREFIX + ".warnings")
                .description("Number of countdown warnings sent")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordStatusTransition(String toKind) {
        Counter.builder(METRIC_PREFIX + ".status.transitions")
                .description("Number of status transitions by target status")
                .tag("to", toKind.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void incrementTickFailure() {
        Counter.builder(METRIC_PREFIX + ".tick.failures")
                .description("Number of ticks aborted by an unexpected error")
                .register(registry)
                .increment();
    }
}
