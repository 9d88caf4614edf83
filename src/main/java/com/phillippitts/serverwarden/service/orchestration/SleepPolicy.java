package com.phillippitts.serverwarden.service.orchestration;

import com.phillippitts.serverwarden.config.properties.LoopProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Chooses how long the loop sleeps between ticks.
 *
 * <p>Fast cadence ({@code log-check-interval-ms}) while an action executes within the warning
 * horizon or a start is awaited; slow cadence ({@code status-check-interval-ms}) otherwise.
 */
@Component
public class SleepPolicy {

    /** Largest warning threshold (15 minutes) plus one minute of slack. */
    static final Duration WARNING_HORIZON = Duration.ofMinutes(16);

    private final Duration fast;
    private final Duration slow;

    @Autowired
    public SleepPolicy(LoopProperties props) {
        this(Duration.ofMillis(props.getLogCheckIntervalMs()), Duration.ofMillis(props.getStatusCheckIntervalMs()));
    }

    SleepPolicy(Duration fast, Duration slow) {
        this.fast = fast;
        this.slow = slow;
    }

    /**
     * @param now             current time
     * @param nextExecutionAt earliest pending execution (scheduled action or periodic restart)
     * @param awaitingStartup whether a start issued by the orchestrator is still awaited
     */
    public Duration nextSleep(Instant now, Optional<Instant> nextExecutionAt, boolean awaitingStartup) {
        if (awaitingStartup) {
            return fast;
        }
        if (nextExecutionAt.isPresent()
                && Duration.between(now, nextExecutionAt.get()).compareTo(WARNING_HORIZON) <= 0) {
            return fast;
        }
        return slow;
    }
}
