package com.phillippitts.serverwarden.service.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Tracks the due time of a job that repeats at a fixed interval after each run.
 * A non-positive interval disables the job.
 */
final class IntervalSchedule {

    private final String name;
    private final Duration interval;
    private volatile Instant nextDueAt;
    private volatile Instant lastRunAt;

    IntervalSchedule(String name, Duration interval, Instant start) {
        this.name = Objects.requireNonNull(name, "name");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.nextDueAt = isEnabled() ? start.plus(interval) : null;
    }

    boolean isEnabled() {
        return !interval.isZero() && !interval.isNegative();
    }

    boolean isDue(Instant now) {
        return isEnabled() && !now.isBefore(nextDueAt);
    }

    void markRun(Instant now) {
        lastRunAt = now;
        if (isEnabled()) {
            nextDueAt = now.plus(interval);
        }
    }

    String name() {
        return name;
    }

    Instant nextDueAt() {
        return nextDueAt;
    }

    Instant lastRunAt() {
        return lastRunAt;
    }
}
