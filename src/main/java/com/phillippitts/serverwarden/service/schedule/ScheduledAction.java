package com.phillippitts.serverwarden.service.schedule;

import com.phillippitts.serverwarden.domain.ActionKind;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A pending delayed action with its own warning schedule.
 *
 * <p>The warning thresholds are chosen once from the original requested delay
 * ({@code scheduledAt - createdAt}), not from the time remaining at any later tick.
 */
public final class ScheduledAction {

    private final ActionKind kind;
    private final Instant createdAt;
    private final Instant scheduledAt;
    private final String requestedBy;
    private final TieredWarningTimer warnings;

    ScheduledAction(ActionKind kind, Instant createdAt, Instant scheduledAt, String requestedBy) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.scheduledAt = Objects.requireNonNull(scheduledAt, "scheduledAt");
        this.requestedBy = requestedBy == null ? "unknown" : requestedBy;
        this.warnings = TieredWarningTimer.forOriginalDelay(Duration.between(createdAt, scheduledAt));
    }

    public ActionKind kind() {
        return kind;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant scheduledAt() {
        return scheduledAt;
    }

    public String requestedBy() {
        return requestedBy;
    }

    public Duration originalDelay() {
        return Duration.between(createdAt, scheduledAt);
    }

    public Duration remaining(Instant now) {
        return Duration.between(now, scheduledAt);
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(scheduledAt);
    }

    /** Minute thresholds this action warns at, largest first. */
    public List<Integer> warningThresholds() {
        return warnings.thresholds();
    }

    /** Minute thresholds already announced. */
    public Set<Integer> warningsSent() {
        return warnings.sent();
    }

    List<Integer> dueWarnings(Instant now) {
        return warnings.due(remaining(now));
    }

    @Override
    public String toString() {
        return "ScheduledAction{" + kind + " at " + scheduledAt + " by " + requestedBy
                + ", warningsSent=" + warnings.sent() + '}';
    }
}
