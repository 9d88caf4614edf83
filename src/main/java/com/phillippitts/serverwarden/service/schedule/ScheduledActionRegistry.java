package com.phillippitts.serverwarden.service.schedule;

import com.phillippitts.serverwarden.domain.ActionKind;
import com.phillippitts.serverwarden.exception.InvalidScheduleException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds at most one pending delayed action per {@link ActionKind}.
 *
 * <p>Scheduling a kind that is already pending replaces it, which also discards its sent warnings.
 * An executed action is removed regardless of its outcome; it is never retried at the same instant.
 * When several actions are due on the same tick, only the earliest is released so the managed
 * process is never targeted twice in one tick; the rest stay pending for the next tick.
 *
 * <p>Mutated by the orchestration loop; safe to read from other threads.
 */
@Component
public class ScheduledActionRegistry {

    private static final Logger LOG = LogManager.getLogger(ScheduledActionRegistry.class);

    private static final Comparator<ScheduledAction> BY_DUE_TIME =
            Comparator.comparing(ScheduledAction::scheduledAt).thenComparing(ScheduledAction::kind);

    private final Clock clock;
    private final Map<ActionKind, ScheduledAction> pending = new ConcurrentHashMap<>();

    public ScheduledActionRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Schedules {@code kind} to execute {@code delayMinutes} from now, replacing any pending action of that kind.
     */
    public ScheduledAction schedule(ActionKind kind, int delayMinutes, String requestedBy) {
        return schedule(kind, delayMinutes, requestedBy, clock.instant());
    }

    /**
     * Schedules {@code kind} to execute {@code delayMinutes} after {@code createdAt}.
     *
     * @throws InvalidScheduleException if the delay is negative
     */
    public ScheduledAction schedule(ActionKind kind, int delayMinutes, String requestedBy, Instant createdAt) {
        Objects.requireNonNull(kind, "kind");
        if (delayMinutes < 0) {
            throw new InvalidScheduleException("Delay must not be negative", String.valueOf(delayMinutes));
        }
        ScheduledAction action = new ScheduledAction(kind, createdAt,
                createdAt.plus(Duration.ofMinutes(delayMinutes)), requestedBy);
        ScheduledAction replaced = pending.put(kind, action);
        if (replaced != null) {
            LOG.info("Replaced pending {} (was due {}) with one due {} requested by {}",
                    kind, replaced.scheduledAt(), action.scheduledAt(), action.requestedBy());
        } else {
            LOG.info("Scheduled {} in {}m (due {}) requested by {}, warnings at {}m",
                    kind, delayMinutes, action.scheduledAt(), action.requestedBy(), action.warningThresholds());
        }
        return action;
    }

    /**
     * Cancels the pending action of {@code kind}.
     *
     * @return the cancelled action, or empty when none was pending
     */
    public Optional<ScheduledAction> cancel(ActionKind kind) {
        ScheduledAction removed = pending.remove(kind);
        if (removed != null) {
            LOG.info("Cancelled pending {} due {}", kind, removed.scheduledAt());
        }
        return Optional.ofNullable(removed);
    }

    public Optional<ScheduledAction> pending(ActionKind kind) {
        return Optional.ofNullable(pending.get(kind));
    }

    /** Pending actions ordered by due time. */
    public List<ScheduledAction> pendingActions() {
        List<ScheduledAction> actions = new ArrayList<>(pending.values());
        actions.sort(BY_DUE_TIME);
        return actions;
    }

    /** Earliest due time among pending actions, or empty. */
    public Optional<Instant> nextExecutionAt() {
        return pending.values().stream().map(ScheduledAction::scheduledAt).min(Comparator.naturalOrder());
    }

    /**
     * Evaluates warnings and executions at {@code now}.
     *
     * <p>The action released for execution is removed from the registry before it is returned.
     */
    public RegistryTick tick(Instant now) {
        return tick(now, true);
    }

    /**
     * Evaluates warnings and, when {@code executionAllowed}, executions at {@code now}.
     * Due actions that may not execute stay registered for a later tick.
     */
    public RegistryTick tick(Instant now, boolean executionAllowed) {
        List<ScheduledAction> ordered = pendingActions();
        ScheduledAction execute = null;
        for (ScheduledAction action : ordered) {
            if (executionAllowed && action.isDue(now)) {
                execute = action;
                break;
            }
        }
        List<ScheduledAction> executions = new ArrayList<>(1);
        if (execute != null && pending.remove(execute.kind(), execute)) {
            executions.add(execute);
            LOG.info("{} due (scheduled {}); releasing for execution", execute.kind(), execute.scheduledAt());
        }

        List<DueWarning> warnings = new ArrayList<>();
        for (ScheduledAction action : ordered) {
            if (action == execute || action.isDue(now)) {
                continue;
            }
            for (Integer minutes : action.dueWarnings(now)) {
                warnings.add(new DueWarning(action.kind(), minutes));
            }
        }
        return new RegistryTick(warnings, executions);
    }
}
