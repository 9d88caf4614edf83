package com.phillippitts.serverwarden.service.schedule;

import com.phillippitts.serverwarden.config.properties.ScheduleProperties;
import com.phillippitts.serverwarden.exception.InvalidScheduleException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Fixed-time daily restarts plus interval-based backups and update checks.
 *
 * <p>Restart warnings use a fixed 15/5/1-minute {@link TieredWarningTimer}: the "original delay" of
 * a periodic restart is always the full interval to the next occurrence, so every threshold applies.
 * When an occurrence is reached it is consumed (next occurrence computed, warning flags reset) before
 * the restart is carried out, so a failing restart is never retried at the same instant.
 *
 * <p>A one-shot skip flag consumes the next occurrence without restarting; warnings are not sent
 * for an occurrence that will be skipped.
 */
@Component
public class PeriodicScheduler {

    private static final Logger LOG = LogManager.getLogger(PeriodicScheduler.class);

    private static final DateTimeFormatter TIME_OF_DAY = DateTimeFormatter.ofPattern("H:mm");

    private final Clock clock;
    private final List<LocalTime> restartTimes;
    private final TieredWarningTimer warnings = TieredWarningTimer.fixed(15, 5, 1);
    private final IntervalSchedule backup;
    private final IntervalSchedule updateCheck;

    private volatile ZonedDateTime nextRestartAt;
    private volatile Instant lastPerformedAt;
    private volatile boolean skipNext;

    @Autowired
    public PeriodicScheduler(ScheduleProperties props, Clock clock) {
        this(parseTimes(props.getRestartTimes()),
                Duration.ofMinutes(props.getBackupIntervalMinutes()),
                Duration.ofMinutes(props.getUpdateCheckIntervalMinutes()),
                clock);
    }

    PeriodicScheduler(List<LocalTime> restartTimes, Duration backupInterval, Duration updateCheckInterval,
                      Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.restartTimes = List.copyOf(new TreeSet<>(restartTimes));
        Instant start = clock.instant();
        this.backup = new IntervalSchedule("backup", backupInterval, start);
        this.updateCheck = new IntervalSchedule("update-check", updateCheckInterval, start);
        this.nextRestartAt = this.restartTimes.isEmpty() ? null
                : nextOccurrence(this.restartTimes, ZonedDateTime.now(clock));
        if (nextRestartAt != null) {
            LOG.info("Periodic restarts at {}; next {}", this.restartTimes, nextRestartAt);
        } else {
            LOG.info("No periodic restart times configured");
        }
    }

    /**
     * Earliest configured time of day strictly after {@code now} today, else the first time tomorrow.
     *
     * @param timesOfDay configured times (any order, must not be empty)
     * @param now        reference time; its zone is used for the result
     */
    public static ZonedDateTime nextOccurrence(List<LocalTime> timesOfDay, ZonedDateTime now) {
        if (timesOfDay.isEmpty()) {
            throw new IllegalArgumentException("At least one time of day is required");
        }
        List<LocalTime> sorted = new ArrayList<>(timesOfDay);
        Collections.sort(sorted);
        ZoneId zone = now.getZone();
        LocalDate today = now.toLocalDate();
        for (LocalTime time : sorted) {
            ZonedDateTime candidate = ZonedDateTime.of(today, time, zone);
            if (candidate.isAfter(now)) {
                return candidate;
            }
        }
        return ZonedDateTime.of(today.plusDays(1), sorted.get(0), zone);
    }

    /**
     * Parses {@code HH:mm} strings.
     *
     * @throws InvalidScheduleException for a malformed entry
     */
    public static List<LocalTime> parseTimes(List<String> values) {
        List<LocalTime> times = new ArrayList<>();
        if (values == null) {
            return times;
        }
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            try {
                times.add(LocalTime.parse(value.trim(), TIME_OF_DAY));
            } catch (DateTimeParseException e) {
                throw new InvalidScheduleException("Restart time must be HH:mm", value, e);
            }
        }
        return times;
    }

    /**
     * Evaluates the restart schedule at {@code now}.
     *
     * @param now              current time
     * @param executionAllowed false when another action already targeted the server this tick; a due
     *                         occurrence then waits for the next tick instead of being consumed
     */
    public PeriodicTick tick(Instant now, boolean executionAllowed) {
        ZonedDateTime occurrence = nextRestartAt;
        if (occurrence == null) {
            return PeriodicTick.idle(List.of(), null);
        }
        if (!now.isBefore(occurrence.toInstant())) {
            if (!executionAllowed) {
                LOG.debug("Periodic restart {} deferred; another action ran this tick", occurrence);
                return PeriodicTick.idle(List.of(), occurrence);
            }
            boolean skipped = skipNext;
            ZonedDateTime next = nextOccurrence(restartTimes, now.atZone(occurrence.getZone()));
            nextRestartAt = next;
            lastPerformedAt = now;
            skipNext = false;
            warnings.reset();
            LOG.info("Periodic restart {} {}; next {}", occurrence, skipped ? "skipped" : "due", next);
            return new PeriodicTick(List.of(),
                    skipped ? PeriodicTick.Outcome.SKIPPED : PeriodicTick.Outcome.EXECUTE, occurrence, next);
        }
        if (skipNext) {
            return PeriodicTick.idle(List.of(), occurrence);
        }
        List<Integer> due = warnings.due(Duration.between(now, occurrence.toInstant()));
        return PeriodicTick.idle(due, occurrence);
    }

    /** Skips the next occurrence once. */
    public void requestSkipNext() {
        if (nextRestartAt == null) {
            LOG.warn("Skip requested but no periodic restarts are configured");
            return;
        }
        skipNext = true;
        LOG.info("Next periodic restart ({}) will be skipped", nextRestartAt);
    }

    public boolean isSkipNextRequested() {
        return skipNext;
    }

    public Optional<ZonedDateTime> nextRestartAt() {
        return Optional.ofNullable(nextRestartAt);
    }

    public boolean isBackupDue(Instant now) {
        return backup.isDue(now);
    }

    public void markBackupPerformed(Instant now) {
        backup.markRun(now);
    }

    public boolean isUpdateCheckDue(Instant now) {
        return updateCheck.isDue(now);
    }

    public void markUpdateCheckPerformed(Instant now) {
        updateCheck.markRun(now);
    }

    public Optional<Instant> nextBackupAt() {
        return Optional.ofNullable(backup.nextDueAt());
    }

    public Optional<Instant> nextUpdateCheckAt() {
        return Optional.ofNullable(updateCheck.nextDueAt());
    }

    public PeriodicScheduleState state() {
        return new PeriodicScheduleState(restartTimes, nextRestartAt, List.copyOf(warnings.sent()),
                lastPerformedAt, skipNext);
    }
}
