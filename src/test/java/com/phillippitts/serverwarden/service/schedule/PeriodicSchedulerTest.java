package com.phillippitts.serverwarden.service.schedule;

import com.phillippitts.serverwarden.exception.InvalidScheduleException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PeriodicSchedulerTest {

    private static final List<LocalTime> TIMES = List.of(LocalTime.of(2, 0), LocalTime.of(14, 0));
    private static final ZonedDateTime DAY = ZonedDateTime.of(2024, 10, 17, 0, 0, 0, 0, ZoneOffset.UTC);

    private static Instant at(int hour, int minute) {
        return DAY.withHour(hour).withMinute(minute).toInstant();
    }

    private static PeriodicScheduler scheduler(Instant start, List<LocalTime> times) {
        return new PeriodicScheduler(times, Duration.ofMinutes(60), Duration.ofMinutes(30),
                Clock.fixed(start, ZoneOffset.UTC));
    }

    @Test
    void nextOccurrenceIsLaterTodayWhenAvailable() {
        ZonedDateTime next = PeriodicScheduler.nextOccurrence(TIMES, DAY.withHour(13).withMinute(50));

        assertThat(next).isEqualTo(DAY.withHour(14));
    }

    @Test
    void nextOccurrenceRollsOverToTomorrow() {
        ZonedDateTime next = PeriodicScheduler.nextOccurrence(TIMES, DAY.withHour(15));

        assertThat(next).isEqualTo(DAY.plusDays(1).withHour(2));
    }

    @Test
    void occurrenceEqualToNowIsNotNext() {
        ZonedDateTime next = PeriodicScheduler.nextOccurrence(TIMES, DAY.withHour(14));

        assertThat(next).isEqualTo(DAY.plusDays(1).withHour(2));
    }

    @Test
    void warnsAtFifteenFiveAndOneMinuteThenExecutes() {
        PeriodicScheduler scheduler = scheduler(at(13, 30), TIMES);

        assertThat(scheduler.tick(at(13, 40), true).warnings()).isEmpty();
        assertThat(scheduler.tick(at(13, 45), true).warnings()).containsExactly(15);
        assertThat(scheduler.tick(at(13, 46), true).warnings()).isEmpty();
        assertThat(scheduler.tick(at(13, 55), true).warnings()).containsExactly(5);
        assertThat(scheduler.tick(at(13, 59), true).warnings()).containsExactly(1);

        PeriodicTick due = scheduler.tick(at(14, 0), true);

        assertThat(due.outcome()).isEqualTo(PeriodicTick.Outcome.EXECUTE);
        assertThat(due.occurrence()).isEqualTo(DAY.withHour(14));
        assertThat(due.next()).isEqualTo(DAY.plusDays(1).withHour(2));
        assertThat(scheduler.state().warningsSent()).isEmpty();
        assertThat(scheduler.state().lastPerformedAt()).isEqualTo(at(14, 0));
        assertThat(scheduler.tick(at(14, 1), true).outcome()).isEqualTo(PeriodicTick.Outcome.NONE);
    }

    @Test
    void skipConsumesOneOccurrenceWithoutWarnings() {
        PeriodicScheduler scheduler = scheduler(at(13, 30), TIMES);
        scheduler.requestSkipNext();

        assertThat(scheduler.tick(at(13, 45), true).warnings()).isEmpty();
        PeriodicTick skipped = scheduler.tick(at(14, 0), true);

        assertThat(skipped.outcome()).isEqualTo(PeriodicTick.Outcome.SKIPPED);
        assertThat(scheduler.isSkipNextRequested()).isFalse();
        assertThat(scheduler.nextRestartAt()).contains(DAY.plusDays(1).withHour(2));
    }

    @Test
    void dueOccurrenceWaitsWhileExecutionIsHeldBack() {
        PeriodicScheduler scheduler = scheduler(at(13, 30), TIMES);

        assertThat(scheduler.tick(at(14, 0), false).outcome()).isEqualTo(PeriodicTick.Outcome.NONE);
        assertThat(scheduler.nextRestartAt()).contains(DAY.withHour(14));
        assertThat(scheduler.tick(at(14, 0), true).outcome()).isEqualTo(PeriodicTick.Outcome.EXECUTE);
    }

    @Test
    void withoutTimesNothingIsScheduled() {
        PeriodicScheduler scheduler = scheduler(at(13, 30), List.of());

        scheduler.requestSkipNext();

        assertThat(scheduler.nextRestartAt()).isEmpty();
        assertThat(scheduler.isSkipNextRequested()).isFalse();
        assertThat(scheduler.tick(at(14, 0), true).outcome()).isEqualTo(PeriodicTick.Outcome.NONE);
    }

    @Test
    void backupAndUpdateCheckRunAtTheirIntervals() {
        PeriodicScheduler scheduler = scheduler(at(10, 0), TIMES);

        assertThat(scheduler.isBackupDue(at(10, 59))).isFalse();
        assertThat(scheduler.isBackupDue(at(11, 0))).isTrue();
        assertThat(scheduler.isUpdateCheckDue(at(10, 30))).isTrue();

        scheduler.markBackupPerformed(at(11, 0));

        assertThat(scheduler.isBackupDue(at(11, 30))).isFalse();
        assertThat(scheduler.nextBackupAt()).contains(at(12, 0));
    }

    @Test
    void zeroIntervalDisablesJob() {
        PeriodicScheduler scheduler = new PeriodicScheduler(TIMES, Duration.ZERO, Duration.ofMinutes(30),
                Clock.fixed(at(10, 0), ZoneOffset.UTC));

        assertThat(scheduler.isBackupDue(at(23, 0))).isFalse();
        assertThat(scheduler.nextBackupAt()).isEmpty();
    }

    @Test
    void parsesTimesOfDay() {
        assertThat(PeriodicScheduler.parseTimes(Arrays.asList("02:00", " 7:30 ", "", null)))
                .containsExactly(LocalTime.of(2, 0), LocalTime.of(7, 30));
    }

    @Test
    void rejectsMalformedTime() {
        assertThatThrownBy(() -> PeriodicScheduler.parseTimes(List.of("02:00", "25:99")))
                .isInstanceOfSatisfying(InvalidScheduleException.class,
                        e -> assertThat(e.getValue()).isEqualTo("25:99"));
    }
}
