package com.phillippitts.serverwarden.service.schedule;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Rolling state of the fixed-time restart schedule.
 *
 * @param restartTimesOfDay configured times, ascending
 * @param nextRestartAt     next occurrence, or null when no times are configured
 * @param warningsSent      minute thresholds already announced for the next occurrence
 * @param lastPerformedAt   when the previous occurrence was consumed, or null
 * @param skipNext          whether the next occurrence will be skipped
 */
public record PeriodicScheduleState(
        List<LocalTime> restartTimesOfDay,
        ZonedDateTime nextRestartAt,
        List<Integer> warningsSent,
        Instant lastPerformedAt,
        boolean skipNext
) {
}
