package com.phillippitts.serverwarden.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldConvertNanosToMillis() {
        assertThat(TimeUtils.nanosToMillis(1_000_000L)).isEqualTo(1L);
        assertThat(TimeUtils.nanosToMillis(100_000_000L)).isEqualTo(100L);
        // 2.999 milliseconds truncates to 2 milliseconds
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
    }

    @Test
    void shouldCalculateElapsedMillis() throws InterruptedException {
        long startNanos = System.nanoTime();
        Thread.sleep(10);

        assertThat(TimeUtils.elapsedMillis(startNanos)).isGreaterThanOrEqualTo(10L);
    }

    @Test
    void minutesSinceCountsWholeMinutes() {
        Instant since = Instant.parse("2024-10-17T14:00:00Z");

        assertThat(TimeUtils.minutesSince(since, since.plusSeconds(179))).isEqualTo(2L);
        assertThat(TimeUtils.minutesSince(null, since)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void formatsMinutesForPeople() {
        assertThat(TimeUtils.formatMinutes(1)).isEqualTo("1 minute");
        assertThat(TimeUtils.formatMinutes(0)).isEqualTo("0 minutes");
        assertThat(TimeUtils.formatMinutes(15)).isEqualTo("15 minutes");
    }
}
