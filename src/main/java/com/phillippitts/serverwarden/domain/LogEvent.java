package com.phillippitts.serverwarden.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Typed lifecycle event extracted from a single server log line.
 *
 * @param timestamp   time stamped on the line, or the wall clock when the line had none
 * @param kind        lifecycle state the line indicates
 * @param performance performance figures when the line was a global stats line, otherwise null
 */
public record LogEvent(Instant timestamp, StatusKind kind, PerformanceSample performance) {

    public LogEvent {
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(kind, "Kind must not be null");
    }

    public static LogEvent of(Instant timestamp, StatusKind kind) {
        return new LogEvent(timestamp, kind, null);
    }

    public boolean hasPerformance() {
        return performance != null;
    }
}
