package com.phillippitts.serverwarden.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of the canonical server status.
 *
 * <p>Snapshots are produced by the status machine only; readers on other threads (REST, health)
 * always see a consistent snapshot.
 *
 * @param kind               current lifecycle state
 * @param phase              short phase label for display
 * @param lastActivityAt     timestamp of the last accepted event (null before any)
 * @param isOnline           true when {@code kind} is {@link StatusKind#ONLINE}
 * @param message            human readable description of the state
 * @param performance        latest performance report while online, otherwise null
 * @param highestKindReached high-water mark used to ignore stale or out-of-order evidence
 */
public record ServerStatus(
        StatusKind kind,
        String phase,
        Instant lastActivityAt,
        boolean isOnline,
        String message,
        PerformanceReport performance,
        StatusKind highestKindReached
) {

    public ServerStatus {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(highestKindReached, "highestKindReached");
    }

    public static ServerStatus initial() {
        return new ServerStatus(StatusKind.UNKNOWN, StatusKind.UNKNOWN.label(), null, false,
                "No lifecycle evidence yet", null, StatusKind.UNKNOWN);
    }

    public int playerCount() {
        return performance == null ? 0 : performance.playerCount();
    }
}
