package com.phillippitts.serverwarden.service.recovery;

import java.time.Instant;

/**
 * Immutable snapshot of the auto-recovery bookkeeping, for status reporting.
 *
 * @param consecutiveAttempts  restarts attempted since the server was last confirmed online
 * @param lastAttemptAt        time of the most recent attempt (null if none)
 * @param cooldownMinutes      minimum spacing between attempts
 * @param maxAttempts          attempt budget
 * @param intentionallyStopped whether the current stop is considered deliberate
 * @param awaitingStartupSince when the orchestrator last started the server and is still waiting
 *                             for it to come online (null if not waiting)
 */
public record RecoveryState(
        int consecutiveAttempts,
        Instant lastAttemptAt,
        int cooldownMinutes,
        int maxAttempts,
        boolean intentionallyStopped,
        Instant awaitingStartupSince
) {

    public boolean isExhausted() {
        return consecutiveAttempts >= maxAttempts;
    }
}
