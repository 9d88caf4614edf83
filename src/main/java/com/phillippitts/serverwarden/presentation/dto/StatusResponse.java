package com.phillippitts.serverwarden.presentation.dto;

import com.phillippitts.serverwarden.domain.ServerStatus;
import com.phillippitts.serverwarden.service.recovery.RecoveryState;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Snapshot of everything the orchestrator knows about the server.
 */
public record StatusResponse(
        ServerStatus status,
        RecoveryState recovery,
        ZonedDateTime nextPeriodicRestart,
        boolean skipNextPeriodicRestart,
        List<PendingActionView> pendingActions
) {
}
