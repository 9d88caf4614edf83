package com.phillippitts.serverwarden.presentation.dto;

import com.phillippitts.serverwarden.service.schedule.ScheduledAction;

import java.time.Instant;
import java.util.List;

/**
 * A pending scheduled action as shown to administrators.
 */
public record PendingActionView(
        String kind,
        Instant scheduledAt,
        String requestedBy,
        List<Integer> warningThresholds,
        List<Integer> warningsSent
) {
    public static PendingActionView from(ScheduledAction action) {
        return new PendingActionView(action.kind().key(), action.scheduledAt(), action.requestedBy(),
                action.warningThresholds(), List.copyOf(action.warningsSent()));
    }
}
