package com.phillippitts.serverwarden.service.status;

import com.phillippitts.serverwarden.domain.ServerStatus;
import com.phillippitts.serverwarden.domain.StatusKind;

/**
 * Result of folding one event (or a startup reconciliation) into the status.
 *
 * @param previous status before the call
 * @param current  status after the call
 * @param changed  true when the status kind changed
 * @param announce true when the change should be announced
 */
public record StatusTransition(ServerStatus previous, ServerStatus current, boolean changed, boolean announce) {

    static StatusTransition unchanged(ServerStatus status) {
        return new StatusTransition(status, status, false, false);
    }

    /** True when this transition moved the status into {@code kind}. */
    public boolean enteredKind(StatusKind kind) {
        return changed && current.kind() == kind;
    }
}
