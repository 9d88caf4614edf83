package com.phillippitts.serverwarden.service.schedule;

import com.phillippitts.serverwarden.domain.ActionKind;

/**
 * A warning that fires on this tick.
 *
 * @param kind             action being warned about
 * @param minutesRemaining threshold that was reached
 */
public record DueWarning(ActionKind kind, int minutesRemaining) {
}
