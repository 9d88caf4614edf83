package com.phillippitts.serverwarden.exception;

import com.phillippitts.serverwarden.domain.ActionKind;

/**
 * Thrown when an update or backup fails while a scheduled action is executing.
 * The owning schedule is still cleared or advanced; the failure is only reported.
 */
public class ActionExecutionException extends ServerWardenException {

    private final ActionKind actionKind;

    public ActionExecutionException(String message, ActionKind actionKind) {
        super(message);
        this.actionKind = actionKind;
    }

    public ActionExecutionException(String message, ActionKind actionKind, Throwable cause) {
        super(message, cause);
        this.actionKind = actionKind;
    }

    /** Kind of the failed action, or null for a standalone periodic backup. */
    public ActionKind getActionKind() {
        return actionKind;
    }
}
