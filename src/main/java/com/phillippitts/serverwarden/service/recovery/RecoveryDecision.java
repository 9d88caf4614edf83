package com.phillippitts.serverwarden.service.recovery;

/**
 * Result of one {@link AutoRecoveryController#tick} evaluation.
 *
 * @param action what the caller should do
 * @param reason why
 * @param alert  true exactly once per episode the administrator should hear about
 *               (attempts exhausted, or a stop judged intentional)
 */
public record RecoveryDecision(Action action, Reason reason, boolean alert) {

    public enum Action { NONE, RESTART }

    public enum Reason {
        /** Process is running; nothing to recover. */
        RUNNING,
        /** Auto-recovery is switched off. */
        DISABLED,
        /** The last stop was deliberate. */
        INTENTIONAL_STOP,
        /** Previous attempt too recent. */
        COOLDOWN,
        /** Attempt budget used up until the server is confirmed online. */
        EXHAUSTED,
        /** Unexpected stop; restart requested. */
        CRASH_DETECTED
    }

    static RecoveryDecision none(Reason reason) {
        return new RecoveryDecision(Action.NONE, reason, false);
    }

    public boolean isRestart() {
        return action == Action.RESTART;
    }
}
