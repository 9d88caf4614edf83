package com.phillippitts.serverwarden.service.orchestration;

/**
 * Result of one executed action, as reported to administrators.
 *
 * @param action  action name (restart, stop, update, periodic-restart, start, recovery-restart, backup)
 * @param success whether the action achieved its goal
 * @param message human-readable summary
 */
public record ActionOutcome(String action, boolean success, String message) {
}
