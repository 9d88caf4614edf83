package com.phillippitts.serverwarden.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A request issued by an administrator, delivered to the orchestrator through a command source.
 *
 * @param sequence     monotonically increasing id; the consumer's cursor is compared against it
 * @param operation    what to do
 * @param kind         action kind for {@link Operation#SCHEDULE} and {@link Operation#CANCEL}, otherwise null
 * @param delayMinutes delay before execution for {@link Operation#SCHEDULE}
 * @param requestedBy  name of the administrator
 * @param receivedAt   when the command entered the system
 */
public record AdminCommand(
        long sequence,
        Operation operation,
        ActionKind kind,
        int delayMinutes,
        String requestedBy,
        Instant receivedAt
) {

    public enum Operation {
        SCHEDULE,
        CANCEL,
        SKIP_NEXT_PERIODIC_RESTART,
        START
    }

    public AdminCommand {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(receivedAt, "receivedAt");
        if ((operation == Operation.SCHEDULE || operation == Operation.CANCEL) && kind == null) {
            throw new IllegalArgumentException(operation + " requires an action kind");
        }
        if (delayMinutes < 0) {
            throw new IllegalArgumentException("Delay must not be negative, got: " + delayMinutes);
        }
        requestedBy = requestedBy == null || requestedBy.isBlank() ? "unknown" : requestedBy;
    }
}
