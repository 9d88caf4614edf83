package com.phillippitts.serverwarden.presentation.dto;

import com.phillippitts.serverwarden.domain.AdminCommand;

/**
 * Acknowledges a queued admin command. The orchestrator applies it on its next tick.
 */
public record CommandAccepted(long sequence, String operation, String kind, int delayMinutes, String requestedBy) {

    public static CommandAccepted from(AdminCommand command) {
        return new CommandAccepted(command.sequence(), command.operation().name(),
                command.kind() == null ? null : command.kind().key(),
                command.delayMinutes(), command.requestedBy());
    }
}
