package com.phillippitts.serverwarden.service.command;

import com.phillippitts.serverwarden.domain.AdminCommand;

import java.util.List;

/**
 * Source of administrator commands, polled once per orchestration tick.
 *
 * <p>Consumers keep their own cursor: polling again with the same cursor yields the same
 * commands, so re-delivery never double-applies a command.
 */
public interface CommandSource {

    /**
     * @param afterSequence sequence of the last command already handled (0 for none)
     * @return commands with a greater sequence, oldest first
     */
    List<AdminCommand> poll(long afterSequence);
}
