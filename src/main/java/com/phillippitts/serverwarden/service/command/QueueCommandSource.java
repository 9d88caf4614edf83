package com.phillippitts.serverwarden.service.command;

import com.phillippitts.serverwarden.domain.ActionKind;
import com.phillippitts.serverwarden.domain.AdminCommand;
import com.phillippitts.serverwarden.domain.AdminCommand.Operation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * In-memory {@link CommandSource} fed by the admin REST API.
 *
 * <p>Retains the most recent {@value #RETAINED} commands; a consumer that falls further behind
 * loses the oldest ones (logged).
 */
@Component
public class QueueCommandSource implements CommandSource {

    private static final Logger LOG = LogManager.getLogger(QueueCommandSource.class);

    static final int RETAINED = 256;

    private final Clock clock;
    private final Deque<AdminCommand> commands = new ArrayDeque<>();
    private long lastSequence;

    public QueueCommandSource(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AdminCommand schedule(ActionKind kind, int delayMinutes, String requestedBy) {
        return submit(Operation.SCHEDULE, Objects.requireNonNull(kind, "kind"), delayMinutes, requestedBy);
    }

    public AdminCommand cancel(ActionKind kind, String requestedBy) {
        return submit(Operation.CANCEL, Objects.requireNonNull(kind, "kind"), 0, requestedBy);
    }

    public AdminCommand skipNextPeriodicRestart(String requestedBy) {
        return submit(Operation.SKIP_NEXT_PERIODIC_RESTART, null, 0, requestedBy);
    }

    public AdminCommand start(String requestedBy) {
        return submit(Operation.START, null, 0, requestedBy);
    }

    /**
     * Validates and enqueues a command.
     *
     * @throws IllegalArgumentException for an invalid combination (e.g. negative delay)
     */
    public synchronized AdminCommand submit(Operation operation, ActionKind kind, int delayMinutes,
                                            String requestedBy) {
        AdminCommand command = new AdminCommand(lastSequence + 1, operation, kind, delayMinutes,
                requestedBy, clock.instant());
        lastSequence = command.sequence();
        commands.addLast(command);
        while (commands.size() > RETAINED) {
            AdminCommand dropped = commands.removeFirst();
            LOG.debug("Command #{} aged out of the queue", dropped.sequence());
        }
        LOG.info("Queued command #{} {} {} (delay={}m, by={})", command.sequence(), operation,
                kind == null ? "" : kind.key(), delayMinutes, command.requestedBy());
        return command;
    }

    @Override
    public synchronized List<AdminCommand> poll(long afterSequence) {
        List<AdminCommand> result = new ArrayList<>();
        for (AdminCommand c : commands) {
            if (c.sequence() > afterSequence) {
                result.add(c);
            }
        }
        if (!result.isEmpty() && result.get(0).sequence() > afterSequence + 1) {
            LOG.warn("Commands #{}..#{} were dropped before being consumed",
                    afterSequence + 1, result.get(0).sequence() - 1);
        }
        return result;
    }

    public synchronized long lastSequence() {
        return lastSequence;
    }
}
