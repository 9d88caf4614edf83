package com.phillippitts.serverwarden.service.orchestration;

import com.phillippitts.serverwarden.config.properties.LoopProperties;
import com.phillippitts.serverwarden.config.properties.ScheduleProperties;
import com.phillippitts.serverwarden.domain.ActionKind;
import com.phillippitts.serverwarden.domain.AdminCommand;
import com.phillippitts.serverwarden.domain.Audience;
import com.phillippitts.serverwarden.domain.LogEvent;
import com.phillippitts.serverwarden.domain.StatusKind;
import com.phillippitts.serverwarden.exception.ActionExecutionException;
import com.phillippitts.serverwarden.exception.InvalidScheduleException;
import com.phillippitts.serverwarden.exception.ServiceControlException;
import com.phillippitts.serverwarden.service.command.CommandSource;
import com.phillippitts.serverwarden.service.control.ServiceController;
import com.phillippitts.serverwarden.service.logs.LogEventParser;
import com.phillippitts.serverwarden.service.logs.LogSource;
import com.phillippitts.serverwarden.service.metrics.WardenMetrics;
import com.phillippitts.serverwarden.service.notify.NotificationKeys;
import com.phillippitts.serverwarden.service.notify.Notifier;
import com.phillippitts.serverwarden.service.recovery.AutoRecoveryController;
import com.phillippitts.serverwarden.service.recovery.RecoveryDecision;
import com.phillippitts.serverwarden.service.schedule.DueWarning;
import com.phillippitts.serverwarden.service.schedule.PeriodicScheduler;
import com.phillippitts.serverwarden.service.schedule.PeriodicTick;
import com.phillippitts.serverwarden.service.schedule.RegistryTick;
import com.phillippitts.serverwarden.service.schedule.ScheduledAction;
import com.phillippitts.serverwarden.service.schedule.ScheduledActionRegistry;
import com.phillippitts.serverwarden.service.status.ServerStatusMachine;
import com.phillippitts.serverwarden.service.status.StatusTransition;
import com.phillippitts.serverwarden.service.version.VersionCheck;
import com.phillippitts.serverwarden.service.version.VersionService;
import com.phillippitts.serverwarden.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One cooperative orchestration cycle over the managed server.
 *
 * <p>Each {@link #tick(Instant)} runs these steps in order:
 * <ol>
 *   <li>Refresh the controller's running flag</li>
 *   <li>Fold new log lines into the status, then the controller's view if the process is gone</li>
 *   <li>Apply new administrator commands</li>
 *   <li>Send due countdown warnings and execute due scheduled actions</li>
 *   <li>Send periodic restart warnings and execute a due periodic restart</li>
 *   <li>Evaluate auto-recovery</li>
 *   <li>Run periodic backup and update check</li>
 *   <li>Compute the next sleep</li>
 * </ol>
 *
 * <p>Once a step has started, stopped, restarted or updated the server, later executions in the same
 * tick are held back (steps 6 and 7 are skipped entirely), so no two operations target the server
 * in one tick.
 *
 * <p><b>Threading:</b> not thread-safe; driven by a single loop thread.
 */
@Component
public class OrchestrationLoop {

    private static final Logger LOG = LogManager.getLogger(OrchestrationLoop.class);

    static final String UPDATE_CHECKER = "update-checker";

    private final ServiceController controller;
    private final LogSource logSource;
    private final LogEventParser parser;
    private final ServerStatusMachine statusMachine;
    private final CommandSource commandSource;
    private final ScheduledActionRegistry registry;
    private final PeriodicScheduler periodic;
    private final AutoRecoveryController recovery;
    private final VersionService versions;
    private final ActionExecutor executor;
    private final Notifier notifier;
    private final SleepPolicy sleepPolicy;
    private final WardenMetrics metrics;
    private final int reconcileTailLines;
    private final int updateDelayMinutes;

    private boolean initialized;
    private boolean lastKnownRunning;
    private long commandCursor;

    public OrchestrationLoop(ServiceController controller,
                             LogSource logSource,
                             LogEventParser parser,
                             ServerStatusMachine statusMachine,
                             CommandSource commandSource,
                             ScheduledActionRegistry registry,
                             PeriodicScheduler periodic,
                             AutoRecoveryController recovery,
                             VersionService versions,
                             ActionExecutor executor,
                             Notifier notifier,
                             SleepPolicy sleepPolicy,
                             WardenMetrics metrics,
                             LoopProperties loopProperties,
                             ScheduleProperties scheduleProperties) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.logSource = Objects.requireNonNull(logSource, "logSource");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.statusMachine = Objects.requireNonNull(statusMachine, "statusMachine");
        this.commandSource = Objects.requireNonNull(commandSource, "commandSource");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.periodic = Objects.requireNonNull(periodic, "periodic");
        this.recovery = Objects.requireNonNull(recovery, "recovery");
        this.versions = Objects.requireNonNull(versions, "versions");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.sleepPolicy = Objects.requireNonNull(sleepPolicy, "sleepPolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.reconcileTailLines = loopProperties.getReconcileTailLines();
        this.updateDelayMinutes = scheduleProperties.getUpdateDelayMinutes();
    }

    /**
     * Seeds the status from the recent log tail and the controller, then skips the log history.
     * Runs once; {@link #tick(Instant)} calls it when needed.
     *
     * @throws ServiceControlException if the controller cannot be queried
     */
    public void initialize(Instant now) {
        boolean running = controller.isRunning();
        List<LogEvent> events = new ArrayList<>();
        for (String line : logSource.recentTail(reconcileTailLines)) {
            parser.parse(line).ifPresent(events::add);
        }
        StatusTransition t = statusMachine.reconcile(events, running);
        logSource.seekToEnd();
        lastKnownRunning = running;
        if (running && t.current().kind() != StatusKind.ONLINE) {
            recovery.awaitStartup(now);
        }
        initialized = true;
        LOG.info("Orchestrator initialized: service '{}' {}, status {}",
                controller.serviceName(), running ? "running" : "not running", t.current().kind());
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Runs one orchestration cycle.
     *
     * @param now current time
     * @return what happened and how long to sleep
     */
    public TickResult tick(Instant now) {
        long start = System.nanoTime();
        if (!initialized) {
            initialize(now);
        }
        boolean actionTaken = false;

        // 1. running flag
        boolean running;
        boolean runningKnown = true;
        try {
            running = controller.isRunning();
        } catch (ServiceControlException e) {
            LOG.warn("Cannot query service state; assuming unchanged: {}", e.getMessage());
            running = lastKnownRunning;
            runningKnown = false;
        }
        if (running && !lastKnownRunning) {
            statusMachine.resetHighWater("process observed starting");
        }
        lastKnownRunning = running;

        // 2. status
        for (String line : logSource.pollNewLines()) {
            Optional<LogEvent> event = parser.parse(line);
            if (event.isPresent()) {
                onTransition(statusMachine.apply(event.get()));
            }
        }
        if (runningKnown && !running) {
            onTransition(statusMachine.observeStopped(now));
        }
        if (recovery.checkStartupTimeout(now)) {
            notifyAdmin(NotificationKeys.STARTUP_TIMEOUT, "Server has not come online since it was started; "
                    + "current status: " + statusMachine.current().kind().label());
        }

        // 3. admin commands
        for (AdminCommand command : commandSource.poll(commandCursor)) {
            commandCursor = command.sequence();
            actionTaken |= handleCommand(command, now);
        }

        // 4. scheduled actions
        RegistryTick due = registry.tick(now, !actionTaken);
        for (DueWarning w : due.warnings()) {
            notifyPlayers(NotificationKeys.ACTION_WARNING, warningText(w.kind(), w.minutesRemaining()),
                    Map.of("action", w.kind().key(), "minutes", w.minutesRemaining()));
            metrics.incrementWarning("scheduled");
        }
        for (ScheduledAction action : due.executions()) {
            LOG.info("Executing {}", action);
            executor.execute(action, now);
            actionTaken = true;
        }

        // 5. periodic restart
        PeriodicTick pt = periodic.tick(now, !actionTaken);
        for (Integer minutes : pt.warnings()) {
            notifyPlayers(NotificationKeys.PERIODIC_RESTART_WARNING,
                    "Scheduled server restart in " + TimeUtils.formatMinutes(minutes),
                    Map.of("minutes", minutes));
            metrics.incrementWarning("periodic");
        }
        if (pt.outcome() == PeriodicTick.Outcome.EXECUTE) {
            executor.executePeriodicRestart(pt.occurrence(), now);
            actionTaken = true;
        } else if (pt.outcome() == PeriodicTick.Outcome.SKIPPED) {
            notifyAdmin(NotificationKeys.PERIODIC_RESTART_SKIPPED, "Periodic restart at "
                    + pt.occurrence().toLocalTime() + " skipped; next at " + pt.next());
        }

        // 6. auto-recovery
        if (!actionTaken && runningKnown) {
            actionTaken = evaluateRecovery(now, running);
        }

        // 7. periodic backup and update check
        if (!actionTaken) {
            if (periodic.isBackupDue(now)) {
                periodic.markBackupPerformed(now);
                executor.performBackup(now);
            }
            if (periodic.isUpdateCheckDue(now)) {
                periodic.markUpdateCheckPerformed(now);
                checkForUpdate(now);
            }
        }

        // 8. sleep
        TickResult result = new TickResult(actionTaken, running,
                sleepPolicy.nextSleep(now, nextExecutionAt(), recovery.isAwaitingStartup()));
        metrics.recordTick(System.nanoTime() - start);
        return result;
    }

    private void onTransition(StatusTransition t) {
        if (!t.changed()) {
            return;
        }
        StatusKind kind = t.current().kind();
        metrics.recordStatusTransition(kind.name());
        recovery.onStatusTransition(t);
        if (!t.announce()) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", t.previous().kind().label());
        payload.put("to", kind.label());
        payload.put("message", t.current().message());
        // players hear about confirmed lifecycle states; intermediate phases go to admins
        Audience audience = (kind == StatusKind.STARTING || kind == StatusKind.ONLINE || kind == StatusKind.OFFLINE)
                ? Audience.PLAYER
                : Audience.ADMIN;
        notifier.send(audience, NotificationKeys.STATUS_CHANGED, payload);
    }

    /**
     * @return true if the command targeted the server
     */
    private boolean handleCommand(AdminCommand command, Instant now) {
        LOG.info("Admin command #{}: {} {} by {}", command.sequence(), command.operation(),
                command.kind() == null ? "" : command.kind().key(), command.requestedBy());
        switch (command.operation()) {
            case SCHEDULE -> {
                try {
                    ScheduledAction action = registry.schedule(command.kind(), command.delayMinutes(),
                            command.requestedBy(), now);
                    notifyAdmin(NotificationKeys.ACTION_SCHEDULED, capitalize(command.kind().key())
                            + " scheduled in " + TimeUtils.formatMinutes(command.delayMinutes())
                            + " by " + command.requestedBy() + " (at " + action.scheduledAt() + ")");
                } catch (InvalidScheduleException e) {
                    notifyAdmin(NotificationKeys.ACTION_FAILED, "Could not schedule "
                            + command.kind().key() + ": " + e.getMessage());
                }
                return false;
            }
            case CANCEL -> {
                Optional<ScheduledAction> cancelled = registry.cancel(command.kind());
                notifyAdmin(NotificationKeys.ACTION_CANCELLED, cancelled.isPresent()
                        ? capitalize(command.kind().key()) + " cancelled by " + command.requestedBy()
                        : "No pending " + command.kind().key() + " to cancel");
                return false;
            }
            case SKIP_NEXT_PERIODIC_RESTART -> {
                periodic.requestSkipNext();
                notifyAdmin(NotificationKeys.PERIODIC_RESTART_SKIP_REQUESTED, periodic.isSkipNextRequested()
                        ? "Next periodic restart (" + periodic.nextRestartAt().map(Object::toString).orElse("-")
                                + ") will be skipped"
                        : "No periodic restarts are configured");
                return false;
            }
            case START -> {
                executor.startServer(command.requestedBy(), now);
                return true;
            }
            default -> {
                LOG.warn("Unhandled command operation {}", command.operation());
                return false;
            }
        }
    }

    /**
     * @return true if a restart was issued
     */
    private boolean evaluateRecovery(Instant now, boolean running) {
        RecoveryDecision decision = recovery.tick(now, running);
        if (decision.alert()) {
            switch (decision.reason()) {
                case EXHAUSTED -> notifyAdmin(NotificationKeys.RECOVERY_EXHAUSTED,
                        "Auto-recovery paused after " + recovery.state().consecutiveAttempts()
                                + " failed restart attempts; start the server manually");
                case INTENTIONAL_STOP -> notifyAdmin(NotificationKeys.RECOVERY_INTENTIONAL_STOP,
                        "Server stop looks intentional; auto-recovery will not restart it");
                default -> LOG.debug("No alert text for {}", decision.reason());
            }
        }
        if (!decision.isRestart()) {
            return false;
        }
        metrics.incrementRecoveryAttempt();
        executor.recoveryRestart(recovery.state().consecutiveAttempts(), now);
        return true;
    }

    private void checkForUpdate(Instant now) {
        VersionCheck check;
        try {
            check = versions.checkAvailable();
        } catch (ActionExecutionException e) {
            LOG.warn("Update check failed: {}", e.getMessage());
            notifyAdmin(NotificationKeys.UPDATE_CHECK_FAILED, "Update check failed: " + e.getMessage());
            return;
        }
        if (!check.available()) {
            return;
        }
        if (registry.pending(ActionKind.UPDATE).isPresent()) {
            LOG.debug("Update {} available; an update is already pending", check.latestBuild());
            return;
        }
        int players = statusMachine.current().playerCount();
        int delay = players > 0 ? updateDelayMinutes : 0;
        registry.schedule(ActionKind.UPDATE, delay, UPDATE_CHECKER, now);
        notifyAdmin(NotificationKeys.ACTION_SCHEDULED, "Update available (build " + check.installedBuild()
                + " -> " + check.latestBuild() + "); updating in " + TimeUtils.formatMinutes(delay)
                + (players > 0 ? " (" + players + " players online)" : ""));
    }

    private Optional<Instant> nextExecutionAt() {
        Optional<Instant> scheduled = registry.nextExecutionAt();
        Optional<Instant> restart = periodic.isSkipNextRequested()
                ? Optional.empty()
                : periodic.nextRestartAt().map(ZonedDateTime::toInstant);
        if (scheduled.isEmpty()) {
            return restart;
        }
        if (restart.isEmpty()) {
            return scheduled;
        }
        return Optional.of(scheduled.get().isBefore(restart.get()) ? scheduled.get() : restart.get());
    }

    private void notifyAdmin(String key, String message) {
        notifier.send(Audience.ADMIN, key, Map.of("message", message));
    }

    private void notifyPlayers(String key, String message, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>(details);
        payload.put("message", message);
        notifier.send(Audience.PLAYER, key, payload);
    }

    static String warningText(ActionKind kind, int minutes) {
        String in = TimeUtils.formatMinutes(minutes);
        return switch (kind) {
            case RESTART -> "Server restart in " + in;
            case STOP -> "Server shutdown in " + in;
            case UPDATE -> "Server update in " + in + "; the server will restart";
        };
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
