package com.phillippitts.serverwarden.service.orchestration;

import com.phillippitts.serverwarden.config.properties.ServerProperties;
import com.phillippitts.serverwarden.domain.ActionKind;
import com.phillippitts.serverwarden.domain.Audience;
import com.phillippitts.serverwarden.exception.ServiceControlException;
import com.phillippitts.serverwarden.service.backup.BackupResult;
import com.phillippitts.serverwarden.service.backup.BackupService;
import com.phillippitts.serverwarden.service.control.ServiceControlJournal;
import com.phillippitts.serverwarden.service.control.ServiceControlJournal.Operation;
import com.phillippitts.serverwarden.service.control.ServiceController;
import com.phillippitts.serverwarden.service.metrics.WardenMetrics;
import com.phillippitts.serverwarden.service.notify.NotificationKeys;
import com.phillippitts.serverwarden.service.notify.Notifier;
import com.phillippitts.serverwarden.service.recovery.AutoRecoveryController;
import com.phillippitts.serverwarden.service.schedule.ScheduledAction;
import com.phillippitts.serverwarden.service.status.ServerStatusMachine;
import com.phillippitts.serverwarden.service.version.UpdateResult;
import com.phillippitts.serverwarden.service.version.VersionService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Carries out actions against the managed server and reports each outcome to administrators
 * with exactly one notification.
 *
 * <p>Every start or restart accepted by the service manager opens a new process lifecycle: the
 * status leaves the previous process's state and the startup watch begins. Every stop is journaled so auto-recovery can tell it
 * apart from a crash.
 *
 * <p>Never throws for service-control failures; they become failed outcomes.
 */
@Component
public class ActionExecutor {

    private static final Logger LOG = LogManager.getLogger(ActionExecutor.class);

    private final ServiceController controller;
    private final VersionService versions;
    private final BackupService backups;
    private final ServerStatusMachine statusMachine;
    private final AutoRecoveryController recovery;
    private final ServiceControlJournal journal;
    private final Notifier notifier;
    private final WardenMetrics metrics;
    private final Path dataDirectory;

    public ActionExecutor(ServiceController controller,
                          VersionService versions,
                          BackupService backups,
                          ServerStatusMachine statusMachine,
                          AutoRecoveryController recovery,
                          ServiceControlJournal journal,
                          Notifier notifier,
                          WardenMetrics metrics,
                          ServerProperties serverProperties) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.versions = Objects.requireNonNull(versions, "versions");
        this.backups = Objects.requireNonNull(backups, "backups");
        this.statusMachine = Objects.requireNonNull(statusMachine, "statusMachine");
        this.recovery = Objects.requireNonNull(recovery, "recovery");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.dataDirectory = Paths.get(serverProperties.dataDirectory());
    }

    /**
     * Executes an administrator-scheduled (or update-checker) action that has come due.
     */
    public ActionOutcome execute(ScheduledAction action, Instant now) {
        ActionKind kind = action.kind();
        String context = kind.key() + " requested by " + action.requestedBy();
        ActionOutcome outcome;
        try {
            outcome = switch (kind) {
                case RESTART -> restart(context, now);
                case STOP -> stop(context);
                case UPDATE -> update(context, now);
            };
        } catch (ServiceControlException e) {
            outcome = controlFailure(kind.key(), e);
        }
        report(outcome.success() ? NotificationKeys.ACTION_COMPLETED : NotificationKeys.ACTION_FAILED,
                outcome, Map.of("requestedBy", action.requestedBy()));
        return outcome;
    }

    /**
     * Executes a periodic restart occurrence: back up world data, then restart.
     * A failed backup is reported and does not prevent the restart.
     */
    public ActionOutcome executePeriodicRestart(ZonedDateTime occurrence, Instant now) {
        performBackup(now);
        ActionOutcome outcome;
        try {
            outcome = restart("periodic restart " + occurrence.toLocalTime(), now);
            outcome = new ActionOutcome("periodic-restart", outcome.success(), outcome.message());
        } catch (ServiceControlException e) {
            outcome = controlFailure("periodic-restart", e);
        }
        report(outcome.success() ? NotificationKeys.PERIODIC_RESTART_COMPLETED : NotificationKeys.PERIODIC_RESTART_FAILED,
                outcome, Map.of("occurrence", occurrence.toString()));
        return outcome;
    }

    /**
     * Starts the server on an administrator's request and re-arms auto-recovery.
     */
    public ActionOutcome startServer(String requestedBy, Instant now) {
        recovery.clearIntentionalStop("start requested by " + requestedBy);
        ActionOutcome outcome;
        try {
            if (controller.isRunning()) {
                outcome = new ActionOutcome("start", true, "Server is already running");
            } else {
                outcome = start("start requested by " + requestedBy, now, "start");
            }
        } catch (ServiceControlException e) {
            outcome = controlFailure("start", e);
        }
        report(outcome.success() ? NotificationKeys.SERVER_STARTED : NotificationKeys.SERVER_START_FAILED,
                outcome, Map.of("requestedBy", requestedBy));
        return outcome;
    }

    /**
     * Starts a server that stopped unexpectedly.
     *
     * @param attempt attempt number within the current recovery episode
     */
    public ActionOutcome recoveryRestart(int attempt, Instant now) {
        ActionOutcome outcome;
        try {
            outcome = start("auto-recovery attempt " + attempt, now, "recovery-restart");
        } catch (ServiceControlException e) {
            outcome = controlFailure("recovery-restart", e);
        }
        report(outcome.success() ? NotificationKeys.RECOVERY_RESTARTED : NotificationKeys.RECOVERY_FAILED,
                outcome, Map.of("attempt", attempt));
        return outcome;
    }

    /**
     * Backs up the server data directory.
     */
    public ActionOutcome performBackup(Instant now) {
        BackupResult result = backups.create(dataDirectory);
        ActionOutcome outcome = result.success()
                ? new ActionOutcome("backup", true, "Backup created: " + result.location().getFileName())
                : new ActionOutcome("backup", false, "Backup failed: " + result.error());
        report(result.success() ? NotificationKeys.BACKUP_COMPLETED : NotificationKeys.BACKUP_FAILED,
                outcome, Map.of());
        return outcome;
    }

    private ActionOutcome restart(String context, Instant now) {
        journal.record(controller.serviceName(), Operation.RESTART, context);
        if (!controller.restart(context)) {
            return new ActionOutcome("restart", false, "Service manager refused the restart");
        }
        statusMachine.resetHighWater(context);
        recovery.awaitStartup(now);
        return new ActionOutcome("restart", true, "Server restarting");
    }

    private ActionOutcome stop(String context) {
        journal.record(controller.serviceName(), Operation.STOP, context);
        recovery.markIntentionalStop(context);
        if (!controller.stop(context)) {
            return new ActionOutcome("stop", false, "Service manager refused the stop");
        }
        return new ActionOutcome("stop", true, "Server stopped");
    }

    private ActionOutcome start(String context, Instant now, String action) {
        journal.record(controller.serviceName(), Operation.START, context);
        if (!controller.start(context)) {
            return new ActionOutcome(action, false, "Service manager refused the start");
        }
        statusMachine.resetHighWater(context);
        recovery.awaitStartup(now);
        return new ActionOutcome(action, true, "Server starting");
    }

    private ActionOutcome update(String context, Instant now) {
        boolean wasRunning = controller.isRunning();
        if (wasRunning) {
            journal.record(controller.serviceName(), Operation.STOP, context);
            if (!controller.stop(context)) {
                return new ActionOutcome("update", false, "Could not stop the server for the update");
            }
        }
        UpdateResult result = versions.update();
        String updateText = result.success() ? "Update installed" : "Update failed: " + result.error();
        if (!wasRunning) {
            return new ActionOutcome("update", result.success(), updateText + "; server left stopped");
        }
        ActionOutcome started = start(context, now, "update");
        if (!started.success()) {
            return new ActionOutcome("update", false, updateText + "; server did not start");
        }
        return new ActionOutcome("update", result.success(), updateText + "; server starting");
    }

    private ActionOutcome controlFailure(String action, ServiceControlException e) {
        if (e.isTransient()) {
            LOG.warn("{} failed (transient): {}", action, e.getMessage());
        } else {
            LOG.error("{} failed (fatal, needs operator attention): {}", action, e.getMessage());
        }
        return new ActionOutcome(action, false, e.getMessage());
    }

    private void report(String eventKey, ActionOutcome outcome, Map<String, Object> extra) {
        metrics.recordAction(outcome.action(), outcome.success());
        Map<String, Object> payload = new LinkedHashMap<>(extra);
        payload.put("action", outcome.action());
        payload.put("success", outcome.success());
        payload.put("message", outcome.message());
        notifier.send(Audience.ADMIN, eventKey, payload);
    }
}
