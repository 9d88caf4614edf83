package com.phillippitts.serverwarden.service.status;

import com.phillippitts.serverwarden.config.properties.LoopProperties;
import com.phillippitts.serverwarden.domain.LogEvent;
import com.phillippitts.serverwarden.domain.PerformanceReport;
import com.phillippitts.serverwarden.domain.ServerStatus;
import com.phillippitts.serverwarden.domain.StatusKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Owns the canonical {@link ServerStatus} and folds parsed log events into it.
 *
 * <p><b>Acceptance rule:</b> a candidate state is applied only when it is at least as advanced as
 * the highest state reached, or when it is {@link StatusKind#SHUTTING_DOWN} /
 * {@link StatusKind#OFFLINE}, which always win. Accepted ordered states raise the high-water mark;
 * overrides never lower it. The mark is only lowered by {@link #resetHighWater(String)}, called when
 * a new process lifecycle begins. Until that process logs its first lifecycle line, shutdown and
 * exit markers still arriving from the previous process are ignored.
 *
 * <p><b>Controller view:</b> {@link #observeStopped(Instant)} moves the status to
 * {@link StatusKind#OFFLINE} when the controller reports the process gone, so a process that dies
 * without logging never keeps a stale online status.
 *
 * <p><b>Startup:</b> {@link #reconcile(List, boolean)} seeds the status once. A process the
 * controller reports as stopped is forced {@link StatusKind#OFFLINE} whatever the log tail says.
 * When the process was already running, the first "online" transition within the startup grace
 * window is applied without being announced.
 *
 * <p><b>Threading:</b> mutated only by the orchestration loop thread; {@link #current()} may be read
 * from any thread and always returns a complete snapshot.
 */
@Component
public class ServerStatusMachine {

    private static final Logger LOG = LogManager.getLogger(ServerStatusMachine.class);

    private final PerformanceClassifier classifier;
    private final Clock clock;
    private final Duration startupGrace;

    private volatile ServerStatus current = ServerStatus.initial();
    private Instant graceUntil;
    private volatile Instant lastShutdownMarkerAt;
    private boolean awaitingNewLifecycle;

    @Autowired
    public ServerStatusMachine(PerformanceClassifier classifier, Clock clock, LoopProperties loopProperties) {
        this(classifier, clock, Duration.ofSeconds(loopProperties.getStartupGraceSeconds()));
    }

    ServerStatusMachine(PerformanceClassifier classifier, Clock clock, Duration startupGrace) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startupGrace = Objects.requireNonNull(startupGrace, "startupGrace");
    }

    public ServerStatus current() {
        return current;
    }

    /**
     * Time of the shutdown marker that ended the latest process lifecycle, or null if that lifecycle
     * has not logged one.
     */
    public Instant lastShutdownMarkerAt() {
        return lastShutdownMarkerAt;
    }

    /**
     * Folds one event into the status.
     *
     * @param event parsed log event
     * @return previous and new status, whether the kind changed and whether to announce it
     */
    public StatusTransition apply(LogEvent event) {
        Objects.requireNonNull(event, "event");
        ServerStatus prev = current;
        StatusKind candidate = event.kind();
        if (candidate == StatusKind.UNKNOWN) {
            return StatusTransition.unchanged(prev);
        }
        boolean override = candidate.isRegressionOverride();
        if (override && awaitingNewLifecycle) {
            LOG.debug("Ignoring {} event at {} from the previous process", candidate, event.timestamp());
            return StatusTransition.unchanged(prev);
        }
        if (!override && !candidate.isAtLeast(prev.highestKindReached())) {
            LOG.debug("Ignoring stale {} event at {}; highest reached is {}",
                    candidate, event.timestamp(), prev.highestKindReached());
            return StatusTransition.unchanged(prev);
        }

        StatusKind highest = override ? prev.highestKindReached() : candidate;
        PerformanceReport performance = null;
        if (candidate == StatusKind.ONLINE) {
            performance = event.hasPerformance() ? classifier.report(event.performance()) : prev.performance();
        }
        ServerStatus next = new ServerStatus(candidate, candidate.label(), event.timestamp(),
                candidate == StatusKind.ONLINE, describe(candidate, performance), performance, highest);
        current = next;

        if (candidate == StatusKind.SHUTTING_DOWN) {
            lastShutdownMarkerAt = event.timestamp();
        } else if (!override) {
            // a new lifecycle has logged; the old shutdown no longer explains a stop
            lastShutdownMarkerAt = null;
            awaitingNewLifecycle = false;
        }

        boolean changed = candidate != prev.kind();
        boolean announce = changed && !suppressedByStartupGrace(candidate);
        if (changed) {
            LOG.info("Server status {} -> {}{}", prev.kind(), candidate, announce ? "" : " (not announced)");
        }
        if (override || candidate == StatusKind.ONLINE) {
            graceUntil = null;
        }
        return new StatusTransition(prev, next, changed, announce);
    }

    /**
     * Seeds the status at orchestrator start from the recent log tail and the controller's view.
     *
     * @param recentTail          events parsed from the recent log tail, oldest first
     * @param controllerIsRunning whether the service controller reports the process running
     * @return the transition from the initial status; never announced
     */
    public StatusTransition reconcile(List<LogEvent> recentTail, boolean controllerIsRunning) {
        ServerStatus prev = current;
        Instant now = clock.instant();
        ServerStatus next;
        awaitingNewLifecycle = false;
        if (!controllerIsRunning) {
            next = new ServerStatus(StatusKind.OFFLINE, StatusKind.OFFLINE.label(), now, false,
                    describe(StatusKind.OFFLINE, null), null, StatusKind.OFFLINE);
            graceUntil = null;
            lastShutdownMarkerAt = lastShutdownIn(recentTail);
            LOG.info("Reconciled status: service not running, forcing {} ({} tail events ignored)",
                    StatusKind.OFFLINE, recentTail.size());
        } else {
            current = ServerStatus.initial();
            for (LogEvent event : recentTail) {
                apply(event);
            }
            ServerStatus folded = current;
            if (folded.kind() == StatusKind.UNKNOWN || folded.kind().isRegressionOverride()) {
                // the tail describes an earlier lifecycle; the live process has not logged yet
                next = new ServerStatus(StatusKind.STARTING, StatusKind.STARTING.label(), now, false,
                        "Server process is running; awaiting log evidence", null, StatusKind.STARTING);
                lastShutdownMarkerAt = null;
            } else {
                next = folded;
            }
            graceUntil = now.plus(startupGrace);
            LOG.info("Reconciled status: service running, status {} from {} tail events",
                    next.kind(), recentTail.size());
        }
        current = next;
        return new StatusTransition(prev, next, prev.kind() != next.kind(), false);
    }

    /**
     * Applies the controller's report that the process is not running.
     *
     * @param now when the controller was queried
     * @return the transition to {@link StatusKind#OFFLINE}, or an unchanged one if already offline
     */
    public StatusTransition observeStopped(Instant now) {
        ServerStatus prev = current;
        if (prev.kind() == StatusKind.OFFLINE) {
            return StatusTransition.unchanged(prev);
        }
        ServerStatus next = new ServerStatus(StatusKind.OFFLINE, StatusKind.OFFLINE.label(), now, false,
                "Server process is not running", null, prev.highestKindReached());
        current = next;
        graceUntil = null;
        LOG.info("Server status {} -> {} (process not running)", prev.kind(), StatusKind.OFFLINE);
        return new StatusTransition(prev, next, true, true);
    }

    /**
     * Starts a new process lifecycle. The status leaves any state of the previous process and the
     * high-water mark is lowered, so the new process's starting and loading markers are accepted
     * and only its own online marker counts as coming online.
     *
     * @param reason why a new lifecycle begins, for the log
     */
    public void resetHighWater(String reason) {
        ServerStatus prev = current;
        current = new ServerStatus(StatusKind.OFFLINE, StatusKind.OFFLINE.label(), prev.lastActivityAt(), false,
                "Awaiting the new server process", null, StatusKind.UNKNOWN);
        graceUntil = null;
        lastShutdownMarkerAt = null;
        awaitingNewLifecycle = true;
        LOG.debug("New lifecycle ({}): status {} -> {}, highest reset from {}",
                reason, prev.kind(), StatusKind.OFFLINE, prev.highestKindReached());
    }

    private static Instant lastShutdownIn(List<LogEvent> tail) {
        Instant marker = null;
        for (LogEvent event : tail) {
            if (event.kind() == StatusKind.SHUTTING_DOWN) {
                marker = event.timestamp();
            } else if (!event.kind().isRegressionOverride() && event.kind() != StatusKind.UNKNOWN) {
                marker = null;
            }
        }
        return marker;
    }

    private boolean suppressedByStartupGrace(StatusKind candidate) {
        return candidate == StatusKind.ONLINE
                && graceUntil != null
                && clock.instant().isBefore(graceUntil);
    }

    private static String describe(StatusKind kind, PerformanceReport performance) {
        switch (kind) {
            case STARTING:
                return "Server process is starting";
            case LOADING:
                return "World is loading";
            case ONLINE:
                if (performance == null) {
                    return "Server is online";
                }
                return String.format(Locale.ROOT, "Server is online (%d players, %.1f FPS, %s)",
                        performance.playerCount(), performance.sample().avgFps(), performance.status().label());
            case SHUTTING_DOWN:
                return "Server is shutting down";
            case OFFLINE:
                return "Server is offline";
            default:
                return "No lifecycle evidence yet";
        }
    }
}
