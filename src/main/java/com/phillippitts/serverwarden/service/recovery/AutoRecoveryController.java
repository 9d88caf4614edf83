package com.phillippitts.serverwarden.service.recovery;

import com.phillippitts.serverwarden.config.properties.RecoveryProperties;
import com.phillippitts.serverwarden.config.properties.ServerProperties;
import com.phillippitts.serverwarden.domain.StatusKind;
import com.phillippitts.serverwarden.service.recovery.RecoveryDecision.Action;
import com.phillippitts.serverwarden.service.recovery.RecoveryDecision.Reason;
import com.phillippitts.serverwarden.service.status.StatusTransition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Restarts a server that stopped unexpectedly, within an attempt budget and with a cooldown
 * between attempts.
 *
 * <p>Decision model (evaluated by {@link #tick}):
 * <ul>
 *   <li>Running: nothing to do. The attempt counter and the intentional-stop flag are cleared only
 *       when the status transitions into online ({@link #onStatusTransition}); a running process
 *       that has not logged its online marker keeps the budget it has used.</li>
 *   <li>Stopped on purpose: nothing to do until an administrator starts the server again.</li>
 *   <li>Attempts exhausted: nothing to do; the administrator is alerted once per episode.</li>
 *   <li>Cooldown not elapsed: nothing to do.</li>
 *   <li>Otherwise {@link IntentionalStopEvidence} is consulted. Evidence of a deliberate stop
 *       marks the server intentionally stopped; no evidence yields a restart attempt.</li>
 * </ul>
 *
 * <p>Also tracks the startup watch: after the orchestrator starts the server, an administrator
 * alert is due once if the server is not online within the startup timeout.
 *
 * <p>Driven by the orchestration loop thread; {@link #state()} may be called from any thread.
 */
@Component
public class AutoRecoveryController {

    private static final Logger LOG = LogManager.getLogger(AutoRecoveryController.class);

    private final RecoveryProperties props;
    private final IntentionalStopEvidence evidence;
    private final String serviceName;
    private final Duration startupTimeout;

    private int consecutiveAttempts;
    private Instant lastAttemptAt;
    private boolean intentionallyStopped;
    private boolean exhaustedAlerted;
    private Instant awaitingStartupSince;
    private boolean startupTimeoutAlerted;

    public AutoRecoveryController(RecoveryProperties props,
                                  IntentionalStopEvidence evidence,
                                  ServerProperties serverProperties) {
        this.props = Objects.requireNonNull(props, "props");
        this.evidence = Objects.requireNonNull(evidence, "evidence");
        Objects.requireNonNull(serverProperties, "serverProperties");
        this.serviceName = serverProperties.serviceName();
        this.startupTimeout = Duration.ofMinutes(serverProperties.startupTimeoutMinutes());
        LOG.info("Auto-recovery {} (cooldown={}m, maxAttempts={}, intentionalStopWindow={}m)",
                props.isEnabled() ? "enabled" : "disabled", props.getCooldownMinutes(),
                props.getMaxConsecutiveAttempts(), props.getIntentionalStopWindowMinutes());
    }

    /**
     * Evaluates whether the server should be restarted now.
     *
     * @param now     current time
     * @param running whether the controller reports the process running
     * @return the decision; {@link Action#RESTART} has already been counted as an attempt
     */
    public synchronized RecoveryDecision tick(Instant now, boolean running) {
        Objects.requireNonNull(now, "now");
        if (running) {
            return RecoveryDecision.none(Reason.RUNNING);
        }
        if (!props.isEnabled()) {
            return RecoveryDecision.none(Reason.DISABLED);
        }
        if (intentionallyStopped) {
            return RecoveryDecision.none(Reason.INTENTIONAL_STOP);
        }
        if (consecutiveAttempts >= props.getMaxConsecutiveAttempts()) {
            boolean alert = !exhaustedAlerted;
            if (alert) {
                exhaustedAlerted = true;
                LOG.error("Auto-recovery paused: {} restart attempts made without the server coming online",
                        consecutiveAttempts);
            }
            return new RecoveryDecision(Action.NONE, Reason.EXHAUSTED, alert);
        }
        if (lastAttemptAt != null
                && Duration.between(lastAttemptAt, now).compareTo(Duration.ofMinutes(props.getCooldownMinutes())) < 0) {
            LOG.debug("Auto-recovery cooling down; last attempt at {}", lastAttemptAt);
            return RecoveryDecision.none(Reason.COOLDOWN);
        }
        if (evidence.assess(serviceName, props.getIntentionalStopWindowMinutes())) {
            intentionallyStopped = true;
            consecutiveAttempts = 0;
            lastAttemptAt = null;
            LOG.info("Server '{}' was stopped intentionally; auto-recovery will not restart it", serviceName);
            return new RecoveryDecision(Action.NONE, Reason.INTENTIONAL_STOP, true);
        }
        consecutiveAttempts++;
        lastAttemptAt = now;
        LOG.warn("Server '{}' is not running; auto-restart attempt {}/{}",
                serviceName, consecutiveAttempts, props.getMaxConsecutiveAttempts());
        return new RecoveryDecision(Action.RESTART, Reason.CRASH_DETECTED, false);
    }

    /**
     * Observes status transitions; entering {@link StatusKind#ONLINE} ends the recovery episode.
     */
    public synchronized void onStatusTransition(StatusTransition transition) {
        if (transition.enteredKind(StatusKind.ONLINE)) {
            confirmOnline();
        }
    }

    /** Records that the server is being stopped deliberately. */
    public synchronized void markIntentionalStop(String reason) {
        intentionallyStopped = true;
        awaitingStartupSince = null;
        LOG.info("Server marked intentionally stopped ({})", reason);
    }

    /**
     * Clears the intentional-stop flag and the attempt budget, used when an administrator asks
     * for the server to run again.
     */
    public synchronized void clearIntentionalStop(String reason) {
        if (intentionallyStopped || consecutiveAttempts > 0) {
            LOG.info("Auto-recovery re-armed ({})", reason);
        }
        intentionallyStopped = false;
        consecutiveAttempts = 0;
        lastAttemptAt = null;
        exhaustedAlerted = false;
    }

    /** Starts the startup watch after the orchestrator started or restarted the server. */
    public synchronized void awaitStartup(Instant since) {
        awaitingStartupSince = Objects.requireNonNull(since, "since");
        startupTimeoutAlerted = false;
    }

    public synchronized boolean isAwaitingStartup() {
        return awaitingStartupSince != null;
    }

    /**
     * @return true exactly once when the awaited start has exceeded the startup timeout
     */
    public synchronized boolean checkStartupTimeout(Instant now) {
        if (awaitingStartupSince == null || startupTimeoutAlerted) {
            return false;
        }
        if (Duration.between(awaitingStartupSince, now).compareTo(startupTimeout) >= 0) {
            startupTimeoutAlerted = true;
            LOG.warn("Server has not come online {} minutes after start (started at {})",
                    startupTimeout.toMinutes(), awaitingStartupSince);
            return true;
        }
        return false;
    }

    public synchronized RecoveryState state() {
        return new RecoveryState(consecutiveAttempts, lastAttemptAt, props.getCooldownMinutes(),
                props.getMaxConsecutiveAttempts(), intentionallyStopped, awaitingStartupSince);
    }

    private void confirmOnline() {
        if (consecutiveAttempts > 0 || intentionallyStopped) {
            LOG.info("Server confirmed online; resetting auto-recovery (attempts={})", consecutiveAttempts);
        }
        consecutiveAttempts = 0;
        lastAttemptAt = null;
        intentionallyStopped = false;
        exhaustedAlerted = false;
        awaitingStartupSince = null;
        startupTimeoutAlerted = false;
    }
}
