package com.phillippitts.serverwarden.service.control;

import com.phillippitts.serverwarden.config.properties.ServerProperties;
import com.phillippitts.serverwarden.config.properties.ServerProperties.ControlTool;
import com.phillippitts.serverwarden.exception.CommandExecutionException;
import com.phillippitts.serverwarden.exception.ServiceControlException;
import com.phillippitts.serverwarden.exception.ServiceControlException.Severity;
import com.phillippitts.serverwarden.exception.ServiceControlExceptionBuilder;
import com.phillippitts.serverwarden.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link ServiceController} backed by {@code systemctl} on Linux or {@code sc.exe} on Windows.
 *
 * <p>Failure classification:
 * <ul>
 *   <li>permission problems and unknown services are {@link Severity#FATAL}</li>
 *   <li>timeouts and failures to launch the tool are {@link Severity#TRANSIENT}</li>
 *   <li>any other non-zero exit is reported as {@code false}</li>
 * </ul>
 */
@Component
public class SystemServiceController implements ServiceController {

    private static final Logger LOG = LogManager.getLogger(SystemServiceController.class);

    /** systemctl status exit code for an unknown unit. */
    static final int SYSTEMCTL_UNIT_UNKNOWN = 4;
    static final int SC_ACCESS_DENIED = 5;
    static final int SC_ALREADY_RUNNING = 1056;
    static final int SC_SERVICE_MISSING = 1060;
    static final int SC_NOT_ACTIVE = 1062;

    private static final List<String> PERMISSION_MARKERS = List.of(
            "access denied",
            "access is denied",
            "interactive authentication required",
            "permission denied",
            "not authorized");

    private static final List<String> MISSING_MARKERS = List.of(
            "not found",
            "not-found",
            "does not exist");

    private static final Duration STOP_POLL_INTERVAL = Duration.ofSeconds(1);

    private final CommandRunner runner;
    private final String serviceName;
    private final ControlTool tool;
    private final Duration commandTimeout;

    public SystemServiceController(CommandRunner runner, ServerProperties props) {
        this.runner = Objects.requireNonNull(runner, "runner");
        Objects.requireNonNull(props, "props");
        this.serviceName = props.serviceName();
        this.tool = props.controlTool();
        this.commandTimeout = Duration.ofSeconds(props.commandTimeoutSeconds());
    }

    @Override
    public String serviceName() {
        return serviceName;
    }

    @Override
    public boolean isRunning() {
        if (tool == ControlTool.SC) {
            CommandResult r = exec("query", List.of("sc", "query", serviceName));
            if (r.exitCode() == SC_SERVICE_MISSING) {
                LOG.warn("Service '{}' is not installed", serviceName);
                return false;
            }
            failOnPermission("query", r);
            String out = r.stdout().toUpperCase(Locale.ROOT);
            return out.contains("RUNNING") || out.contains("START_PENDING");
        }
        CommandResult r = exec("is-active", List.of("systemctl", "is-active", serviceName));
        String state = r.stdout().trim();
        return "active".equals(state) || "activating".equals(state) || "reloading".equals(state);
    }

    @Override
    public boolean exists() {
        if (tool == ControlTool.SC) {
            CommandResult r = exec("query", List.of("sc", "query", serviceName));
            failOnPermission("query", r);
            return r.exitCode() != SC_SERVICE_MISSING;
        }
        CommandResult r = exec("status", List.of("systemctl", "status", serviceName));
        if (r.exitCode() == SYSTEMCTL_UNIT_UNKNOWN) {
            return false;
        }
        return !containsAny(r.combinedOutput(), MISSING_MARKERS);
    }

    @Override
    public boolean start(String context) {
        LOG.info("Starting service '{}' ({})", serviceName, context);
        if (tool == ControlTool.SC) {
            CommandResult r = exec("start", List.of("sc", "start", serviceName));
            return accept("start", r, SC_ALREADY_RUNNING);
        }
        return accept("start", exec("start", List.of("systemctl", "start", serviceName)), 0);
    }

    @Override
    public boolean stop(String reason) {
        LOG.info("Stopping service '{}' ({})", serviceName, reason);
        if (tool == ControlTool.SC) {
            CommandResult r = exec("stop", List.of("sc", "stop", serviceName));
            return accept("stop", r, SC_NOT_ACTIVE);
        }
        return accept("stop", exec("stop", List.of("systemctl", "stop", serviceName)), 0);
    }

    @Override
    public boolean restart(String reason) {
        LOG.info("Restarting service '{}' ({})", serviceName, reason);
        if (tool == ControlTool.SC) {
            // sc has no restart verb and its stop returns before the process exits
            if (!stop(reason)) {
                return false;
            }
            awaitStopped();
            return start(reason);
        }
        return accept("restart", exec("restart", List.of("systemctl", "restart", serviceName)), 0);
    }

    private void awaitStopped() {
        long deadline = System.nanoTime() + commandTimeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (!isRunning()) {
                return;
            }
            try {
                Thread.sleep(STOP_POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw ServiceControlExceptionBuilder.create("Interrupted while waiting for stop")
                        .service(serviceName)
                        .operation("restart")
                        .severity(Severity.TRANSIENT)
                        .cause(e)
                        .build();
            }
        }
        LOG.warn("Service '{}' still running {}s after stop; starting anyway",
                serviceName, commandTimeout.toSeconds());
    }

    private CommandResult exec(String operation, List<String> command) {
        try {
            return runner.run(command, null, commandTimeout);
        } catch (CommandExecutionException e) {
            throw ServiceControlExceptionBuilder.create(e.isTimedOut()
                            ? "Service manager did not answer in time"
                            : "Service manager could not be invoked")
                    .service(serviceName)
                    .operation(operation)
                    .severity(Severity.TRANSIENT)
                    .cause(e)
                    .build();
        }
    }

    /**
     * Maps a completed command to the boolean contract, throwing for failures no retry can fix.
     */
    private boolean accept(String operation, CommandResult r, int alsoSuccessfulExit) {
        if (r.succeeded() || (alsoSuccessfulExit != 0 && r.exitCode() == alsoSuccessfulExit)) {
            return true;
        }
        failOnPermission(operation, r);
        boolean missing = (tool == ControlTool.SC && r.exitCode() == SC_SERVICE_MISSING)
                || containsAny(r.combinedOutput(), MISSING_MARKERS);
        if (missing) {
            throw fatal(operation, r, "Service is not installed");
        }
        LOG.warn("'{}' of service '{}' failed with exit {}: {}", operation, serviceName, r.exitCode(),
                LogSanitizer.preview(r.combinedOutput(), 300));
        return false;
    }

    private void failOnPermission(String operation, CommandResult r) {
        boolean denied = (tool == ControlTool.SC && r.exitCode() == SC_ACCESS_DENIED)
                || containsAny(r.combinedOutput(), PERMISSION_MARKERS);
        if (denied) {
            throw fatal(operation, r, "Insufficient privileges to control service");
        }
    }

    private ServiceControlException fatal(String operation, CommandResult r, String message) {
        return ServiceControlExceptionBuilder.create(message)
                .service(serviceName)
                .operation(operation)
                .severity(Severity.FATAL)
                .exitCode(r.exitCode())
                .durationMs(r.durationMs())
                .metadata("output", LogSanitizer.preview(r.combinedOutput(), 300))
                .build();
    }

    private static boolean containsAny(String text, List<String> markers) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String m : markers) {
            if (lower.contains(m)) {
                return true;
            }
        }
        return false;
    }
}
