package com.phillippitts.serverwarden.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Cadence of the orchestration loop.
 */
@ConfigurationProperties(prefix = "warden.loop")
@Validated
public class LoopProperties {

    /** Start the orchestration loop with the application context. */
    private boolean enabled = true;

    /** Sleep between ticks while an action is imminent or a start is awaited. */
    @Positive(message = "Log check interval must be positive")
    private long logCheckIntervalMs = 500;

    /** Sleep between ticks once the server is stable. */
    @Positive(message = "Status check interval must be positive")
    private long statusCheckIntervalMs = 5000;

    /** Window after orchestrator start in which an "online" transition of an already running server is not announced. */
    @Min(0)
    private int startupGraceSeconds = 120;

    /** Sleep after a tick failed unexpectedly. */
    @Positive
    private long errorBackoffMs = 5000;

    /** Lines of the log tail inspected when reconciling status at startup. */
    @Positive
    private int reconcileTailLines = 200;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getLogCheckIntervalMs() {
        return logCheckIntervalMs;
    }

    public void setLogCheckIntervalMs(long logCheckIntervalMs) {
        this.logCheckIntervalMs = logCheckIntervalMs;
    }

    public long getStatusCheckIntervalMs() {
        return statusCheckIntervalMs;
    }

    public void setStatusCheckIntervalMs(long statusCheckIntervalMs) {
        this.statusCheckIntervalMs = statusCheckIntervalMs;
    }

    public int getStartupGraceSeconds() {
        return startupGraceSeconds;
    }

    public void setStartupGraceSeconds(int startupGraceSeconds) {
        this.startupGraceSeconds = startupGraceSeconds;
    }

    public long getErrorBackoffMs() {
        return errorBackoffMs;
    }

    public void setErrorBackoffMs(long errorBackoffMs) {
        this.errorBackoffMs = errorBackoffMs;
    }

    public int getReconcileTailLines() {
        return reconcileTailLines;
    }

    public void setReconcileTailLines(int reconcileTailLines) {
        this.reconcileTailLines = reconcileTailLines;
    }
}
