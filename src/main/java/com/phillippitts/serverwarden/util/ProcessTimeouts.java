package com.phillippitts.serverwarden.util;

import java.time.Duration;

/**
 * Standard timeout values for external process management.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.serverwarden.service.control.CommandRunner}
 * for service-control and updater subprocesses.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for stream gobbler threads during cleanup (best-effort; they are daemon threads).
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Upper bound for an updater metadata query (latest build lookup).
     */
    public static final Duration VERSION_QUERY_TIMEOUT = Duration.ofMinutes(5);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
