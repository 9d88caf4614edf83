package com.phillippitts.serverwarden.service.control;

import com.phillippitts.serverwarden.exception.ServiceControlException;

/**
 * Controls the game server through the host's service manager.
 *
 * <p>Every method may throw {@link ServiceControlException}; its severity tells the caller whether
 * retrying later can help ({@code TRANSIENT}) or an operator has to step in ({@code FATAL}).
 */
public interface ServiceController {

    /** Name of the managed service unit. */
    String serviceName();

    /** Whether the service process is currently running. */
    boolean isRunning();

    /** Whether the service is registered with the service manager at all. */
    boolean exists();

    /**
     * Starts the service.
     *
     * @param context short reason recorded in logs (e.g. "admin start", "auto-recovery")
     * @return true if the service manager accepted the request
     */
    boolean start(String context);

    /**
     * Stops the service.
     *
     * @param reason short reason recorded in logs
     * @return true if the service manager accepted the request
     */
    boolean stop(String reason);

    /**
     * Restarts the service, starting it if it is not running.
     *
     * @param reason short reason recorded in logs
     * @return true if the service manager accepted the request
     */
    boolean restart(String reason);
}
