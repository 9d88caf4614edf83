package com.phillippitts.serverwarden.exception;

/**
 * Base exception for all server-warden application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ServerWardenException extends RuntimeException {

    public ServerWardenException(String message) {
        super(message);
    }

    public ServerWardenException(String message, Throwable cause) {
        super(message, cause);
    }

    public ServerWardenException(Throwable cause) {
        super(cause);
    }
}
