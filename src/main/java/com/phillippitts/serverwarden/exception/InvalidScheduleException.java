package com.phillippitts.serverwarden.exception;

/**
 * Thrown when a schedule request or configured time of day is malformed.
 */
public class InvalidScheduleException extends ServerWardenException {

    private final String value;

    public InvalidScheduleException(String message, String value) {
        super(message + ": '" + value + "'");
        this.value = value;
    }

    public InvalidScheduleException(String message, String value, Throwable cause) {
        super(message + ": '" + value + "'", cause);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
