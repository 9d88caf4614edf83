package com.phillippitts.serverwarden.exception;

/**
 * Thrown when an external command cannot be started, is interrupted, or exceeds its timeout.
 * A command that runs to completion with a non-zero exit code is not an error at this level.
 */
public class CommandExecutionException extends ServerWardenException {

    private final String command;
    private final boolean timedOut;

    public CommandExecutionException(String message, String command, boolean timedOut) {
        super(message + " (command: " + command + ")");
        this.command = command;
        this.timedOut = timedOut;
    }

    public CommandExecutionException(String message, String command, boolean timedOut, Throwable cause) {
        super(message + " (command: " + command + ")", cause);
        this.command = command;
        this.timedOut = timedOut;
    }

    public String getCommand() {
        return command;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
