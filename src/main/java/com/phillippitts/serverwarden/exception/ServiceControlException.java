package com.phillippitts.serverwarden.exception;

/**
 * Thrown when the managed service cannot be queried or controlled.
 *
 * <p>{@link Severity#TRANSIENT} failures (timeouts, I/O errors) are eligible for a retry on a later
 * tick. {@link Severity#FATAL} failures (permission denied, service not installed) are surfaced to
 * administrators and not retried automatically within the same cycle.
 */
public class ServiceControlException extends ServerWardenException {

    public enum Severity { TRANSIENT, FATAL }

    private final String serviceName;
    private final String operation;
    private final Severity severity;

    public ServiceControlException(String message, String serviceName, String operation, Severity severity) {
        super(message + " (service: " + serviceName + ", operation: " + operation + ")");
        this.serviceName = serviceName;
        this.operation = operation;
        this.severity = severity;
    }

    public ServiceControlException(String message, String serviceName, String operation, Severity severity,
                                   Throwable cause) {
        super(message + " (service: " + serviceName + ", operation: " + operation + ")", cause);
        this.serviceName = serviceName;
        this.operation = operation;
        this.severity = severity;
    }

    public String getServiceName() {
        return serviceName;
    }

    public String getOperation() {
        return operation;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isTransient() {
        return severity == Severity.TRANSIENT;
    }
}
