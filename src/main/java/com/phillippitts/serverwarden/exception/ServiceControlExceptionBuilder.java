package com.phillippitts.serverwarden.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link ServiceControlException} with process diagnostics.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ServiceControlExceptionBuilder.create("Service start failed")
 *         .service("pzserver")
 *         .operation("start")
 *         .severity(Severity.FATAL)
 *         .exitCode(4)
 *         .durationMs(120)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class ServiceControlExceptionBuilder {

    private final String message;
    private String serviceName = "unknown";
    private String operation = "unknown";
    private ServiceControlException.Severity severity = ServiceControlException.Severity.TRANSIENT;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ServiceControlExceptionBuilder(String message) {
        this.message = message;
    }

    public static ServiceControlExceptionBuilder create(String message) {
        return new ServiceControlExceptionBuilder(message);
    }

    public ServiceControlExceptionBuilder service(String serviceName) {
        if (serviceName != null) {
            this.serviceName = serviceName;
        }
        return this;
    }

    public ServiceControlExceptionBuilder operation(String operation) {
        if (operation != null) {
            this.operation = operation;
        }
        return this;
    }

    public ServiceControlExceptionBuilder severity(ServiceControlException.Severity severity) {
        if (severity != null) {
            this.severity = severity;
        }
        return this;
    }

    public ServiceControlExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ServiceControlExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ServiceControlExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata entry; null keys or values are ignored.
     */
    public ServiceControlExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key}={value}, ...) (service: {name}, operation: {op})
     * </pre>
     */
    public ServiceControlException build() {
        String detailed = buildDetailedMessage();
        if (cause != null) {
            return new ServiceControlException(detailed, serviceName, operation, severity, cause);
        }
        return new ServiceControlException(detailed, serviceName, operation, severity);
    }

    private String buildDetailedMessage() {
        if (exitCode == null && durationMs == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
