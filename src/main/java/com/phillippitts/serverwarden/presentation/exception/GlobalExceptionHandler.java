package com.phillippitts.serverwarden.presentation.exception;

import com.phillippitts.serverwarden.exception.InvalidScheduleException;
import com.phillippitts.serverwarden.exception.ServiceControlException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed schedule (HTTP 400).
     */
    @ExceptionHandler(InvalidScheduleException.class)
    ResponseEntity<ApiError> handleInvalidSchedule(InvalidScheduleException ex) {
        LOG.warn("Invalid schedule: value={}", ex.getValue());
        return badRequest(ex, "Invalid schedule");
    }

    /**
     * Client error - unknown action kind, negative delay (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return badRequest(ex, "Invalid request");
    }

    /**
     * Client error - parameter of the wrong type, e.g. non-numeric delay (HTTP 400).
     */
    @ExceptionHandler(TypeMismatchException.class)
    ResponseEntity<ApiError> handleTypeMismatch(TypeMismatchException ex) {
        LOG.warn("Rejected request parameter: {}", ex.getPropertyName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                "Parameter '" + ex.getPropertyName() + "' has an invalid value",
                Instant.now()
            ));
    }

    /**
     * Service manager failure (HTTP 503). Transient failures may be retried.
     */
    @ExceptionHandler(ServiceControlException.class)
    ResponseEntity<ApiError> handleServiceControl(ServiceControlException ex) {
        LOG.error("Service control failed: service={}, operation={}, severity={}",
                ex.getServiceName(), ex.getOperation(), ex.getSeverity(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Server control unavailable",
                ex.isTransient() ? "Please retry in a few seconds" : "Operator attention required",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500). Framework errors keep their own status.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse er) {
            return ResponseEntity
                .status(er.getStatusCode())
                .body(new ApiError(
                    ex.getClass().getSimpleName(),
                    "Request not handled",
                    er.getBody().getDetail(),
                    Instant.now()
                ));
        }
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(Exception ex, String message) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                message,
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
