/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.serverwarden.exception.InvalidScheduleException} → 400 Bad Request</li>
 *   <li>{@link java.lang.IllegalArgumentException} (unknown action kind, negative delay) → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.serverwarden.exception.ServiceControlException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "IllegalArgumentException",
 *   "message": "Invalid request",
 *   "details": "Unknown action kind: 'reboot'. Allowed: restart, stop, update",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.serverwarden.presentation.exception;
