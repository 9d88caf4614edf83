/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.serverwarden.exception.ServerWardenException} - Base exception</li>
 *   <li>{@link com.phillippitts.serverwarden.exception.ServiceControlException} - managed service
 *       could not be queried or controlled; classified as transient or fatal</li>
 *   <li>{@link com.phillippitts.serverwarden.exception.ActionExecutionException} - update or backup
 *       failed while executing an action</li>
 *   <li>{@link com.phillippitts.serverwarden.exception.InvalidScheduleException} - malformed time of
 *       day or schedule request</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP responses through
 * {@code presentation.exception.GlobalExceptionHandler} when they reach the REST boundary.
 */
package com.phillippitts.serverwarden.exception;
