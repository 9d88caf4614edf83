/**
 * Immutable value types shared by the orchestrator components.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.serverwarden.domain.LogEvent} - lifecycle evidence parsed from one log line</li>
 *   <li>{@link com.phillippitts.serverwarden.domain.ServerStatus} - canonical status snapshot with
 *       the highest state reached</li>
 *   <li>{@link com.phillippitts.serverwarden.domain.AdminCommand} - administrator request with a
 *       delivery sequence number</li>
 * </ul>
 */
package com.phillippitts.serverwarden.domain;
