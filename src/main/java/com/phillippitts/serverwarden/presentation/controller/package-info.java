/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints ({@link com.phillippitts.serverwarden.presentation.controller.AdminController}):
 * <ul>
 *   <li>{@code POST /api/actions/{kind}?delayMinutes=&requestedBy=} - schedule restart, stop or update</li>
 *   <li>{@code DELETE /api/actions/{kind}} - cancel a pending action</li>
 *   <li>{@code POST /api/periodic/skip-next} - skip the next periodic restart</li>
 *   <li>{@code POST /api/server/start} - start the server and re-arm auto-recovery</li>
 *   <li>{@code GET /api/actions} - pending actions</li>
 *   <li>{@code GET /api/status} - status, recovery state and schedule</li>
 * </ul>
 */
package com.phillippitts.serverwarden.presentation.controller;
