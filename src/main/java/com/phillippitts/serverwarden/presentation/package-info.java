/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>This package contains the HTTP/REST boundary of the application. Presentation depends on
 * service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - admin REST endpoints</li>
 *   <li>{@code presentation.dto} - response bodies</li>
 *   <li>{@code presentation.exception} - global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers never touch scheduling state directly; they queue commands for the
 * orchestration loop and read snapshots.
 */
package com.phillippitts.serverwarden.presentation;
