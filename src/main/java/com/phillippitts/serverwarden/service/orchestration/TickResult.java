package com.phillippitts.serverwarden.service.orchestration;

import java.time.Duration;

/**
 * What one tick did and how long to wait before the next.
 *
 * @param actionTaken whether a start, stop, restart or update targeted the server this tick
 * @param running     controller's running flag observed at the start of the tick
 * @param sleep       delay before the next tick
 */
public record TickResult(boolean actionTaken, boolean running, Duration sleep) {
}
