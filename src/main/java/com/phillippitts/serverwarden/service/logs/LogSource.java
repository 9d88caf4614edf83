package com.phillippitts.serverwarden.service.logs;

import java.util.List;

/**
 * Source of server console lines.
 *
 * <p>Implementations are consumed only by the orchestration loop thread.
 */
public interface LogSource {

    /**
     * Returns complete lines appended since the previous poll, oldest first.
     * Never throws for a missing or unreadable file; returns an empty list instead.
     */
    List<String> pollNewLines();

    /**
     * Returns up to {@code maxLines} most recent complete lines without moving the poll position.
     */
    List<String> recentTail(int maxLines);

    /**
     * Moves the poll position to the end of the current content, so only lines written from now on
     * are returned by {@link #pollNewLines()}.
     */
    void seekToEnd();
}
