package com.phillippitts.serverwarden.service.notify;

import com.phillippitts.serverwarden.domain.Audience;

import java.util.Map;

/**
 * Fire-and-forget notification channel to administrators and players.
 *
 * <p>Implementations must not throw and must not block the caller on delivery.
 */
public interface Notifier {

    /**
     * @param audience who should receive the message
     * @param eventKey stable key from {@link NotificationKeys}
     * @param payload  message details; {@code "message"} holds the human-readable text
     */
    void send(Audience audience, String eventKey, Map<String, Object> payload);
}
