package com.phillippitts.serverwarden.service.notify;

import com.phillippitts.serverwarden.domain.Audience;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Published on the application event bus for every notification sent.
 */
public record NotificationEvent(
        Audience audience,
        String eventKey,
        Map<String, Object> payload,
        Instant at
) {
    public NotificationEvent {
        Objects.requireNonNull(audience, "audience");
        Objects.requireNonNull(eventKey, "eventKey");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        if (at == null) {
            at = Instant.now();
        }
    }

    /** Human-readable text, falling back to the event key. */
    public String message() {
        Object m = payload.get("message");
        return m == null ? eventKey : String.valueOf(m);
    }
}
