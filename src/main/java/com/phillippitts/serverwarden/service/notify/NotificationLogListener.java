package com.phillippitts.serverwarden.service.notify;

import com.phillippitts.serverwarden.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivers notifications to the notification log. Identical notifications (same audience, key and
 * payload) within a minute are delivered once.
 */
@Component
public class NotificationLogListener {

    private static final Logger LOG = LogManager.getLogger("notifications");

    static final Duration DEDUP_WINDOW = Duration.ofMinutes(1);
    private static final int MAX_TRACKED = 512;

    private final Map<String, Instant> lastDelivered = new ConcurrentHashMap<>();

    @EventListener
    @Async("notifyExecutor")
    public void onNotification(NotificationEvent event) {
        if (!shouldDeliver(event)) {
            LOG.debug("Duplicate {} notification '{}' suppressed", event.audience(), event.eventKey());
            return;
        }
        LOG.info("[{}] {}: {}", event.audience(), event.eventKey(), LogSanitizer.preview(event.message(), 500));
    }

    // Package-private for tests
    boolean shouldDeliver(NotificationEvent event) {
        String key = event.audience() + "|" + event.eventKey() + "|" + new TreeMap<>(event.payload());
        Instant now = event.at();
        if (lastDelivered.size() > MAX_TRACKED) {
            lastDelivered.values().removeIf(t -> Duration.between(t, now).compareTo(DEDUP_WINDOW) > 0);
        }
        Instant prev = lastDelivered.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(DEDUP_WINDOW) > 0) {
            lastDelivered.put(key, now);
            return true;
        }
        return false;
    }
}
