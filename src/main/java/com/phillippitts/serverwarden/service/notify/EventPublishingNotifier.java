package com.phillippitts.serverwarden.service.notify;

import com.phillippitts.serverwarden.domain.Audience;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Notifier} that hands notifications to the application event bus.
 *
 * <p>Delivery listeners run asynchronously, so publishing never waits on a gateway.
 */
@Component
public class EventPublishingNotifier implements Notifier {

    private static final Logger LOG = LogManager.getLogger(EventPublishingNotifier.class);

    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public EventPublishingNotifier(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void send(Audience audience, String eventKey, Map<String, Object> payload) {
        try {
            publisher.publishEvent(new NotificationEvent(audience, eventKey, payload, clock.instant()));
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish {} notification '{}': {}", audience, eventKey, e.toString());
        }
    }
}
