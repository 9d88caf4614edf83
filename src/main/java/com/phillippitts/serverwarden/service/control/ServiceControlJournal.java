package com.phillippitts.serverwarden.service.control;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded in-memory record of stop, start and restart requests issued by this process.
 *
 * <p>Used to tell an operator-initiated stop apart from a crash. Thread-safe.
 */
@Component
public class ServiceControlJournal {

    private static final Logger LOG = LogManager.getLogger(ServiceControlJournal.class);

    static final int MAX_ENTRIES = 100;

    public enum Operation { START, STOP, RESTART }

    /**
     * One journal entry.
     *
     * @param at          when the request was issued
     * @param serviceName target service
     * @param operation   requested operation
     * @param reason      free-form context (who or what asked)
     */
    public record Entry(Instant at, String serviceName, Operation operation, String reason) {
        public Entry {
            Objects.requireNonNull(at, "at");
            Objects.requireNonNull(serviceName, "serviceName");
            Objects.requireNonNull(operation, "operation");
            reason = reason == null ? "" : reason;
        }
    }

    private final Clock clock;
    private final Deque<Entry> entries = new ArrayDeque<>();

    public ServiceControlJournal(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Entry record(String serviceName, Operation operation, String reason) {
        Entry entry = new Entry(clock.instant(), serviceName, operation, reason);
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > MAX_ENTRIES) {
                entries.removeFirst();
            }
        }
        LOG.debug("Journal: {} {} ({})", operation, serviceName, entry.reason());
        return entry;
    }

    /**
     * Most recent STOP entry for the given service, unless a later START or RESTART has since
     * brought the service back.
     */
    public Optional<Entry> lastStop(String serviceName) {
        return latest(serviceName).filter(e -> e.operation() == Operation.STOP);
    }

    /** Most recent START or RESTART entry for the given service, if any. */
    public Optional<Entry> lastLaunch(String serviceName) {
        synchronized (entries) {
            Iterator<Entry> it = entries.descendingIterator();
            while (it.hasNext()) {
                Entry e = it.next();
                if (e.serviceName().equals(serviceName) && e.operation() != Operation.STOP) {
                    return Optional.of(e);
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Entry> latest(String serviceName) {
        synchronized (entries) {
            Iterator<Entry> it = entries.descendingIterator();
            while (it.hasNext()) {
                Entry e = it.next();
                if (e.serviceName().equals(serviceName)) {
                    return Optional.of(e);
                }
            }
        }
        return Optional.empty();
    }

    /** Snapshot in insertion order. */
    public List<Entry> entries() {
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }
}
