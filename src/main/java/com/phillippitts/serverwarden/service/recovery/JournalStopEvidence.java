package com.phillippitts.serverwarden.service.recovery;

import com.phillippitts.serverwarden.service.control.ServiceControlJournal;
import com.phillippitts.serverwarden.service.status.ServerStatusMachine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link IntentionalStopEvidence} backed by the orchestrator's own control journal and the clean
 * shutdown marker last seen in the server log.
 *
 * <p>A stop counts as intentional when, within the window, either this process issued a STOP for
 * the service that no later start or restart superseded, or the server logged an orderly shutdown
 * after the latest start or restart issued here. Time of day plays no part.
 */
@Component
public class JournalStopEvidence implements IntentionalStopEvidence {

    private static final Logger LOG = LogManager.getLogger(JournalStopEvidence.class);

    private final ServiceControlJournal journal;
    private final ServerStatusMachine statusMachine;
    private final Clock clock;

    public JournalStopEvidence(ServiceControlJournal journal, ServerStatusMachine statusMachine, Clock clock) {
        this.journal = Objects.requireNonNull(journal, "journal");
        this.statusMachine = Objects.requireNonNull(statusMachine, "statusMachine");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean assess(String serviceName, int windowMinutes) {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(windowMinutes));

        var stop = journal.lastStop(serviceName).filter(e -> !e.at().isBefore(cutoff));
        if (stop.isPresent()) {
            LOG.info("Stop of '{}' at {} was requested ({}); treating as intentional",
                    serviceName, stop.get().at(), stop.get().reason());
            return true;
        }

        Instant marker = statusMachine.lastShutdownMarkerAt();
        Optional<Instant> launchedAt = journal.lastLaunch(serviceName).map(ServiceControlJournal.Entry::at);
        if (marker != null && launchedAt.isPresent() && marker.isBefore(launchedAt.get())) {
            LOG.debug("Shutdown marker at {} predates the start at {}; not evidence", marker, launchedAt.get());
            return false;
        }
        if (marker != null && !marker.isBefore(cutoff)) {
            LOG.info("Server logged an orderly shutdown at {}; treating stop of '{}' as intentional",
                    marker, serviceName);
            return true;
        }
        return false;
    }
}
