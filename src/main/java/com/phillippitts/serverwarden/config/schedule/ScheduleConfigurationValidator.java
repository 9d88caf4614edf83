package com.phillippitts.serverwarden.config.schedule;

import com.phillippitts.serverwarden.config.properties.BackupProperties;
import com.phillippitts.serverwarden.config.properties.ScheduleProperties;
import com.phillippitts.serverwarden.config.properties.ServerProperties;
import com.phillippitts.serverwarden.exception.InvalidScheduleException;
import com.phillippitts.serverwarden.service.schedule.PeriodicScheduler;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates schedule and backup settings at startup to fail fast with actionable messages.
 */
@Component
class ScheduleConfigurationValidator {

    private static final Logger LOG = LogManager.getLogger(ScheduleConfigurationValidator.class);

    private final ScheduleProperties schedule;
    private final BackupProperties backup;
    private final ServerProperties server;

    ScheduleConfigurationValidator(ScheduleProperties schedule, BackupProperties backup, ServerProperties server) {
        this.schedule = schedule;
        this.backup = backup;
        this.server = server;
    }

    @PostConstruct
    void validate() {
        List<LocalTime> times;
        try {
            times = PeriodicScheduler.parseTimes(schedule.getRestartTimes());
        } catch (InvalidScheduleException e) {
            throw new IllegalArgumentException("Invalid warden.schedule.restart-times entry: '" + e.getValue()
                    + "'. Use 24-hour HH:mm, e.g. 02:00,14:00", e);
        }
        Set<LocalTime> seen = new HashSet<>();
        for (LocalTime t : times) {
            if (!seen.add(t)) {
                throw new IllegalArgumentException("Duplicate warden.schedule.restart-times entry: " + t);
            }
        }
        // Backups inside the data directory would be copied into every later backup
        Path data = Paths.get(server.dataDirectory()).toAbsolutePath().normalize();
        Path backups = Paths.get(backup.directory()).toAbsolutePath().normalize();
        if (backups.startsWith(data)) {
            throw new IllegalArgumentException("warden.backup.directory (" + backups
                    + ") must not be inside warden.server.data-directory (" + data + ")");
        }
        if (times.isEmpty()) {
            LOG.info("No restart times configured; periodic restarts disabled");
        }
    }
}
