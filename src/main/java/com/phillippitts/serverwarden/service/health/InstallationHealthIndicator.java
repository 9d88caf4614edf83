package com.phillippitts.serverwarden.service.health;

import com.phillippitts.serverwarden.config.properties.BackupProperties;
import com.phillippitts.serverwarden.config.properties.ServerProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Health indicator for the server installation paths the warden depends on.
 *
 * <p>DOWN when the install or data directory is missing. A missing console log is reported but
 * not fatal (the server creates it on first start).
 */
@Component
public class InstallationHealthIndicator implements HealthIndicator {

    private final ServerProperties serverProperties;
    private final BackupProperties backupProperties;

    public InstallationHealthIndicator(ServerProperties serverProperties, BackupProperties backupProperties) {
        this.serverProperties = serverProperties;
        this.backupProperties = backupProperties;
    }

    @Override
    public Health health() {
        Path install = Paths.get(serverProperties.installDirectory());
        Path data = Paths.get(serverProperties.dataDirectory());
        Path log = Paths.get(serverProperties.logFile());
        Path backups = Paths.get(backupProperties.directory());

        boolean installExists = Files.isDirectory(install);
        boolean dataExists = Files.isDirectory(data);

        Health.Builder builder = (installExists && dataExists) ? Health.up() : Health.down();
        return builder
                .withDetail("installDirectory", formatStatus(installExists, install))
                .withDetail("dataDirectory", formatStatus(dataExists, data))
                .withDetail("logFile", formatStatus(Files.isRegularFile(log), log))
                .withDetail("backupDirectory", Files.isDirectory(backups)
                        ? "accessible at " + backups
                        : "will be created at " + backups)
                .build();
    }

    private String formatStatus(boolean exists, Path path) {
        if (exists) {
            return "accessible at " + path;
        }
        return "NOT FOUND at " + path;
    }
}
