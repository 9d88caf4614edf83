package com.phillippitts.serverwarden.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Backup destination and retention.
 *
 * @param directory  where backups are written
 * @param maxBackups number of backups retained; older ones are deleted
 * @param compress   write zip archives instead of plain directory copies
 */
@ConfigurationProperties(prefix = "warden.backup")
@Validated
public record BackupProperties(
        @DefaultValue("backups")
        @NotBlank(message = "Backup directory must not be blank")
        String directory,

        @DefaultValue("10")
        @Positive(message = "Max backups must be positive")
        int maxBackups,

        @DefaultValue("true")
        boolean compress
) {
}
