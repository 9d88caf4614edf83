package com.phillippitts.serverwarden.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-time restarts and periodic maintenance intervals.
 * Binds to properties prefixed with "warden.schedule".
 */
@ConfigurationProperties(prefix = "warden.schedule")
@Validated
public class ScheduleProperties {

    /** Daily restart times as HH:mm; empty disables periodic restarts. */
    @NotNull
    private List<String> restartTimes = new ArrayList<>();

    /** Minutes between periodic backups; 0 disables them. */
    @Min(value = 0, message = "Backup interval must not be negative")
    private int backupIntervalMinutes = 60;

    /** Minutes between update checks; 0 disables them. */
    @Min(value = 0, message = "Update check interval must not be negative")
    private int updateCheckIntervalMinutes = 30;

    /** Grace period before applying an update while players are online. */
    @Min(value = 0, message = "Update delay must not be negative")
    private int updateDelayMinutes = 15;

    public List<String> getRestartTimes() {
        return restartTimes;
    }

    public void setRestartTimes(List<String> restartTimes) {
        this.restartTimes = restartTimes == null ? new ArrayList<>() : restartTimes;
    }

    public int getBackupIntervalMinutes() {
        return backupIntervalMinutes;
    }

    public void setBackupIntervalMinutes(int backupIntervalMinutes) {
        this.backupIntervalMinutes = backupIntervalMinutes;
    }

    public int getUpdateCheckIntervalMinutes() {
        return updateCheckIntervalMinutes;
    }

    public void setUpdateCheckIntervalMinutes(int updateCheckIntervalMinutes) {
        this.updateCheckIntervalMinutes = updateCheckIntervalMinutes;
    }

    public int getUpdateDelayMinutes() {
        return updateDelayMinutes;
    }

    public void setUpdateDelayMinutes(int updateDelayMinutes) {
        this.updateDelayMinutes = updateDelayMinutes;
    }
}
