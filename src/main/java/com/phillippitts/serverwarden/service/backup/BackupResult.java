package com.phillippitts.serverwarden.service.backup;

import java.nio.file.Path;

/**
 * Outcome of one backup.
 *
 * @param success  whether the backup was written completely
 * @param location archive file or directory written (null on failure)
 * @param error    failure description (null on success)
 */
public record BackupResult(boolean success, Path location, String error) {

    public static BackupResult ok(Path location) {
        return new BackupResult(true, location, null);
    }

    public static BackupResult failed(String error) {
        return new BackupResult(false, null, error);
    }
}
