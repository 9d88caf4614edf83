package com.phillippitts.serverwarden.service.backup;

import java.nio.file.Path;

/**
 * Copies server data into a backup store.
 */
public interface BackupService {

    /**
     * Backs up {@code sourcePath}. Never throws; failures are described by the result.
     */
    BackupResult create(Path sourcePath);
}
