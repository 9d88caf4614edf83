package com.phillippitts.serverwarden.service.version;

import com.phillippitts.serverwarden.exception.ActionExecutionException;

/**
 * Looks up and installs server builds.
 */
public interface VersionService {

    /**
     * Compares the installed build with the latest published one.
     *
     * @throws ActionExecutionException if the latest build cannot be determined
     */
    VersionCheck checkAvailable();

    /**
     * Installs the latest build. The server must be stopped first.
     * Never throws; failures are described by the result.
     */
    UpdateResult update();
}
