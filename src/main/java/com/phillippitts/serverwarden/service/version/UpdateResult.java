package com.phillippitts.serverwarden.service.version;

/**
 * Outcome of an update run.
 *
 * @param success whether the updater reported success
 * @param error   failure description (null on success)
 */
public record UpdateResult(boolean success, String error) {

    public static UpdateResult ok() {
        return new UpdateResult(true, null);
    }

    public static UpdateResult failed(String error) {
        return new UpdateResult(false, error == null ? "unknown error" : error);
    }
}
