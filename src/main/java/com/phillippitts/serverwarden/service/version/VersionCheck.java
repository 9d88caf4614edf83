package com.phillippitts.serverwarden.service.version;

/**
 * Installed versus latest build of the server.
 *
 * @param installedBuild build id currently installed (null if unknown)
 * @param latestBuild    latest published build id (null if unknown)
 * @param available      whether both are known and differ
 */
public record VersionCheck(String installedBuild, String latestBuild, boolean available) {

    public static VersionCheck of(String installedBuild, String latestBuild) {
        boolean available = installedBuild != null && latestBuild != null && !installedBuild.equals(latestBuild);
        return new VersionCheck(installedBuild, latestBuild, available);
    }
}
