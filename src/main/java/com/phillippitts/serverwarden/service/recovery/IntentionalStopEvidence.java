package com.phillippitts.serverwarden.service.recovery;

/**
 * Decides whether a stopped server was stopped on purpose, from explicit evidence only.
 */
public interface IntentionalStopEvidence {

    /**
     * @param serviceName   managed service
     * @param windowMinutes how far back evidence counts
     * @return true if a deliberate stop was observed within the window
     */
    boolean assess(String serviceName, int windowMinutes);
}
