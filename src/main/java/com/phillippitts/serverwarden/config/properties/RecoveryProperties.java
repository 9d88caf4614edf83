package com.phillippitts.serverwarden.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for automatic crash recovery.
 */
@ConfigurationProperties(prefix = "warden.recovery")
@Validated
public class RecoveryProperties {

    /** Enable/disable automatic restarts of a stopped server. */
    private boolean enabled = true;

    /** Minimum minutes between consecutive restart attempts. */
    @Positive(message = "Cooldown minutes must be positive")
    private int cooldownMinutes = 5;

    /** Attempts allowed before recovery pauses until the server is confirmed online again. */
    @Positive(message = "Max consecutive attempts must be positive")
    private int maxConsecutiveAttempts = 3;

    /** How far back stop evidence (journal entries, shutdown markers) counts as intentional. */
    @Positive(message = "Intentional stop window must be positive")
    private int intentionalStopWindowMinutes = 10;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getCooldownMinutes() {
        return cooldownMinutes;
    }

    public void setCooldownMinutes(int cooldownMinutes) {
        this.cooldownMinutes = cooldownMinutes;
    }

    public int getMaxConsecutiveAttempts() {
        return maxConsecutiveAttempts;
    }

    public void setMaxConsecutiveAttempts(int maxConsecutiveAttempts) {
        this.maxConsecutiveAttempts = maxConsecutiveAttempts;
    }

    public int getIntentionalStopWindowMinutes() {
        return intentionalStopWindowMinutes;
    }

    public void setIntentionalStopWindowMinutes(int intentionalStopWindowMinutes) {
        this.intentionalStopWindowMinutes = intentionalStopWindowMinutes;
    }
}
