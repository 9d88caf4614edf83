package com.phillippitts.serverwarden.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * External updater (SteamCMD) settings.
 *
 * @param steamcmdPath   SteamCMD executable
 * @param appId          dedicated server app id
 * @param branch         branch whose build id counts as "latest"
 * @param timeoutSeconds upper bound for one updater invocation
 */
@ConfigurationProperties(prefix = "warden.update")
@Validated
public record UpdateProperties(
        @DefaultValue("steamcmd")
        @NotBlank(message = "SteamCMD path must not be blank")
        String steamcmdPath,

        @DefaultValue("380870")
        @NotBlank(message = "App id must not be blank")
        String appId,

        @DefaultValue("public")
        @NotBlank
        String branch,

        @DefaultValue("1800")
        @Positive(message = "Update timeout must be positive")
        int timeoutSeconds
) {
}
