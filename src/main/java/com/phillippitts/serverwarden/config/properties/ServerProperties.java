package com.phillippitts.serverwarden.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Identity and locations of the managed game server.
 * Binds to properties prefixed with "warden.server".
 *
 * <p>Example application.properties:
 * <pre>
 * warden.server.service-name=pzserver
 * warden.server.log-file=/home/pz/Zomboid/server-console.txt
 * warden.server.install-directory=/opt/pzserver
 * warden.server.data-directory=/home/pz/Zomboid/Saves
 * warden.server.startup-timeout-minutes=10
 * warden.server.command-timeout-seconds=60
 * warden.server.control-tool=systemctl
 * </pre>
 *
 * @param serviceName           name of the OS service running the server
 * @param logFile               server console log followed for lifecycle events
 * @param installDirectory      server installation (updater target)
 * @param dataDirectory         world data copied by backups
 * @param startupTimeoutMinutes how long a start may take before administrators are alerted
 * @param commandTimeoutSeconds upper bound for each service-control command
 * @param controlTool           OS tool used to control the service
 */
@ConfigurationProperties(prefix = "warden.server")
@Validated
public record ServerProperties(
        @DefaultValue("pzserver")
        @NotBlank(message = "Service name must not be blank")
        String serviceName,

        @DefaultValue("server-console.txt")
        @NotBlank(message = "Log file must not be blank")
        String logFile,

        @DefaultValue(".")
        @NotBlank(message = "Install directory must not be blank")
        String installDirectory,

        @DefaultValue("Saves")
        @NotBlank(message = "Data directory must not be blank")
        String dataDirectory,

        @DefaultValue("10")
        @Positive(message = "Startup timeout must be positive")
        int startupTimeoutMinutes,

        @DefaultValue("60")
        @Positive(message = "Command timeout must be positive")
        int commandTimeoutSeconds,

        @DefaultValue("systemctl")
        @NotNull
        ControlTool controlTool
) {

    /** Service control backends. */
    public enum ControlTool { SYSTEMCTL, SC }
}
