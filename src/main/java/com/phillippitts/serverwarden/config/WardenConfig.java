package com.phillippitts.serverwarden.config;

import com.phillippitts.serverwarden.config.properties.ServerProperties;
import com.phillippitts.serverwarden.service.logs.FileLogSource;
import com.phillippitts.serverwarden.service.logs.LogSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Infrastructure beans for the orchestrator.
 */
@Configuration
public class WardenConfig {

    /**
     * Wall clock in the host's zone; restart times of day are interpreted in this zone.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public LogSource logSource(ServerProperties serverProperties) {
        return new FileLogSource(Paths.get(serverProperties.logFile()));
    }
}
