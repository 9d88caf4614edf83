package com.phillippitts.serverwarden;

import com.phillippitts.serverwarden.config.properties.BackupProperties;
import com.phillippitts.serverwarden.config.properties.LoopProperties;
import com.phillippitts.serverwarden.config.properties.PerformanceThresholds;
import com.phillippitts.serverwarden.config.properties.RecoveryProperties;
import com.phillippitts.serverwarden.config.properties.ScheduleProperties;
import com.phillippitts.serverwarden.config.properties.ServerProperties;
import com.phillippitts.serverwarden.config.properties.UpdateProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ServerProperties.class,
        ScheduleProperties.class,
        RecoveryProperties.class,
        BackupProperties.class,
        PerformanceThresholds.class,
        LoopProperties.class,
        UpdateProperties.class
})
public class ServerWardenApplication {

    public static void main(String[] args) {
        SpringApplication.run(ServerWardenApplication.class, args);
    }

}
