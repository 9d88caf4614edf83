package com.phillippitts.serverwarden.service.health;

import com.phillippitts.serverwarden.domain.ServerStatus;
import com.phillippitts.serverwarden.domain.StatusKind;
import com.phillippitts.serverwarden.service.recovery.AutoRecoveryController;
import com.phillippitts.serverwarden.service.recovery.RecoveryState;
import com.phillippitts.serverwarden.service.status.ServerStatusMachine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the managed game server.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: server online</li>
 *   <li>STARTING: server starting or loading its world</li>
 *   <li>DOWN: server offline or shutting down</li>
 *   <li>UNKNOWN: no evidence yet</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ServerHealthIndicator implements HealthIndicator {

    static final String STARTING = "STARTING";

    private final ServerStatusMachine statusMachine;
    private final AutoRecoveryController recovery;

    public ServerHealthIndicator(ServerStatusMachine statusMachine, AutoRecoveryController recovery) {
        this.statusMachine = statusMachine;
        this.recovery = recovery;
    }

    @Override
    public Health health() {
        ServerStatus status = statusMachine.current();
        RecoveryState rs = recovery.state();

        Health.Builder builder = new Health.Builder();
        switch (status.kind()) {
            case ONLINE -> builder.up();
            case STARTING, LOADING -> builder.status(STARTING);
            case OFFLINE, SHUTTING_DOWN -> builder.down();
            default -> builder.unknown();
        }
        builder.withDetail("status", status.kind().label())
                .withDetail("message", status.message())
                .withDetail("recovery", describeRecovery(rs));
        if (status.lastActivityAt() != null) {
            builder.withDetail("lastActivityAt", status.lastActivityAt().toString());
        }
        if (status.kind() == StatusKind.ONLINE && status.performance() != null) {
            builder.withDetail("players", status.playerCount())
                    .withDetail("fps", status.performance().sample().avgFps())
                    .withDetail("performance", status.performance().status().toString());
        }
        return builder.build();
    }

    private String describeRecovery(RecoveryState rs) {
        if (rs.intentionallyStopped()) {
            return "paused (intentional stop)";
        }
        if (rs.isExhausted()) {
            return "paused (" + rs.consecutiveAttempts() + " attempts exhausted)";
        }
        return "armed (" + rs.consecutiveAttempts() + "/" + rs.maxAttempts() + " attempts)";
    }
}
