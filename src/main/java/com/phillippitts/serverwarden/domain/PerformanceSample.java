package com.phillippitts.serverwarden.domain;

import java.util.Objects;

/**
 * Server performance figures reported by the periodic global stats log line.
 *
 * @param avgFps       average server frames per second over the sampling period
 * @param minFps       lowest frame rate over the sampling period
 * @param maxFps       highest frame rate over the sampling period
 * @param frameTimeMs  average frame time in milliseconds
 * @param playerCount  connected players
 * @param entityCounts simulated entity counts
 */
public record PerformanceSample(
        double avgFps,
        double minFps,
        double maxFps,
        double frameTimeMs,
        int playerCount,
        EntityCounts entityCounts
) {

    public PerformanceSample {
        if (playerCount < 0) {
            throw new IllegalArgumentException("Player count must not be negative, got: " + playerCount);
        }
        Objects.requireNonNull(entityCounts, "Entity counts must not be null");
    }

    /**
     * Entity population of the running world.
     */
    public record EntityCounts(int characters, int zombies, int vehicles) {

        public static EntityCounts none() {
            return new EntityCounts(0, 0, 0);
        }
    }
}
