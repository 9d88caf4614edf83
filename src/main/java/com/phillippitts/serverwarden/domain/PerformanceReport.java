package com.phillippitts.serverwarden.domain;

import java.util.Objects;

/**
 * A performance sample together with its classification.
 *
 * @param sample raw figures from the log
 * @param status rating derived from the average frame rate
 */
public record PerformanceReport(PerformanceSample sample, PerformanceRating status) {

    public PerformanceReport {
        Objects.requireNonNull(sample, "sample");
        Objects.requireNonNull(status, "status");
    }

    public int playerCount() {
        return sample.playerCount();
    }
}
