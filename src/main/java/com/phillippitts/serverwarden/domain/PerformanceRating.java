package com.phillippitts.serverwarden.domain;

/**
 * Qualitative bands a {@link PerformanceSample} is classified into, from the configured FPS thresholds.
 */
public enum PerformanceRating {
    EXCELLENT("Excellent"),
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor"),
    CRITICAL("Critical");

    private final String label;

    PerformanceRating(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
