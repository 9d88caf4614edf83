package com.phillippitts.serverwarden.service.status;

import com.phillippitts.serverwarden.config.properties.PerformanceThresholds;
import com.phillippitts.serverwarden.domain.PerformanceRating;
import com.phillippitts.serverwarden.domain.PerformanceReport;
import com.phillippitts.serverwarden.domain.PerformanceSample;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Classifies average server FPS into {@link PerformanceRating} bands.
 *
 * <p>A sample rates as the highest band whose threshold its average FPS reaches; below
 * {@code poor} it is {@link PerformanceRating#CRITICAL}.
 */
@Component
public class PerformanceClassifier {

    private final PerformanceThresholds thresholds;

    public PerformanceClassifier(PerformanceThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public PerformanceRating rate(double avgFps) {
        if (avgFps >= thresholds.excellent()) {
            return PerformanceRating.EXCELLENT;
        }
        if (avgFps >= thresholds.good()) {
            return PerformanceRating.GOOD;
        }
        if (avgFps >= thresholds.fair()) {
            return PerformanceRating.FAIR;
        }
        if (avgFps >= thresholds.poor()) {
            return PerformanceRating.POOR;
        }
        return PerformanceRating.CRITICAL;
    }

    public PerformanceReport report(PerformanceSample sample) {
        return new PerformanceReport(sample, rate(sample.avgFps()));
    }
}
