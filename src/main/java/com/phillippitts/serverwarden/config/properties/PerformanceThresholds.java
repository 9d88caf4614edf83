package com.phillippitts.serverwarden.config.properties;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Minimum average FPS for each performance band. Anything below {@code poor} is critical.
 *
 * <p>Example application.properties:
 * <pre>
 * warden.performance.excellent=30
 * warden.performance.good=20
 * warden.performance.fair=15
 * warden.performance.poor=10
 * </pre>
 */
@ConfigurationProperties(prefix = "warden.performance")
@Validated
public record PerformanceThresholds(
        @DefaultValue("30") @PositiveOrZero double excellent,
        @DefaultValue("20") @PositiveOrZero double good,
        @DefaultValue("15") @PositiveOrZero double fair,
        @DefaultValue("10") @PositiveOrZero double poor
) {

    @AssertTrue(message = "Performance thresholds must be descending: excellent >= good >= fair >= poor")
    public boolean isDescending() {
        return excellent >= good && good >= fair && fair >= poor;
    }
}
