package com.polyglot.application.config;

import com.polyglot.domain.vocabulary.ReviewSchedulingPolicy;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Externalised spaced-repetition constants.
 *
 * <p>WHY configuration: the interval model is a product decision, not a domain rule. Missing values
 * fall back to {@link ReviewSchedulingPolicy#defaults()}; inconsistent values fail fast in {@link
 * #toPolicy()} with a {@code ValidationException}.
 *
 * <pre>
 * polyglot:
 *   review:
 *     minimum-interval: 1d
 *     maximum-interval: 64d
 *     growth-factor: 2.0
 * </pre>
 *
 * @param minimumInterval interval after a first encounter, an INCORRECT or a SKIPPED review
 * @param maximumInterval cap for the growing interval
 * @param growthFactor multiplier applied on every CORRECT review; 0 means "use the default"
 */
@ConfigurationProperties(prefix = "polyglot.review")
@Validated
public record ReviewSchedulingProperties(
        Duration minimumInterval, Duration maximumInterval, @DecimalMin("0.0") double growthFactor) {

    /** Applies defaults for unset fields. */
    public ReviewSchedulingProperties {
        if (minimumInterval == null) {
            minimumInterval = ReviewSchedulingPolicy.DEFAULT_MINIMUM_INTERVAL;
        }
        if (maximumInterval == null) {
            maximumInterval = ReviewSchedulingPolicy.DEFAULT_MAXIMUM_INTERVAL;
        }
        if (growthFactor == 0.0) {
            growthFactor = ReviewSchedulingPolicy.DEFAULT_GROWTH_FACTOR;
        }
    }

    public ReviewSchedulingPolicy toPolicy() {
        return new ReviewSchedulingPolicy(minimumInterval, maximumInterval, growthFactor);
    }
}
