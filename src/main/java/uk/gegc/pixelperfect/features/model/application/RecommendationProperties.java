package uk.gegc.pixelperfect.features.model.application;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds of the rule-based recommendation engine. Signals must strictly exceed a threshold to trigger its rule.
 */
@Configuration
@ConfigurationProperties(prefix = "pixelperfect.recommendation")
@Validated
@Data
public class RecommendationProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double damageThreshold = 0.7d;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double textCoverageThreshold = 0.15d;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double noiseThreshold = 0.5d;

    /**
     * Reported confidence. Constant because the rules do not weigh signal strength.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidence = 0.7d;

    private int maxAlternatives = 2;
}
