package uk.gegc.pixelperfect.features.model.application;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Credit pricing parameters. A backend's price is {@code ceil(base * creditMultiplier)}.
 */
@Configuration
@ConfigurationProperties(prefix = "pixelperfect.credits")
@Validated
@Data
public class CreditCostProperties {

    /**
     * Base credits for upscale and combined upscale+enhance jobs.
     */
    @Positive
    private long upscaleBase = 1L;

    /**
     * Base credits for enhance and custom-prompt jobs.
     */
    @Positive
    private long enhanceBase = 2L;
}
