package uk.gegc.pixelperfect.features.ratelimit.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Admission control for processing jobs: how many jobs a user may start per sliding window.
 */
@Configuration
@ConfigurationProperties(prefix = "pixelperfect.batch")
@Data
public class BatchLimitProperties {

    private Duration window = Duration.ofHours(1);

    /**
     * {@code jpa} (atomic, shared across instances) or {@code memory} (single instance only).
     */
    private String store = "jpa";

    private Map<SubscriptionTier, Integer> limits = defaultLimits();

    public int limitFor(SubscriptionTier tier) {
        Integer limit = limits.get(tier == null ? SubscriptionTier.FREE : tier);
        return limit == null ? defaultLimits().get(SubscriptionTier.FREE) : limit;
    }

    private static Map<SubscriptionTier, Integer> defaultLimits() {
        Map<SubscriptionTier, Integer> limits = new EnumMap<>(SubscriptionTier.class);
        limits.put(SubscriptionTier.FREE, 10);
        limits.put(SubscriptionTier.HOBBY, 50);
        limits.put(SubscriptionTier.PRO, 200);
        limits.put(SubscriptionTier.BUSINESS, 1000);
        return limits;
    }
}
