package uk.gegc.pixelperfect.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the batch window cleanup jobs. Disabled in tests via {@code pixelperfect.scheduling.enabled=false}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "pixelperfect.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
