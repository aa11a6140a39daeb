package uk.gegc.pixelperfect.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single time source for job ids, ledger timestamps, batch windows and output expiry.
 * Tests replace it with {@link Clock#fixed}.
 */
@Configuration
public class ClockConfig {

    @Value("${pixelperfect.timezone:UTC}")
    private String timezone;

    @Bean
    public Clock clock() {
        String configuredZone = timezone == null || timezone.isBlank()
                ? "UTC"
                : timezone.trim();
        return Clock.system(ZoneId.of(configuredZone));
    }
}
