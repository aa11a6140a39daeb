package uk.gegc.pixelperfect.features.processing.infra.backend;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Connection settings of the backend families and the retry policy for rate-limited calls.
 */
@Configuration
@ConfigurationProperties(prefix = "pixelperfect.backend")
@Data
public class BackendProperties {

    private Replicate replicate = new Replicate();
    private Gemini gemini = new Gemini();
    private Retry retry = new Retry();

    @Data
    public static class Replicate {
        private String baseUrl = "https://api.replicate.com";
        private String apiToken;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(90);
        /**
         * Interval between status polls once the synchronous wait window has elapsed.
         */
        private Duration pollInterval = Duration.ofSeconds(2);
        /**
         * Total time a prediction may take before the call fails with a timeout.
         */
        private Duration maxWait = Duration.ofMinutes(5);
    }

    @Data
    public static class Gemini {
        private String baseUrl = "https://generativelanguage.googleapis.com";
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(120);
    }

    @Data
    public static class Retry {
        /**
         * Total attempts including the first one.
         */
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30000;
        /**
         * 0.0 disables jitter, 0.25 spreads delays by plus or minus 25%.
         */
        private double jitterFactor = 0.25;
    }
}
