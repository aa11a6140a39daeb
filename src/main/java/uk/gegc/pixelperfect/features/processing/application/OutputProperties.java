package uk.gegc.pixelperfect.features.processing.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "pixelperfect.output")
@Data
public class OutputProperties {

    /**
     * How long hosted result URLs stay valid on the backend side.
     */
    private Duration urlTtl = Duration.ofHours(1);
}
