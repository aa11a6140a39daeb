package uk.gegc.pixelperfect.shared.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per feature.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public OpenAPI pixelPerfectOpenApi() {
        return new OpenAPI().info(new Info()
                .title("PixelPerfect API")
                .version("v1")
                .description("Image upscaling and enhancement billed in prepaid credits"));
    }

    @Bean
    public GroupedOpenApi imagesGroup() {
        return GroupedOpenApi.builder()
                .group("images")
                .displayName("Image Processing")
                .pathsToMatch("/api/v1/images/**")
                .build();
    }

    @Bean
    public GroupedOpenApi modelsGroup() {
        return GroupedOpenApi.builder()
                .group("models")
                .displayName("Models & Recommendations")
                .pathsToMatch("/api/v1/models", "/api/v1/models/**")
                .build();
    }

    @Bean
    public GroupedOpenApi billingGroup() {
        return GroupedOpenApi.builder()
                .group("billing")
                .displayName("Credits")
                .pathsToMatch("/api/v1/billing/**")
                .build();
    }
}
