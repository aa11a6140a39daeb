package uk.gegc.pixelperfect.features.model.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.pixelperfect.features.model.domain.model.Recommendation;

import java.util.List;

@Schema(name = "RecommendationDto")
public record RecommendationDto(
        @Schema(example = "real-esrgan") String recommendedModel,
        String reasoning,
        long creditCost,
        List<String> alternatives,
        double confidence
) {

    public static RecommendationDto from(Recommendation recommendation) {
        return new RecommendationDto(
                recommendation.recommendedModel(),
                recommendation.reasoning(),
                recommendation.creditCost(),
                recommendation.alternatives(),
                recommendation.confidence()
        );
    }
}
