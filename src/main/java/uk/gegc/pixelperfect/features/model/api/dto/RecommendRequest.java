package uk.gegc.pixelperfect.features.model.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import uk.gegc.pixelperfect.features.model.domain.model.ImageAnalysis;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;

@Schema(name = "RecommendRequest", description = "Image analysis signals plus the job parameters")
public record RecommendRequest(
        @NotNull(message = "Analysis is required") ImageAnalysis analysis,
        @Schema(description = "Plan to recommend for; defaults to the caller's plan") SubscriptionTier tier,
        ProcessingMode mode,
        @Min(2) @Max(8) Integer scale
) {

    public RecommendRequest {
        mode = mode == null ? ProcessingMode.UPSCALE : mode;
        scale = scale == null ? 2 : scale;
    }
}
