package uk.gegc.pixelperfect.features.model.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ModelCapability;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;

import java.util.List;

@Schema(name = "BackendDescriptorDto", description = "A processing model the user can choose")
public record BackendDescriptorDto(
        @Schema(example = "real-esrgan") String id,
        @Schema(example = "Real-ESRGAN") String displayName,
        List<ModelCapability> capabilities,
        @Schema(description = "Credits charged in upscale mode") long upscaleCredits,
        @Schema(description = "Credits charged in enhance mode") long enhanceCredits,
        double qualityScore,
        long processingTimeMs,
        List<Integer> supportedScales,
        int maxInputResolution,
        int maxOutputResolution,
        @Schema(description = "Lowest plan that may use the model; null when open to all") SubscriptionTier tierRestriction
) {

    public static BackendDescriptorDto from(BackendDescriptor backend, long upscaleCredits, long enhanceCredits) {
        return new BackendDescriptorDto(
                backend.id(),
                backend.displayName(),
                List.copyOf(backend.capabilities()),
                upscaleCredits,
                enhanceCredits,
                backend.qualityScore(),
                backend.processingTimeMs(),
                List.copyOf(backend.supportedScales()),
                backend.maxInputResolution(),
                backend.maxOutputResolution(),
                backend.tierRestriction()
        );
    }
}
