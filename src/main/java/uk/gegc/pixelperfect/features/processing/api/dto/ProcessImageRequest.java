package uk.gegc.pixelperfect.features.processing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import uk.gegc.pixelperfect.features.model.domain.model.ImageAnalysis;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;
import uk.gegc.pixelperfect.features.processing.domain.model.EnhancementSettings;

@Schema(name = "ProcessImageRequest", description = "Image plus processing options")
public record ProcessImageRequest(
        @Schema(description = "Base64 image data, a data URI or an https URL", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Image data must not be blank")
        String imageData,

        @Schema(description = "MIME type of raw base64 image data", example = "image/png")
        @Size(max = 64)
        String mimeType,

        @Schema(description = "Backend id, or 'auto' to let the service choose", example = "auto")
        @Size(max = 64)
        String modelId,

        @Schema(description = "Processing mode", example = "upscale")
        ProcessingMode mode,

        @Schema(description = "Output scale factor: 2, 4 or 8", example = "2")
        @Min(value = 2, message = "Scale must be 2, 4 or 8")
        @Max(value = 8, message = "Scale must be 2, 4 or 8")
        Integer scale,

        @Schema(description = "Enhancement actions applied in enhance, both and custom modes")
        EnhancementSettings enhancement,

        @Schema(description = "Restore faces")
        boolean enhanceFaces,

        @Schema(description = "Keep text and logos legible")
        boolean preserveText,

        @Schema(description = "Free-form instructions, required for custom mode")
        @Size(max = 2000, message = "Custom instructions must not exceed 2000 characters")
        String customInstructions,

        @Schema(description = "Prefer quality over cost when choosing automatically")
        boolean prioritizeQuality,

        @Schema(description = "Image analysis signals used by automatic model choice")
        ImageAnalysis analysis
) {

    public static final String AUTO = "auto";

    public ProcessImageRequest {
        mode = mode == null ? ProcessingMode.UPSCALE : mode;
        scale = scale == null ? 2 : scale;
        modelId = modelId == null || modelId.isBlank() ? AUTO : modelId.trim();
    }

    public boolean autoModel() {
        return AUTO.equalsIgnoreCase(modelId);
    }
}
