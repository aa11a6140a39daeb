package uk.gegc.pixelperfect.features.processing.domain.model;

import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;

/**
 * Canonical, backend-independent description of what to do with an image.
 *
 * @param imageDataUrl the source image as a {@code data:<mime>;base64,} URI or a fetchable URL
 */
public record ImageInput(
        String imageDataUrl,
        String mimeType,
        ProcessingMode mode,
        int scale,
        EnhancementSettings enhancement,
        boolean enhanceFaces,
        boolean preserveText,
        String customInstructions
) {

    public ImageInput {
        mode = mode == null ? ProcessingMode.UPSCALE : mode;
        enhancement = enhancement == null ? EnhancementSettings.none() : enhancement;
    }

    public boolean hasCustomInstructions() {
        return customInstructions != null && !customInstructions.isBlank();
    }

    /**
     * Enhancement actions apply to every mode except plain upscaling.
     */
    public boolean enhance() {
        return mode != ProcessingMode.UPSCALE;
    }
}
