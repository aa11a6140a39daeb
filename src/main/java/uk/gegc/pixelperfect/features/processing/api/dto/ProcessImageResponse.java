package uk.gegc.pixelperfect.features.processing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.pixelperfect.features.processing.domain.model.CanonicalResult;

import java.time.Instant;

@Schema(name = "ProcessImageResponse", description = "Processed image and billing outcome")
public record ProcessImageResponse(
        @Schema(description = "Hosted URL or inline data URI of the processed image")
        String imageUrl,
        @Schema(description = "MIME type of the processed image", example = "image/png")
        String mimeType,
        @Schema(description = "When a hosted URL expires; null for inline data")
        Instant expiresAt,
        @Schema(description = "Backend that processed the image", example = "real-esrgan")
        String modelUsed,
        @Schema(description = "Job identifier, also the ledger reference", example = "rep_1718000000000_k3j9x0a")
        String jobId,
        @Schema(description = "Credits charged for this job")
        long creditsUsed,
        @Schema(description = "Balance after the debit")
        long creditsRemaining,
        @Schema(description = "Backend processing time in milliseconds")
        long processingTimeMs
) {

    public static ProcessImageResponse from(CanonicalResult result) {
        return new ProcessImageResponse(
                result.imageUrl(),
                result.mimeType(),
                result.expiresAt(),
                result.modelId(),
                result.jobId(),
                result.creditsUsed(),
                result.creditsRemaining(),
                result.processingTimeMs()
        );
    }
}
