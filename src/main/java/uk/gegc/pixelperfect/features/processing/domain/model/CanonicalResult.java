package uk.gegc.pixelperfect.features.processing.domain.model;

import java.time.Instant;

/**
 * Backend-agnostic processing result.
 *
 * @param imageUrl         a fetchable URL or an inline {@code data:} URI
 * @param expiresAt        when a hosted URL stops resolving; null for inline data
 * @param creditsRemaining balance reported by the debit of this job
 */
public record CanonicalResult(
        String imageUrl,
        String mimeType,
        Instant expiresAt,
        long creditsRemaining,
        String modelId,
        String jobId,
        long creditsUsed,
        long processingTimeMs
) {

    public CanonicalResult withBilling(String modelId, String jobId, long creditsUsed,
                                       long creditsRemaining, long processingTimeMs) {
        return new CanonicalResult(imageUrl, mimeType, expiresAt, creditsRemaining,
                modelId, jobId, creditsUsed, processingTimeMs);
    }

    public static CanonicalResult of(String imageUrl, String mimeType, Instant expiresAt) {
        return new CanonicalResult(imageUrl, mimeType, expiresAt, 0L, null, null, 0L, 0L);
    }
}
