package uk.gegc.pixelperfect.features.processing.application;

import uk.gegc.pixelperfect.features.processing.api.dto.ProcessImageRequest;
import uk.gegc.pixelperfect.features.processing.domain.model.CanonicalResult;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchCheckResult;

import java.util.UUID;

public interface ImageProcessingService {

    /**
     * Admits, prices and dispatches one image job for the user.
     *
     * @throws uk.gegc.pixelperfect.shared.exception.RateLimitExceededException when the batch window is full
     * @throws uk.gegc.pixelperfect.features.model.domain.exception.ModelNotFoundException for an unknown model id
     * @throws uk.gegc.pixelperfect.features.model.domain.exception.ModelNotAvailableException when the chosen
     *         model cannot serve the user's tier, scale or mode
     * @throws uk.gegc.pixelperfect.features.processing.domain.exception.ProcessingException for any dispatch failure
     */
    CanonicalResult process(UUID userId, ProcessImageRequest request);

    BatchCheckResult getBatchUsage(UUID userId);
}
