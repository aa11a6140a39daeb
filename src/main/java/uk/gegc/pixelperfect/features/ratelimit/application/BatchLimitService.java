package uk.gegc.pixelperfect.features.ratelimit.application;

import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;

import java.util.UUID;

public interface BatchLimitService {

    /**
     * Counts one job against the user's window.
     *
     * @throws uk.gegc.pixelperfect.shared.exception.RateLimitExceededException when the window is full;
     *         nothing is counted in that case
     */
    BatchCheckResult checkAndIncrement(UUID userId, SubscriptionTier tier);

    /**
     * Current window usage without counting anything.
     */
    BatchCheckResult getUsage(UUID userId, SubscriptionTier tier);
}
