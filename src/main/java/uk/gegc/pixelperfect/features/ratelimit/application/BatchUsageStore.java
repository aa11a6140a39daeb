package uk.gegc.pixelperfect.features.ratelimit.application;

import java.time.Duration;
import java.util.UUID;

/**
 * Shared counter backing batch admission. {@link #checkAndIncrementBatch} must be atomic per user:
 * concurrent calls can never admit more than {@code limit} jobs in one window.
 */
public interface BatchUsageStore {

    BatchCheckResult checkAndIncrementBatch(UUID userId, int limit, Duration window);

    BatchCheckResult currentUsage(UUID userId, int limit, Duration window);
}
