package uk.gegc.pixelperfect.features.ratelimit.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchCheckResult;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchLimitProperties;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchLimitService;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchUsageStore;
import uk.gegc.pixelperfect.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "pixelperfect.batch", name = "store", havingValue = "jpa", matchIfMissing = true)
public class StoreBackedBatchLimitService implements BatchLimitService {

    private final BatchUsageStore batchUsageStore;
    private final BatchLimitProperties properties;
    private final Clock clock;

    @Override
    public BatchCheckResult checkAndIncrement(UUID userId, SubscriptionTier tier) {
        int limit = properties.limitFor(tier);
        BatchCheckResult result = batchUsageStore.checkAndIncrementBatch(userId, limit, properties.getWindow());
        if (!result.allowed()) {
            long retryAfter = Duration.between(clock.instant(), result.resetAt()).toSeconds();
            log.info("Batch limit reached for user {}: {}/{} until {}", userId, result.currentCount(), limit, result.resetAt());
            throw new RateLimitExceededException(
                    "Batch limit of " + limit + " jobs per " + properties.getWindow().toMinutes() + " minutes reached",
                    retryAfter);
        }
        return result;
    }

    @Override
    public BatchCheckResult getUsage(UUID userId, SubscriptionTier tier) {
        return batchUsageStore.currentUsage(userId, properties.limitFor(tier), properties.getWindow());
    }
}
