package uk.gegc.pixelperfect.features.ratelimit.application.impl;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchCheckResult;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchLimitProperties;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchLimitService;
import uk.gegc.pixelperfect.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-process sliding window. Counts are not shared between instances, so a horizontally scaled
 * deployment admits up to {@code limit * instances} jobs per window. Use the store-backed variant there.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "pixelperfect.batch", name = "store", havingValue = "memory")
public class InMemoryBatchLimitService implements BatchLimitService {

    private final Map<UUID, Deque<Instant>> windows = new ConcurrentHashMap<>();
    private final BatchLimitProperties properties;
    private final Clock clock;

    public InMemoryBatchLimitService(BatchLimitProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void warnSingleInstance() {
        log.warn("In-memory batch limiting is active; limits are enforced per instance only");
    }

    @Override
    public BatchCheckResult checkAndIncrement(UUID userId, SubscriptionTier tier) {
        int limit = properties.limitFor(tier);
        Duration window = properties.getWindow();
        AtomicReference<BatchCheckResult> admitted = new AtomicReference<>();
        // compute holds the entry for the whole check, so cleanup cannot evict it mid-increment
        windows.compute(userId, (id, existing) -> {
            Deque<Instant> timestamps = existing != null ? existing : new ArrayDeque<>();
            Instant now = clock.instant();
            prune(timestamps, now.minus(window));
            if (timestamps.size() >= limit) {
                Instant resetAt = timestamps.isEmpty() ? now.plus(window) : timestamps.peekFirst().plus(window);
                throw new RateLimitExceededException(
                        "Batch limit of " + limit + " jobs per " + window.toMinutes() + " minutes reached",
                        Duration.between(now, resetAt).toSeconds());
            }
            timestamps.addLast(now);
            admitted.set(new BatchCheckResult(true, timestamps.size(), limit, timestamps.peekFirst().plus(window)));
            return timestamps;
        });
        return admitted.get();
    }

    @Override
    public BatchCheckResult getUsage(UUID userId, SubscriptionTier tier) {
        int limit = properties.limitFor(tier);
        Duration window = properties.getWindow();
        Instant now = clock.instant();
        AtomicReference<BatchCheckResult> usage =
                new AtomicReference<>(new BatchCheckResult(true, 0, limit, now.plus(window)));
        windows.computeIfPresent(userId, (id, timestamps) -> {
            prune(timestamps, now.minus(window));
            Instant resetAt = timestamps.isEmpty() ? now.plus(window) : timestamps.peekFirst().plus(window);
            usage.set(new BatchCheckResult(timestamps.size() < limit, timestamps.size(), limit, resetAt));
            return timestamps;
        });
        return usage.get();
    }

    @Scheduled(fixedDelayString = "${pixelperfect.batch.cleanup-interval-ms:300000}")
    public void cleanup() {
        Instant cutoff = clock.instant().minus(properties.getWindow());
        int before = windows.size();
        for (UUID userId : windows.keySet()) {
            windows.computeIfPresent(userId, (id, timestamps) -> {
                prune(timestamps, cutoff);
                return timestamps.isEmpty() ? null : timestamps;
            });
        }
        log.debug("Batch window cleanup removed {} idle users", before - windows.size());
    }

    private static void prune(Deque<Instant> timestamps, Instant cutoff) {
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }
}
