package uk.gegc.pixelperfect.features.ratelimit.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchCheckResult;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchLimitProperties;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchUsageStore;
import uk.gegc.pixelperfect.features.ratelimit.domain.model.BatchUsageCounter;
import uk.gegc.pixelperfect.features.ratelimit.domain.model.BatchUsageEvent;
import uk.gegc.pixelperfect.features.ratelimit.infra.repository.BatchUsageCounterRepository;
import uk.gegc.pixelperfect.features.ratelimit.infra.repository.BatchUsageEventRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Sliding-window counter in the database. Each check locks the user's counter row, so concurrent
 * requests for one user are serialized across all application instances.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "pixelperfect.batch", name = "store", havingValue = "jpa", matchIfMissing = true)
public class JpaBatchUsageStore implements BatchUsageStore {

    private final BatchUsageCounterRepository counterRepository;
    private final BatchUsageEventRepository eventRepository;
    private final TransactionTemplate requiresNewTemplate;
    private final TransactionTemplate lockedTemplate;
    private final BatchLimitProperties properties;
    private final Clock clock;

    public JpaBatchUsageStore(BatchUsageCounterRepository counterRepository,
                              BatchUsageEventRepository eventRepository,
                              PlatformTransactionManager transactionManager,
                              BatchLimitProperties properties,
                              Clock clock) {
        this.counterRepository = counterRepository;
        this.eventRepository = eventRepository;
        this.requiresNewTemplate = new TransactionTemplate(transactionManager);
        this.requiresNewTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.lockedTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public BatchCheckResult checkAndIncrementBatch(UUID userId, int limit, Duration window) {
        ensureCounter(userId);
        BatchCheckResult result = lockedTemplate.execute(status -> {
            BatchUsageCounter counter = counterRepository.findByUserIdForUpdate(userId)
                    .orElseThrow(() -> new IllegalStateException("Batch counter missing for user " + userId));

            LocalDateTime now = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
            LocalDateTime cutoff = now.minus(window);
            eventRepository.deleteExpired(userId, cutoff);
            long count = eventRepository.countByUserIdAndCreatedAtAfter(userId, cutoff);

            if (count >= limit) {
                LocalDateTime oldest = eventRepository.findOldestAfter(userId, cutoff).orElse(now);
                return new BatchCheckResult(false, (int) count, limit, toInstant(oldest.plus(window)));
            }

            eventRepository.save(new BatchUsageEvent(userId, now));
            counter.setUpdatedAt(now);
            LocalDateTime oldest = eventRepository.findOldestAfter(userId, cutoff).orElse(now);
            return new BatchCheckResult(true, (int) count + 1, limit, toInstant(oldest.plus(window)));
        });
        log.debug("Batch check for user {}: allowed={} count={}/{}", userId, result.allowed(), result.currentCount(), limit);
        return result;
    }

    @Override
    @Transactional(readOnly = true)
    public BatchCheckResult currentUsage(UUID userId, int limit, Duration window) {
        LocalDateTime now = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        LocalDateTime cutoff = now.minus(window);
        long count = eventRepository.countByUserIdAndCreatedAtAfter(userId, cutoff);
        LocalDateTime oldest = eventRepository.findOldestAfter(userId, cutoff).orElse(now);
        return new BatchCheckResult(count < limit, (int) count, limit, toInstant(oldest.plus(window)));
    }

    /**
     * Drops events of users that stopped sending requests; active users are pruned on every check.
     */
    @Scheduled(fixedDelayString = "${pixelperfect.batch.cleanup-interval-ms:300000}")
    public void purgeExpired() {
        LocalDateTime cutoff = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).minus(properties.getWindow());
        Integer removed = lockedTemplate.execute(status -> eventRepository.deleteAllExpired(cutoff));
        if (removed != null && removed > 0) {
            log.debug("Purged {} expired batch usage events", removed);
        }
    }

    private void ensureCounter(UUID userId) {
        if (counterRepository.existsById(userId)) {
            return;
        }
        try {
            requiresNewTemplate.executeWithoutResult(status ->
                    counterRepository.saveAndFlush(new BatchUsageCounter(userId, LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC))));
        } catch (DataIntegrityViolationException e) {
            log.debug("Batch counter for user {} created concurrently", userId);
        }
    }

    private static Instant toInstant(LocalDateTime value) {
        return value.toInstant(ZoneOffset.UTC);
    }
}
