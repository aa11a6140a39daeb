package uk.gegc.pixelperfect.features.ratelimit.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchCheckResult;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchLimitProperties;
import uk.gegc.pixelperfect.features.ratelimit.infra.repository.BatchUsageCounterRepository;
import uk.gegc.pixelperfect.features.ratelimit.infra.repository.BatchUsageEventRepository;
import uk.gegc.pixelperfect.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("JpaBatchUsageStore")
class JpaBatchUsageStoreTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");
    private static final Duration WINDOW = Duration.ofHours(1);

    @Autowired
    private BatchUsageCounterRepository counterRepository;
    @Autowired
    private BatchUsageEventRepository eventRepository;
    @Autowired
    private PlatformTransactionManager transactionManager;

    private MutableClock clock;
    private JpaBatchUsageStore store;
    private UUID userId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new JpaBatchUsageStore(counterRepository, eventRepository, transactionManager,
                new BatchLimitProperties(), clock);
        userId = UUID.randomUUID();
    }

    @Test
    @DisplayName("counts jobs in the window and rejects once the limit is reached")
    void slidingWindow() {
        // Given
        BatchCheckResult first = store.checkAndIncrementBatch(userId, 2, WINDOW);
        clock.advance(Duration.ofMinutes(10));
        BatchCheckResult second = store.checkAndIncrementBatch(userId, 2, WINDOW);
        clock.advance(Duration.ofMinutes(10));

        // When
        BatchCheckResult third = store.checkAndIncrementBatch(userId, 2, WINDOW);

        // Then
        assertThat(first.allowed()).isTrue();
        assertThat(first.currentCount()).isEqualTo(1);
        assertThat(second.currentCount()).isEqualTo(2);
        assertThat(third.allowed()).isFalse();
        assertThat(third.currentCount()).isEqualTo(2);
        assertThat(third.resetAt()).isEqualTo(START.plus(WINDOW));
        assertThat(eventRepository.count()).isGreaterThanOrEqualTo(2);
    }

    @Test
    @DisplayName("expired jobs leave the window")
    void expiry() {
        store.checkAndIncrementBatch(userId, 2, WINDOW);
        clock.advance(Duration.ofMinutes(10));
        store.checkAndIncrementBatch(userId, 2, WINDOW);
        clock.advance(Duration.ofMinutes(51));

        BatchCheckResult result = store.checkAndIncrementBatch(userId, 2, WINDOW);

        assertThat(result.allowed()).isTrue();
        assertThat(result.currentCount()).isEqualTo(2);
        assertThat(result.resetAt()).isEqualTo(START.plus(Duration.ofMinutes(10)).plus(WINDOW));
    }

    @Test
    @DisplayName("usage reads without counting and purge removes stale events")
    void usageAndPurge() {
        store.checkAndIncrementBatch(userId, 5, WINDOW);

        assertThat(store.currentUsage(userId, 5, WINDOW).currentCount()).isEqualTo(1);
        assertThat(store.currentUsage(userId, 5, WINDOW).currentCount()).isEqualTo(1);

        clock.advance(Duration.ofHours(2));
        store.purgeExpired();

        assertThat(eventRepository.countByUserIdAndCreatedAtAfter(userId,
                LocalDateTime.of(2000, 1, 1, 0, 0))).isZero();
        assertThat(store.currentUsage(userId, 5, WINDOW).currentCount()).isZero();
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    @DisplayName("concurrent checks for one user never admit more than the limit")
    void concurrentChecks() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                attempts.add(executor.submit(() -> {
                    start.await();
                    return store.checkAndIncrementBatch(userId, 3, WINDOW).allowed();
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(30, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(3);
        } finally {
            executor.shutdownNow();
            clock.advance(Duration.ofDays(1));
            store.purgeExpired();
            counterRepository.deleteById(userId);
        }
    }
}
