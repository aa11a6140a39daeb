package uk.gegc.pixelperfect.features.ratelimit.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchCheckResult;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchLimitProperties;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchUsageStore;
import uk.gegc.pixelperfect.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StoreBackedBatchLimitService")
class StoreBackedBatchLimitServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final UUID USER = UUID.fromString("55555555-5555-5555-5555-555555555555");
    private static final Duration WINDOW = Duration.ofHours(1);

    @Mock
    private BatchUsageStore store;

    private StoreBackedBatchLimitService service;

    @BeforeEach
    void setUp() {
        service = new StoreBackedBatchLimitService(store, new BatchLimitProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("passes the tier limit to the store and returns admitted results")
    void admitted() {
        BatchCheckResult admitted = new BatchCheckResult(true, 3, 200, NOW.plus(WINDOW));
        when(store.checkAndIncrementBatch(USER, 200, WINDOW)).thenReturn(admitted);

        assertThat(service.checkAndIncrement(USER, SubscriptionTier.PRO)).isEqualTo(admitted);
    }

    @Test
    @DisplayName("a full window becomes a rate limit error with a Retry-After hint")
    void rejected() {
        when(store.checkAndIncrementBatch(USER, 10, WINDOW))
                .thenReturn(new BatchCheckResult(false, 10, 10, NOW.plus(Duration.ofMinutes(15))));

        assertThatThrownBy(() -> service.checkAndIncrement(USER, SubscriptionTier.FREE))
                .isInstanceOfSatisfying(RateLimitExceededException.class, ex -> {
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(900);
                    assertThat(ex.getMessage()).isEqualTo("Batch limit of 10 jobs per 60 minutes reached");
                });
    }

    @Test
    @DisplayName("Retry-After never drops below one second")
    void retryAfterFloor() {
        when(store.checkAndIncrementBatch(USER, 10, WINDOW))
                .thenReturn(new BatchCheckResult(false, 10, 10, NOW.minusSeconds(5)));

        assertThatThrownBy(() -> service.checkAndIncrement(USER, SubscriptionTier.FREE))
                .isInstanceOfSatisfying(RateLimitExceededException.class,
                        ex -> assertThat(ex.getRetryAfterSeconds()).isEqualTo(1));
    }

    @Test
    @DisplayName("usage uses the tier limit")
    void usage() {
        BatchCheckResult usage = new BatchCheckResult(true, 1, 1000, NOW.plus(WINDOW));
        when(store.currentUsage(USER, 1000, WINDOW)).thenReturn(usage);

        assertThat(service.getUsage(USER, SubscriptionTier.BUSINESS)).isEqualTo(usage);
    }
}
