package uk.gegc.pixelperfect.features.billing.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.pixelperfect.features.billing.InMemoryCreditStore;
import uk.gegc.pixelperfect.features.billing.application.CreditMetricsService;
import uk.gegc.pixelperfect.features.billing.application.CreditStore;
import uk.gegc.pixelperfect.features.billing.application.DebitResult;
import uk.gegc.pixelperfect.features.billing.domain.exception.CreditLedgerException;
import uk.gegc.pixelperfect.features.billing.domain.exception.InsufficientCreditsException;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CreditLedgerClientImpl")
class CreditLedgerClientImplTest {

    private static final UUID USER = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Mock
    private CreditStore creditStore;
    @Mock
    private CreditMetricsService metricsService;

    @InjectMocks
    private CreditLedgerClientImpl ledgerClient;

    @Nested
    @DisplayName("debit")
    class Debit {

        @Test
        @DisplayName("returns the store result")
        void success() {
            // Given
            when(creditStore.debit(USER, 4, "rep_1_abc", "desc")).thenReturn(new DebitResult(6, 4, 0, false));

            // When
            DebitResult result = ledgerClient.debit(USER, 4, "rep_1_abc", "desc");

            // Then
            assertThat(result.newBalance()).isEqualTo(6);
        }

        @Test
        @DisplayName("insufficient credits pass through unchanged and are counted")
        void insufficient() {
            when(creditStore.debit(eq(USER), anyLong(), anyString(), anyString()))
                    .thenThrow(new InsufficientCreditsException(USER, 4, 1));

            assertThatThrownBy(() -> ledgerClient.debit(USER, 4, "rep_1_abc", "desc"))
                    .isInstanceOf(InsufficientCreditsException.class)
                    .hasMessage("Insufficient credits. Required: 4, Available: 1");
            verify(metricsService).incrementInsufficientCredits();
        }

        @Test
        @DisplayName("other store failures are wrapped")
        void storeFailure() {
            when(creditStore.debit(eq(USER), anyLong(), anyString(), anyString()))
                    .thenThrow(new IllegalStateException("connection reset"));

            assertThatThrownBy(() -> ledgerClient.debit(USER, 4, "rep_1_abc", "desc"))
                    .isInstanceOf(CreditLedgerException.class)
                    .hasRootCauseMessage("connection reset");
        }

        @Test
        @DisplayName("negative amounts are rejected")
        void negativeAmount() {
            assertThatThrownBy(() -> ledgerClient.debit(USER, -1, "rep_1_abc", "desc"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("refund failures are wrapped")
    void refundFailure() {
        when(creditStore.credit(USER, 4, "rep_1_abc")).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> ledgerClient.refund(USER, 4, "rep_1_abc"))
                .isInstanceOf(CreditLedgerException.class);
    }

    @Nested
    @DisplayName("against the in-memory store")
    class InMemory {

        @Test
        @DisplayName("debit then refund restores the balance and each pool")
        void roundTrip() {
            InMemoryCreditStore store = new InMemoryCreditStore().withAccount(USER, SubscriptionTier.HOBBY, 3, 10);
            CreditLedgerClientImpl client = new CreditLedgerClientImpl(store, metricsService);

            DebitResult debit = client.debit(USER, 5, "rep_1_abc", "desc");
            long afterRefund = client.refund(USER, 5, "rep_1_abc");

            assertThat(debit.fromSubscription()).isEqualTo(3);
            assertThat(debit.fromPurchased()).isEqualTo(2);
            assertThat(afterRefund).isEqualTo(13);
            assertThat(client.getAccount(USER).subscriptionCredits()).isEqualTo(3);
            assertThat(client.getAccount(USER).purchasedCredits()).isEqualTo(10);
        }

        @Test
        @DisplayName("repeating a debit or refund with the same job id changes nothing")
        void idempotent() {
            InMemoryCreditStore store = new InMemoryCreditStore().withAccount(USER, SubscriptionTier.FREE, 10, 0);
            CreditLedgerClientImpl client = new CreditLedgerClientImpl(store, metricsService);

            client.debit(USER, 4, "rep_1_abc", "desc");
            DebitResult replay = client.debit(USER, 4, "rep_1_abc", "desc");
            client.refund(USER, 4, "rep_1_abc");
            long secondRefund = client.refund(USER, 4, "rep_1_abc");

            assertThat(replay.replayed()).isTrue();
            assertThat(replay.newBalance()).isEqualTo(6);
            assertThat(secondRefund).isEqualTo(10);
        }

        @Test
        @DisplayName("two concurrent debits for a balance covering one: exactly one succeeds")
        void concurrentDebits() throws Exception {
            InMemoryCreditStore store = new InMemoryCreditStore().withAccount(USER, SubscriptionTier.FREE, 5, 0);
            CreditLedgerClientImpl client = new CreditLedgerClientImpl(store, metricsService);
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int i = 0; i < 2; i++) {
                    String jobId = "rep_1_job" + i;
                    Callable<String> debit = () -> {
                        start.await();
                        try {
                            client.debit(USER, 5, jobId, "desc");
                            return "ok";
                        } catch (InsufficientCreditsException e) {
                            return "insufficient";
                        }
                    };
                    results.add(executor.submit(debit));
                }
                start.countDown();

                List<String> outcomes = new ArrayList<>();
                for (Future<String> result : results) {
                    outcomes.add(result.get(5, TimeUnit.SECONDS));
                }
                assertThat(outcomes).containsExactlyInAnyOrder("ok", "insufficient");
                assertThat(store.balance(USER)).isZero();
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
