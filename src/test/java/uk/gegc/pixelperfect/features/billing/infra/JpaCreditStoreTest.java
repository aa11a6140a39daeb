package uk.gegc.pixelperfect.features.billing.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.pixelperfect.features.billing.application.AccountSnapshot;
import uk.gegc.pixelperfect.features.billing.application.DebitResult;
import uk.gegc.pixelperfect.features.billing.domain.exception.CreditAccountNotFoundException;
import uk.gegc.pixelperfect.features.billing.domain.exception.IdempotencyConflictException;
import uk.gegc.pixelperfect.features.billing.domain.exception.InsufficientCreditsException;
import uk.gegc.pixelperfect.features.billing.domain.model.CreditTransactionType;
import uk.gegc.pixelperfect.features.billing.infra.repository.CreditTransactionRepository;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(JpaCreditStore.class)
@DisplayName("JpaCreditStore")
class JpaCreditStoreTest {

    @Autowired
    private JpaCreditStore store;

    @Autowired
    private CreditTransactionRepository transactionRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private UUID account(SubscriptionTier tier, long subscription, long purchased) {
        UUID userId = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO credit_accounts (user_id, subscription_tier, subscription_credits, "
                        + "purchased_credits, version) VALUES (?, ?, ?, ?, 0)",
                userId, tier.name(), subscription, purchased);
        return userId;
    }

    @Test
    @DisplayName("debit spends subscription credits before purchased ones")
    void debitSpendsSubscriptionFirst() {
        // Given
        UUID userId = account(SubscriptionTier.HOBBY, 3, 10);

        // When
        DebitResult result = store.debit(userId, 5, "rep_1_aaaaaaa", "Upscale 2x with real-esrgan");

        // Then
        assertThat(result.fromSubscription()).isEqualTo(3);
        assertThat(result.fromPurchased()).isEqualTo(2);
        assertThat(result.newBalance()).isEqualTo(8);
        assertThat(result.replayed()).isFalse();
        AccountSnapshot snapshot = store.getAccount(userId);
        assertThat(snapshot.subscriptionCredits()).isZero();
        assertThat(snapshot.purchasedCredits()).isEqualTo(8);
        assertThat(transactionRepository.findByReferenceIdAndType("rep_1_aaaaaaa", CreditTransactionType.USAGE))
                .hasValueSatisfying(tx -> {
                    assertThat(tx.getAmount()).isEqualTo(-5);
                    assertThat(tx.getBalanceAfter()).isEqualTo(8);
                });
    }

    @Test
    @DisplayName("repeating a debit with the same job id is a no-op")
    void debitIsIdempotent() {
        UUID userId = account(SubscriptionTier.FREE, 10, 0);

        store.debit(userId, 4, "rep_1_bbbbbbb", "desc");
        DebitResult replay = store.debit(userId, 4, "rep_1_bbbbbbb", "desc");

        assertThat(replay.replayed()).isTrue();
        assertThat(replay.newBalance()).isEqualTo(6);
        assertThat(store.getAccount(userId).totalCredits()).isEqualTo(6);
    }

    @Test
    @DisplayName("reusing a job id with a different amount is a conflict")
    void debitConflict() {
        UUID userId = account(SubscriptionTier.FREE, 10, 0);
        store.debit(userId, 4, "rep_1_ccccccc", "desc");

        assertThatThrownBy(() -> store.debit(userId, 5, "rep_1_ccccccc", "desc"))
                .isInstanceOf(IdempotencyConflictException.class);
    }

    @Test
    @DisplayName("debit beyond the balance changes nothing")
    void debitInsufficient() {
        UUID userId = account(SubscriptionTier.FREE, 2, 1);

        assertThatThrownBy(() -> store.debit(userId, 4, "rep_1_ddddddd", "desc"))
                .isInstanceOfSatisfying(InsufficientCreditsException.class, ex -> {
                    assertThat(ex.getRequiredCredits()).isEqualTo(4);
                    assertThat(ex.getAvailableCredits()).isEqualTo(3);
                });
        assertThat(store.getAccount(userId).totalCredits()).isEqualTo(3);
    }

    @Test
    @DisplayName("a user without an account cannot be debited")
    void debitWithoutAccount() {
        assertThatThrownBy(() -> store.debit(UUID.randomUUID(), 1, "rep_1_eeeeeee", "desc"))
                .isInstanceOfSatisfying(InsufficientCreditsException.class,
                        ex -> assertThat(ex.getAvailableCredits()).isZero());
    }

    @Test
    @DisplayName("refund restores each pool and is applied once")
    void refundRestoresPools() {
        UUID userId = account(SubscriptionTier.PRO, 3, 10);
        store.debit(userId, 5, "gem_1_fffffff", "desc");

        long balance = store.credit(userId, 5, "gem_1_fffffff");
        long again = store.credit(userId, 5, "gem_1_fffffff");

        assertThat(balance).isEqualTo(13);
        assertThat(again).isEqualTo(13);
        AccountSnapshot snapshot = store.getAccount(userId);
        assertThat(snapshot.subscriptionCredits()).isEqualTo(3);
        assertThat(snapshot.purchasedCredits()).isEqualTo(10);
    }

    @Test
    @DisplayName("a refund without a matching debit goes to the purchased pool")
    void refundWithoutDebit() {
        UUID userId = account(SubscriptionTier.FREE, 1, 0);

        long balance = store.credit(userId, 2, "rep_1_ggggggg");

        assertThat(balance).isEqualTo(3);
        assertThat(store.getAccount(userId).purchasedCredits()).isEqualTo(2);
    }

    @Test
    @DisplayName("refund for an unknown account fails")
    void refundWithoutAccount() {
        assertThatThrownBy(() -> store.credit(UUID.randomUUID(), 2, "rep_1_hhhhhhh"))
                .isInstanceOf(CreditAccountNotFoundException.class);
    }

    @Test
    @DisplayName("unknown users read as an empty free account")
    void emptySnapshot() {
        AccountSnapshot snapshot = store.getAccount(UUID.randomUUID());

        assertThat(snapshot.tier()).isEqualTo(SubscriptionTier.FREE);
        assertThat(snapshot.totalCredits()).isZero();
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    @DisplayName("two concurrent debits against a balance covering one: exactly one succeeds")
    void concurrentDebitsNeverOverdraw() throws Exception {
        UUID userId = account(SubscriptionTier.FREE, 5, 0);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                String jobId = "rep_2_concur" + i;
                attempts.add(executor.submit(() -> {
                    start.await();
                    try {
                        store.debit(userId, 5, jobId, "desc");
                        return true;
                    } catch (InsufficientCreditsException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(20, TimeUnit.SECONDS)) {
                    succeeded++;
                }
            }

            assertThat(succeeded).isEqualTo(1);
            assertThat(store.getAccount(userId).totalCredits()).isZero();
        } finally {
            executor.shutdownNow();
            jdbcTemplate.update("DELETE FROM credit_transactions WHERE user_id = ?", userId);
            jdbcTemplate.update("DELETE FROM credit_accounts WHERE user_id = ?", userId);
        }
    }
}
