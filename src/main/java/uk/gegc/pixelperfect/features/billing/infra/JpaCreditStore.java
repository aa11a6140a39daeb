package uk.gegc.pixelperfect.features.billing.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.pixelperfect.features.billing.application.AccountSnapshot;
import uk.gegc.pixelperfect.features.billing.application.CreditStore;
import uk.gegc.pixelperfect.features.billing.application.DebitResult;
import uk.gegc.pixelperfect.features.billing.domain.exception.CreditAccountNotFoundException;
import uk.gegc.pixelperfect.features.billing.domain.exception.IdempotencyConflictException;
import uk.gegc.pixelperfect.features.billing.domain.exception.InsufficientCreditsException;
import uk.gegc.pixelperfect.features.billing.domain.model.CreditAccount;
import uk.gegc.pixelperfect.features.billing.domain.model.CreditTransaction;
import uk.gegc.pixelperfect.features.billing.domain.model.CreditTransactionType;
import uk.gegc.pixelperfect.features.billing.infra.repository.CreditAccountRepository;
import uk.gegc.pixelperfect.features.billing.infra.repository.CreditTransactionRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Relational credit store. Every write locks the account row first, so the balance check, the deduction and the
 * idempotency lookup happen under one lock within one transaction.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaCreditStore implements CreditStore {

    private final CreditAccountRepository accountRepository;
    private final CreditTransactionRepository transactionRepository;

    @Override
    @Transactional
    public DebitResult debit(UUID userId, long amount, String jobId, String description) {
        requireJobId(jobId);
        Optional<CreditAccount> locked = accountRepository.findByUserIdForUpdate(userId);
        if (locked.isEmpty()) {
            throw new InsufficientCreditsException(userId, amount, 0L);
        }
        CreditAccount account = locked.get();

        Optional<CreditTransaction> existing = transactionRepository.findByReferenceIdAndType(jobId, CreditTransactionType.USAGE);
        if (existing.isPresent()) {
            CreditTransaction tx = existing.get();
            if (!tx.getUserId().equals(userId) || -tx.getAmount() != amount) {
                throw new IdempotencyConflictException("Job id " + jobId + " was already debited with different parameters");
            }
            return new DebitResult(account.getTotalCredits(), tx.getFromSubscription(), tx.getFromPurchased(), true);
        }

        long available = account.getTotalCredits();
        if (available < amount) {
            throw new InsufficientCreditsException(userId, amount, available);
        }

        // Subscription credits expire first, so they are spent first
        long fromSubscription = Math.min(account.getSubscriptionCredits(), amount);
        long fromPurchased = amount - fromSubscription;
        account.setSubscriptionCredits(account.getSubscriptionCredits() - fromSubscription);
        account.setPurchasedCredits(account.getPurchasedCredits() - fromPurchased);
        accountRepository.save(account);

        CreditTransaction tx = new CreditTransaction();
        tx.setUserId(userId);
        tx.setType(CreditTransactionType.USAGE);
        tx.setAmount(-amount);
        tx.setReferenceId(jobId);
        tx.setFromSubscription(fromSubscription);
        tx.setFromPurchased(fromPurchased);
        tx.setBalanceAfter(account.getTotalCredits());
        tx.setDescription(description);
        transactionRepository.save(tx);

        return new DebitResult(account.getTotalCredits(), fromSubscription, fromPurchased, false);
    }

    @Override
    @Transactional
    public long credit(UUID userId, long amount, String jobId) {
        requireJobId(jobId);
        CreditAccount account = accountRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new CreditAccountNotFoundException(userId));

        if (transactionRepository.findByReferenceIdAndType(jobId, CreditTransactionType.REFUND).isPresent()) {
            log.debug("Refund for job {} already recorded", jobId);
            return account.getTotalCredits();
        }

        long toSubscription = 0L;
        long toPurchased = amount;
        Optional<CreditTransaction> usage = transactionRepository.findByReferenceIdAndType(jobId, CreditTransactionType.USAGE);
        if (usage.isPresent() && -usage.get().getAmount() == amount) {
            toSubscription = usage.get().getFromSubscription();
            toPurchased = usage.get().getFromPurchased();
        } else {
            log.warn("Refund for job {} does not match a recorded debit; crediting {} to purchased pool", jobId, amount);
        }

        account.setSubscriptionCredits(account.getSubscriptionCredits() + toSubscription);
        account.setPurchasedCredits(account.getPurchasedCredits() + toPurchased);
        accountRepository.save(account);

        CreditTransaction tx = new CreditTransaction();
        tx.setUserId(userId);
        tx.setType(CreditTransactionType.REFUND);
        tx.setAmount(amount);
        tx.setReferenceId(jobId);
        tx.setFromSubscription(toSubscription);
        tx.setFromPurchased(toPurchased);
        tx.setBalanceAfter(account.getTotalCredits());
        tx.setDescription("Refund for failed job " + jobId);
        transactionRepository.save(tx);

        return account.getTotalCredits();
    }

    @Override
    @Transactional(readOnly = true)
    public AccountSnapshot getAccount(UUID userId) {
        return accountRepository.findByUserId(userId)
                .map(a -> new AccountSnapshot(a.getUserId(), a.getSubscriptionTier(),
                        a.getSubscriptionCredits(), a.getPurchasedCredits()))
                .orElseGet(() -> AccountSnapshot.empty(userId));
    }

    private static void requireJobId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
    }
}
