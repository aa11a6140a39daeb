package uk.gegc.pixelperfect.features.billing.application;

import java.util.UUID;

/**
 * Durable credit ledger.
 *
 * <p>Implementations must make {@link #debit} an indivisible check-and-deduct so that concurrent debits of one
 * user can never overdraw the balance. Both write operations are idempotent per job id: repeating a call with
 * the same job id returns the current balance and changes nothing.
 */
public interface CreditStore {

    /**
     * @throws uk.gegc.pixelperfect.features.billing.domain.exception.InsufficientCreditsException
     *         when the balance is lower than {@code amount}
     */
    DebitResult debit(UUID userId, long amount, String jobId, String description);

    /**
     * Reverses the debit recorded under {@code jobId}.
     *
     * @return the balance after the refund
     */
    long credit(UUID userId, long amount, String jobId);

    AccountSnapshot getAccount(UUID userId);
}
