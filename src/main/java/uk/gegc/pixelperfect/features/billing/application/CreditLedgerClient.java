package uk.gegc.pixelperfect.features.billing.application;

import java.util.UUID;

/**
 * Entry point for dispatch code into the credit ledger.
 * Insufficient balance surfaces as {@code InsufficientCreditsException}; every other store failure
 * is wrapped in {@code CreditLedgerException}.
 */
public interface CreditLedgerClient {

    DebitResult debit(UUID userId, long amount, String jobId, String description);

    long refund(UUID userId, long amount, String jobId);

    AccountSnapshot getAccount(UUID userId);
}
