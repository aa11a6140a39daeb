package uk.gegc.pixelperfect.features.billing.application;

/**
 * Outcome of a debit. {@code replayed} is true when the job id had already been debited and nothing changed.
 */
public record DebitResult(
        long newBalance,
        long fromSubscription,
        long fromPurchased,
        boolean replayed
) {
}
