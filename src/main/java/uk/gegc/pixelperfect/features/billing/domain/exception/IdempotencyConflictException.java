package uk.gegc.pixelperfect.features.billing.domain.exception;

/**
 * A job id was reused with a different user or amount.
 */
public class IdempotencyConflictException extends RuntimeException {

    public IdempotencyConflictException(String message) {
        super(message);
    }
}
