package uk.gegc.pixelperfect.features.processing.domain.model;

/**
 * Backend-agnostic failure classes reported to callers.
 */
public enum ProcessingErrorCode {
    RATE_LIMITED,
    SAFETY,
    TIMEOUT,
    PROCESSING_FAILED,
    NO_OUTPUT,
    INSUFFICIENT_CREDITS,
    GENERIC;

    /**
     * Failures raised before a debit is recorded never need a refund.
     */
    public boolean isPreDebit() {
        return this == INSUFFICIENT_CREDITS || this == GENERIC;
    }
}
