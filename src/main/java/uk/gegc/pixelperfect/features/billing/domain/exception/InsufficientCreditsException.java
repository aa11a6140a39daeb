package uk.gegc.pixelperfect.features.billing.domain.exception;

import java.util.UUID;

public class InsufficientCreditsException extends RuntimeException {

    private final UUID userId;
    private final long requiredCredits;
    private final long availableCredits;

    public InsufficientCreditsException(UUID userId, long requiredCredits, long availableCredits) {
        super(String.format("Insufficient credits. Required: %d, Available: %d", requiredCredits, availableCredits));
        this.userId = userId;
        this.requiredCredits = requiredCredits;
        this.availableCredits = availableCredits;
    }

    public UUID getUserId() {
        return userId;
    }

    public long getRequiredCredits() {
        return requiredCredits;
    }

    public long getAvailableCredits() {
        return availableCredits;
    }

    public long getShortfall() {
        return Math.max(0, requiredCredits - availableCredits);
    }
}
