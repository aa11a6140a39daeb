package uk.gegc.pixelperfect.features.billing.application;

import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;

import java.util.UUID;

public record AccountSnapshot(
        UUID userId,
        SubscriptionTier tier,
        long subscriptionCredits,
        long purchasedCredits
) {

    public long totalCredits() {
        return subscriptionCredits + purchasedCredits;
    }

    public static AccountSnapshot empty(UUID userId) {
        return new AccountSnapshot(userId, SubscriptionTier.FREE, 0L, 0L);
    }
}
