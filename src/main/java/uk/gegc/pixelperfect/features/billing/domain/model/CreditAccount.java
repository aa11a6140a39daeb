package uk.gegc.pixelperfect.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A user's prepaid credit balance, split into two pools.
 * Subscription credits expire with the billing period and are consumed first.
 */
@Entity
@Table(name = "credit_accounts")
@Getter
@Setter
public class CreditAccount {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_tier", nullable = false, length = 32)
    private SubscriptionTier subscriptionTier = SubscriptionTier.FREE;

    @Column(name = "subscription_credits", nullable = false)
    private long subscriptionCredits;

    @Column(name = "purchased_credits", nullable = false)
    private long purchasedCredits;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public long getTotalCredits() {
        return subscriptionCredits + purchasedCredits;
    }

    @PrePersist
    @PreUpdate
    void touch() {
        this.updatedAt = LocalDateTime.now();
    }
}
