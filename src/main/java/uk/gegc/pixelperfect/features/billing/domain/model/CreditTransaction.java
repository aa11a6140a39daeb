package uk.gegc.pixelperfect.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only ledger entry. {@code (referenceId, type)} is unique, which makes a job's debit and refund idempotent.
 */
@Entity
@Table(name = "credit_transactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_credit_tx_reference_type", columnNames = {"reference_id", "type"}))
@Getter
@Setter
public class CreditTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private CreditTransactionType type;

    /**
     * Signed amount: negative for usage, positive for everything else.
     */
    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "reference_id", length = 64)
    private String referenceId;

    @Column(name = "from_subscription", nullable = false)
    private long fromSubscription;

    @Column(name = "from_purchased", nullable = false)
    private long fromPurchased;

    @Column(name = "balance_after", nullable = false)
    private long balanceAfter;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
