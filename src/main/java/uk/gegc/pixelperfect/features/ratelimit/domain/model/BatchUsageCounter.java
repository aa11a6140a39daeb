package uk.gegc.pixelperfect.features.ratelimit.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One row per user, used only as a lock target so window checks for the same user serialize.
 */
@Entity
@Table(name = "batch_usage_counters")
@Getter
@Setter
@NoArgsConstructor
public class BatchUsageCounter {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public BatchUsageCounter(UUID userId, LocalDateTime updatedAt) {
        this.userId = userId;
        this.updatedAt = updatedAt;
    }
}
