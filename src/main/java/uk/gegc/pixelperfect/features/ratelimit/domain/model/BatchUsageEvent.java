package uk.gegc.pixelperfect.features.ratelimit.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "batch_usage_events")
@Getter
@NoArgsConstructor
public class BatchUsageEvent {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public BatchUsageEvent(UUID userId, LocalDateTime createdAt) {
        this.id = UUID.randomUUID();
        this.userId = userId;
        this.createdAt = createdAt;
    }
}
