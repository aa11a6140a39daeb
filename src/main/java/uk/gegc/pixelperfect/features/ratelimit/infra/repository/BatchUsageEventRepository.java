package uk.gegc.pixelperfect.features.ratelimit.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.pixelperfect.features.ratelimit.domain.model.BatchUsageEvent;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

public interface BatchUsageEventRepository extends JpaRepository<BatchUsageEvent, UUID> {

    long countByUserIdAndCreatedAtAfter(UUID userId, LocalDateTime cutoff);

    @Query("SELECT MIN(e.createdAt) FROM BatchUsageEvent e WHERE e.userId = :userId AND e.createdAt > :cutoff")
    Optional<LocalDateTime> findOldestAfter(@Param("userId") UUID userId, @Param("cutoff") LocalDateTime cutoff);

    @Modifying
    @Query("DELETE FROM BatchUsageEvent e WHERE e.userId = :userId AND e.createdAt <= :cutoff")
    int deleteExpired(@Param("userId") UUID userId, @Param("cutoff") LocalDateTime cutoff);

    @Modifying
    @Query("DELETE FROM BatchUsageEvent e WHERE e.createdAt <= :cutoff")
    int deleteAllExpired(@Param("cutoff") LocalDateTime cutoff);
}
