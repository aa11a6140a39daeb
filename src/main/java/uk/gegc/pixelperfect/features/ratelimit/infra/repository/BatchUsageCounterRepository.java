package uk.gegc.pixelperfect.features.ratelimit.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.pixelperfect.features.ratelimit.domain.model.BatchUsageCounter;

import java.util.Optional;
import java.util.UUID;

public interface BatchUsageCounterRepository extends JpaRepository<BatchUsageCounter, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM BatchUsageCounter c WHERE c.userId = :userId")
    Optional<BatchUsageCounter> findByUserIdForUpdate(@Param("userId") UUID userId);
}
