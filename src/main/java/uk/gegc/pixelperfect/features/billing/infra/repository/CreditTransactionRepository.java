package uk.gegc.pixelperfect.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.pixelperfect.features.billing.domain.model.CreditTransaction;
import uk.gegc.pixelperfect.features.billing.domain.model.CreditTransactionType;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, UUID> {

    Optional<CreditTransaction> findByReferenceIdAndType(String referenceId, CreditTransactionType type);

    List<CreditTransaction> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
