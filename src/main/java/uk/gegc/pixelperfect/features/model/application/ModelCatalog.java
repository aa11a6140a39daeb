package uk.gegc.pixelperfect.features.model.application;

import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ModelCapability;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;
import uk.gegc.pixelperfect.features.model.domain.model.UseCase;

import java.util.List;
import java.util.Optional;

/**
 * Read-mostly registry of processing backends.
 * All list operations return enabled backends only, in catalog order.
 */
public interface ModelCatalog {

    Optional<BackendDescriptor> getBackend(String id);

    List<BackendDescriptor> listEnabled();

    List<BackendDescriptor> listByCapability(ModelCapability capability);

    /**
     * Enabled backends without a tier restriction or whose restriction ranks at or below {@code tier}.
     */
    List<BackendDescriptor> listByTier(SubscriptionTier tier);

    /**
     * Backend mapped to the use case, empty when the use case is not configured.
     */
    Optional<BackendDescriptor> getBackendForUseCase(UseCase useCase);

    /**
     * Rebuilds the catalog from configuration and swaps it in atomically.
     * Readers see either the previous or the new catalog, never a mix.
     */
    void reload();
}
