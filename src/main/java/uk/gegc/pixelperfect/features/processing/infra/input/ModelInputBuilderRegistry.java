package uk.gegc.pixelperfect.features.processing.infra.input;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.pixelperfect.features.model.application.ModelCatalog;
import uk.gegc.pixelperfect.features.model.domain.exception.InvalidCatalogException;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup table from backend id to its {@link ModelInputBuilder}.
 * Startup fails when an enabled catalog backend has no builder.
 */
@Slf4j
@Component
public class ModelInputBuilderRegistry {

    private final Map<String, ModelInputBuilder> builders = new HashMap<>();
    private final ModelCatalog modelCatalog;

    public ModelInputBuilderRegistry(List<ModelInputBuilder> builders, ModelCatalog modelCatalog) {
        this.modelCatalog = modelCatalog;
        for (ModelInputBuilder builder : builders) {
            ModelInputBuilder previous = this.builders.putIfAbsent(builder.backendId(), builder);
            if (previous != null) {
                throw new IllegalStateException("Duplicate input builder for backend " + builder.backendId());
            }
        }
    }

    @PostConstruct
    void verifyCoverage() {
        List<String> missing = modelCatalog.listEnabled().stream()
                .map(BackendDescriptor::id)
                .filter(id -> !builders.containsKey(id))
                .toList();
        if (!missing.isEmpty()) {
            throw new InvalidCatalogException("No input builder registered for backends " + missing);
        }
        log.info("Input builders registered for {} backends", builders.size());
    }

    public ModelInputBuilder builderFor(String backendId) {
        ModelInputBuilder builder = builders.get(backendId);
        if (builder == null) {
            throw new IllegalStateException("No input builder registered for backend " + backendId);
        }
        return builder;
    }
}
