package uk.gegc.pixelperfect.features.model.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.pixelperfect.features.model.application.ModelCatalog;
import uk.gegc.pixelperfect.features.model.application.ModelCatalogProperties;
import uk.gegc.pixelperfect.features.model.domain.exception.InvalidCatalogException;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ModelCapability;
import uk.gegc.pixelperfect.features.model.domain.model.ProviderKind;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;
import uk.gegc.pixelperfect.features.model.domain.model.UseCase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Service
public class ModelCatalogImpl implements ModelCatalog {

    private final ModelCatalogProperties properties;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();

    public ModelCatalogImpl(ModelCatalogProperties properties) {
        this.properties = properties;
        this.snapshot.set(build(properties));
        log.info("Model catalog loaded with {} backends ({} enabled)",
                snapshot.get().backends().size(), listEnabled().size());
    }

    @Override
    public Optional<BackendDescriptor> getBackend(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.get().backends().get(id));
    }

    @Override
    public List<BackendDescriptor> listEnabled() {
        return snapshot.get().backends().values().stream()
                .filter(BackendDescriptor::enabled)
                .toList();
    }

    @Override
    public List<BackendDescriptor> listByCapability(ModelCapability capability) {
        return listEnabled().stream()
                .filter(b -> b.hasCapability(capability))
                .toList();
    }

    @Override
    public List<BackendDescriptor> listByTier(SubscriptionTier tier) {
        return listEnabled().stream()
                .filter(b -> b.isAvailableTo(tier))
                .toList();
    }

    @Override
    public Optional<BackendDescriptor> getBackendForUseCase(UseCase useCase) {
        Snapshot current = snapshot.get();
        String id = current.useCases().get(useCase);
        return id == null ? Optional.empty() : Optional.ofNullable(current.backends().get(id));
    }

    @Override
    public void reload() {
        Snapshot rebuilt = build(properties);
        snapshot.set(rebuilt);
        log.info("Model catalog reloaded with {} backends", rebuilt.backends().size());
    }

    static Snapshot build(ModelCatalogProperties properties) {
        Map<String, BackendDescriptor> backends = new LinkedHashMap<>();
        for (ModelCatalogProperties.Backend config : properties.getBackends()) {
            BackendDescriptor descriptor = toDescriptor(config);
            if (backends.putIfAbsent(descriptor.id(), descriptor) != null) {
                throw new InvalidCatalogException("Duplicate backend id: " + descriptor.id());
            }
        }

        Map<UseCase, String> useCases = new EnumMap<>(UseCase.class);
        properties.getUseCases().forEach((key, backendId) -> {
            UseCase useCase;
            try {
                useCase = UseCase.fromKey(key);
            } catch (IllegalArgumentException ex) {
                throw new InvalidCatalogException("Unknown use case id: " + key);
            }
            if (!backends.containsKey(backendId)) {
                throw new InvalidCatalogException("Use case " + key + " points to unknown backend " + backendId);
            }
            useCases.put(useCase, backendId);
        });

        return new Snapshot(Collections.unmodifiableMap(backends), Collections.unmodifiableMap(useCases));
    }

    private static BackendDescriptor toDescriptor(ModelCatalogProperties.Backend config) {
        Set<ModelCapability> capabilities = EnumSet.noneOf(ModelCapability.class);
        for (String raw : config.getCapabilities()) {
            try {
                capabilities.add(ModelCapability.fromValue(raw));
            } catch (IllegalArgumentException ex) {
                throw new InvalidCatalogException("Backend '" + config.getId() + "': " + ex.getMessage());
            }
        }
        ProviderKind provider;
        SubscriptionTier restriction;
        try {
            provider = ProviderKind.valueOf(config.getProvider().trim().toUpperCase(Locale.ROOT));
            restriction = config.getTierRestriction() == null || config.getTierRestriction().isBlank()
                    ? null
                    : SubscriptionTier.valueOf(config.getTierRestriction().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new InvalidCatalogException("Backend '" + config.getId() + "' has an invalid provider or tier");
        }
        return new BackendDescriptor(
                config.getId(),
                config.getDisplayName(),
                provider,
                config.getModelVersion(),
                capabilities,
                config.getCostPerCall(),
                config.getCreditMultiplier(),
                config.getQualityScore(),
                config.getProcessingTimeMs(),
                Set.copyOf(config.getSupportedScales()),
                config.getMaxInputResolution(),
                config.getMaxOutputResolution(),
                config.isEnabled(),
                restriction
        );
    }

    record Snapshot(Map<String, BackendDescriptor> backends, Map<UseCase, String> useCases) {
    }
}
