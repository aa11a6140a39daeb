package uk.gegc.pixelperfect.features.model.domain.model;

import uk.gegc.pixelperfect.features.model.domain.exception.InvalidCatalogException;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable description of one processing backend.
 *
 * <p>A backend lists scales exactly when it can upscale: {@code supportedScales} is empty if and only if
 * {@link ModelCapability#UPSCALE} is absent. Construction fails with {@link InvalidCatalogException}
 * otherwise, so an inconsistent catalog never loads.
 */
public record BackendDescriptor(
        String id,
        String displayName,
        ProviderKind providerKind,
        String modelVersion,
        Set<ModelCapability> capabilities,
        BigDecimal costPerCall,
        BigDecimal creditMultiplier,
        double qualityScore,
        long processingTimeMs,
        Set<Integer> supportedScales,
        int maxInputResolution,
        int maxOutputResolution,
        boolean enabled,
        SubscriptionTier tierRestriction
) {

    public static final Set<Integer> ALLOWED_SCALES = Set.of(2, 4, 8);

    public BackendDescriptor {
        if (id == null || id.isBlank()) {
            throw new InvalidCatalogException("Backend id must not be blank");
        }
        if (providerKind == null) {
            throw new InvalidCatalogException("Backend '" + id + "' has no provider kind");
        }
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ModelCapability.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        supportedScales = supportedScales == null
                ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(supportedScales));
        costPerCall = costPerCall == null ? BigDecimal.ZERO : costPerCall;
        creditMultiplier = creditMultiplier == null ? BigDecimal.ONE : creditMultiplier;
        displayName = displayName == null || displayName.isBlank() ? id : displayName;

        if (creditMultiplier.signum() < 0) {
            throw new InvalidCatalogException("Backend '" + id + "' has a negative credit multiplier");
        }
        if (costPerCall.signum() < 0) {
            throw new InvalidCatalogException("Backend '" + id + "' has a negative cost per call");
        }
        if (qualityScore < 0 || qualityScore > 10) {
            throw new InvalidCatalogException("Backend '" + id + "' quality score must be within 0..10");
        }
        for (Integer scale : supportedScales) {
            if (!ALLOWED_SCALES.contains(scale)) {
                throw new InvalidCatalogException("Backend '" + id + "' declares unsupported scale " + scale);
            }
        }
        boolean upscales = capabilities.contains(ModelCapability.UPSCALE);
        if (upscales && supportedScales.isEmpty()) {
            throw new InvalidCatalogException("Backend '" + id + "' can upscale but declares no scales");
        }
        if (!upscales && !supportedScales.isEmpty()) {
            throw new InvalidCatalogException("Backend '" + id + "' declares scales without the upscale capability");
        }
    }

    public boolean hasCapability(ModelCapability capability) {
        return capabilities.contains(capability);
    }

    public boolean hasAllCapabilities(Set<ModelCapability> required) {
        return required == null || capabilities.containsAll(required);
    }

    public boolean supportsScale(int scale) {
        return supportedScales.contains(scale);
    }

    public boolean isAvailableTo(SubscriptionTier tier) {
        SubscriptionTier effective = tier == null ? SubscriptionTier.FREE : tier;
        return effective.includes(tierRestriction);
    }
}
