package uk.gegc.pixelperfect.features.model.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Constraints and preferences a backend selection has to satisfy.
 * {@code availableCredits} is optional; when absent the selector ignores affordability.
 */
public record SelectionCriteria(
        SubscriptionTier userTier,
        ProcessingMode mode,
        int scale,
        Set<ModelCapability> requiredCapabilities,
        SelectionPreferences preferences,
        Long availableCredits
) {

    public SelectionCriteria {
        userTier = userTier == null ? SubscriptionTier.FREE : userTier;
        mode = mode == null ? ProcessingMode.UPSCALE : mode;
        requiredCapabilities = requiredCapabilities == null || requiredCapabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(requiredCapabilities));
        preferences = preferences == null ? SelectionPreferences.none() : preferences;
    }

    public static SelectionCriteria of(SubscriptionTier tier, ProcessingMode mode, int scale) {
        return new SelectionCriteria(tier, mode, scale, Set.of(), SelectionPreferences.none(), null);
    }
}
