package uk.gegc.pixelperfect.features.model.application;

import uk.gegc.pixelperfect.features.model.domain.model.ImageAnalysis;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;
import uk.gegc.pixelperfect.features.model.domain.model.Recommendation;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;

public interface RecommendationEngine {

    /**
     * Maps image analysis signals to a backend for automatic mode.
     * Rules are evaluated in a fixed order: damage, text, faces, noise, then the general default.
     *
     * @throws uk.gegc.pixelperfect.features.model.domain.exception.NoEligibleModelException
     *         when no backend serves this tier at this scale
     */
    Recommendation recommend(ImageAnalysis analysis, SubscriptionTier tier, ProcessingMode mode, int scale);
}
