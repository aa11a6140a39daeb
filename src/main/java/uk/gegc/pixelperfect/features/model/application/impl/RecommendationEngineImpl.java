package uk.gegc.pixelperfect.features.model.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.pixelperfect.features.model.application.CreditCostCalculator;
import uk.gegc.pixelperfect.features.model.application.ModelCatalog;
import uk.gegc.pixelperfect.features.model.application.RecommendationEngine;
import uk.gegc.pixelperfect.features.model.application.RecommendationProperties;
import uk.gegc.pixelperfect.features.model.domain.exception.NoEligibleModelException;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ContentType;
import uk.gegc.pixelperfect.features.model.domain.model.ImageAnalysis;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;
import uk.gegc.pixelperfect.features.model.domain.model.Recommendation;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;
import uk.gegc.pixelperfect.features.model.domain.model.UseCase;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationEngineImpl implements RecommendationEngine {

    static final String DOWNGRADE_NOTE = "Standard upscaling selected (best available for your tier).";

    private final ModelCatalog modelCatalog;
    private final CreditCostCalculator creditCostCalculator;
    private final RecommendationProperties properties;

    @Override
    public Recommendation recommend(ImageAnalysis analysis, SubscriptionTier tier, ProcessingMode mode, int scale) {
        List<BackendDescriptor> eligible = modelCatalog.listByTier(tier).stream()
                .filter(b -> b.supportsScale(scale))
                .filter(b -> b.hasAllCapabilities(mode.requiredCapabilities()))
                .toList();
        if (eligible.isEmpty()) {
            throw new NoEligibleModelException("No model available for tier " + tier.toValue() + " at " + scale + "x in " + mode.toValue() + " mode");
        }

        Rule rule = matchRule(analysis);
        BackendDescriptor mapped = modelCatalog.getBackendForUseCase(rule.useCase()).orElse(null);

        BackendDescriptor recommended;
        String reasoning;
        if (mapped != null && eligible.stream().anyMatch(b -> b.id().equals(mapped.id()))) {
            recommended = mapped;
            reasoning = rule.reasoning();
        } else {
            recommended = eligible.get(0);
            reasoning = rule.useCase() == UseCase.GENERAL_UPSCALE
                    ? DOWNGRADE_NOTE
                    : rule.reasoning() + " " + DOWNGRADE_NOTE;
            log.debug("Use case {} maps to {} which is not eligible for tier={} scale={}; downgraded to {}",
                    rule.useCase().getKey(), mapped == null ? null : mapped.id(), tier, scale, recommended.id());
        }

        List<String> alternatives = eligible.stream()
                .map(BackendDescriptor::id)
                .filter(id -> !id.equals(recommended.id()))
                .limit(properties.getMaxAlternatives())
                .toList();

        return new Recommendation(
                recommended.id(),
                reasoning,
                creditCostCalculator.creditCost(recommended, mode),
                alternatives,
                properties.getConfidence()
        );
    }

    private Rule matchRule(ImageAnalysis analysis) {
        if (analysis == null) {
            return Rule.GENERAL;
        }
        ContentType contentType = analysis.contentType();
        if (analysis.damageLevel() > properties.getDamageThreshold()) {
            return Rule.DAMAGE;
        }
        if (analysis.textCoverage() > properties.getTextCoverageThreshold() || contentType == ContentType.DOCUMENT) {
            return Rule.TEXT;
        }
        if (analysis.faceCount() > 0 || contentType == ContentType.PORTRAIT || contentType == ContentType.VINTAGE) {
            return Rule.FACES;
        }
        if (analysis.noiseLevel() > properties.getNoiseThreshold()) {
            return Rule.NOISE;
        }
        return Rule.GENERAL;
    }

    private enum Rule {
        DAMAGE(UseCase.DAMAGED_PHOTOS, "Heavy damage detected. Premium restoration recommended."),
        TEXT(UseCase.TEXT_LOGOS, "Text or logos detected. Text preservation model selected."),
        FACES(UseCase.PORTRAITS, "Portrait or old photo detected. Face restoration model selected."),
        NOISE(UseCase.MAX_QUALITY, "Noise detected. Higher quality upscaler selected."),
        GENERAL(UseCase.GENERAL_UPSCALE, "Standard upscaling selected.");

        private final UseCase useCase;
        private final String reasoning;

        Rule(UseCase useCase, String reasoning) {
            this.useCase = useCase;
            this.reasoning = reasoning;
        }

        UseCase useCase() {
            return useCase;
        }

        String reasoning() {
            return reasoning;
        }
    }
}
