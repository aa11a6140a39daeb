package uk.gegc.pixelperfect.features.model.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.pixelperfect.features.model.application.CreditCostCalculator;
import uk.gegc.pixelperfect.features.model.application.ModelCatalog;
import uk.gegc.pixelperfect.features.model.application.ModelSelector;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ModelCapability;
import uk.gegc.pixelperfect.features.model.domain.model.SelectionCriteria;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModelSelectorImpl implements ModelSelector {

    private static final Comparator<BackendDescriptor> BY_QUALITY_DESC =
            Comparator.comparingDouble(BackendDescriptor::qualityScore).reversed();
    private static final Comparator<BackendDescriptor> BY_COST_ASC =
            Comparator.comparing(BackendDescriptor::costPerCall);

    private final ModelCatalog modelCatalog;
    private final CreditCostCalculator creditCostCalculator;

    @Override
    public Optional<BackendDescriptor> selectBest(SelectionCriteria criteria) {
        List<BackendDescriptor> candidates = new ArrayList<>(modelCatalog.listByTier(criteria.userTier()).stream()
                .filter(b -> b.hasAllCapabilities(criteria.requiredCapabilities()))
                .filter(b -> b.supportsScale(criteria.scale()))
                .toList());

        if (candidates.isEmpty()) {
            log.debug("No backend satisfies tier={} capabilities={} scale={}",
                    criteria.userTier(), criteria.requiredCapabilities(), criteria.scale());
            return Optional.empty();
        }

        if (criteria.preferences().enhanceFaces()) {
            List<BackendDescriptor> faceCapable = candidates.stream()
                    .filter(b -> b.hasCapability(ModelCapability.FACE_RESTORATION))
                    .toList();
            if (!faceCapable.isEmpty()) {
                candidates = new ArrayList<>(faceCapable);
            }
        }

        // List.sort is stable: ties keep catalog order
        candidates.sort(criteria.preferences().prioritizeQuality() ? BY_QUALITY_DESC : BY_COST_ASC);

        Long availableCredits = criteria.availableCredits();
        if (availableCredits == null) {
            return Optional.of(candidates.get(0));
        }
        for (BackendDescriptor candidate : candidates) {
            if (creditCostCalculator.creditCost(candidate, criteria.mode()) <= availableCredits) {
                return Optional.of(candidate);
            }
        }

        BackendDescriptor cheapest = candidates.stream().min(BY_COST_ASC).orElseThrow();
        log.warn("No affordable backend for tier={} scale={} credits={}; returning cheapest candidate {} (best effort)",
                criteria.userTier(), criteria.scale(), availableCredits, cheapest.id());
        return Optional.of(cheapest);
    }
}
