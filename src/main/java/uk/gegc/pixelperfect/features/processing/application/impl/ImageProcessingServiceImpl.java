package uk.gegc.pixelperfect.features.processing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.pixelperfect.features.billing.application.AccountSnapshot;
import uk.gegc.pixelperfect.features.billing.application.CreditLedgerClient;
import uk.gegc.pixelperfect.features.model.application.CreditCostCalculator;
import uk.gegc.pixelperfect.features.model.application.ModelCatalog;
import uk.gegc.pixelperfect.features.model.application.ModelSelector;
import uk.gegc.pixelperfect.features.model.application.RecommendationEngine;
import uk.gegc.pixelperfect.features.model.domain.exception.ModelNotAvailableException;
import uk.gegc.pixelperfect.features.model.domain.exception.ModelNotFoundException;
import uk.gegc.pixelperfect.features.model.domain.exception.NoEligibleModelException;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ModelCapability;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;
import uk.gegc.pixelperfect.features.model.domain.model.Recommendation;
import uk.gegc.pixelperfect.features.model.domain.model.SelectionCriteria;
import uk.gegc.pixelperfect.features.model.domain.model.SelectionPreferences;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;
import uk.gegc.pixelperfect.features.processing.api.dto.ProcessImageRequest;
import uk.gegc.pixelperfect.features.processing.application.DispatchOrchestrator;
import uk.gegc.pixelperfect.features.processing.application.DispatchRequest;
import uk.gegc.pixelperfect.features.processing.application.ImageProcessingService;
import uk.gegc.pixelperfect.features.processing.domain.model.CanonicalResult;
import uk.gegc.pixelperfect.features.processing.domain.model.ImageInput;
import uk.gegc.pixelperfect.features.processing.infra.backend.ImageBackendRegistry;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchCheckResult;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchLimitService;
import uk.gegc.pixelperfect.shared.util.DataUris;

import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ImageProcessingServiceImpl implements ImageProcessingService {

    private final BatchLimitService batchLimitService;
    private final CreditLedgerClient ledgerClient;
    private final ModelCatalog modelCatalog;
    private final ModelSelector modelSelector;
    private final RecommendationEngine recommendationEngine;
    private final CreditCostCalculator creditCostCalculator;
    private final ImageBackendRegistry backendRegistry;
    private final DispatchOrchestrator dispatchOrchestrator;

    @Override
    public CanonicalResult process(UUID userId, ProcessImageRequest request) {
        validate(request);

        AccountSnapshot account = ledgerClient.getAccount(userId);
        batchLimitService.checkAndIncrement(userId, account.tier());

        BackendDescriptor backend = request.autoModel()
                ? chooseAutomatically(request, account)
                : resolveExplicit(request, account.tier());
        long creditCost = creditCostCalculator.creditCost(backend, request.mode());
        log.debug("User {} ({}) -> {} for {} {}x, {} credits",
                userId, account.tier(), backend.id(), request.mode().toValue(), request.scale(), creditCost);

        ImageInput input = new ImageInput(
                DataUris.toDataUri(request.imageData(), request.mimeType()),
                request.mimeType(),
                request.mode(),
                request.scale(),
                request.enhancement(),
                request.enhanceFaces(),
                request.preserveText(),
                request.customInstructions()
        );
        return dispatchOrchestrator.dispatch(new DispatchRequest(userId, backend, creditCost, input))
                .orElseThrow();
    }

    @Override
    public BatchCheckResult getBatchUsage(UUID userId) {
        return batchLimitService.getUsage(userId, ledgerClient.getAccount(userId).tier());
    }

    private void validate(ProcessImageRequest request) {
        if (!BackendDescriptor.ALLOWED_SCALES.contains(request.scale())) {
            throw new IllegalArgumentException("Scale must be 2, 4 or 8");
        }
        if (request.mode() == ProcessingMode.CUSTOM
                && (request.customInstructions() == null || request.customInstructions().isBlank())) {
            throw new IllegalArgumentException("Custom mode requires custom instructions");
        }
    }

    private BackendDescriptor resolveExplicit(ProcessImageRequest request, SubscriptionTier tier) {
        String modelId = request.modelId();
        BackendDescriptor backend = modelCatalog.getBackend(modelId)
                .orElseThrow(() -> new ModelNotFoundException(modelId));
        if (!backend.enabled()) {
            throw new ModelNotAvailableException(modelId, "Model " + modelId + " is currently disabled");
        }
        if (!backend.isAvailableTo(tier)) {
            throw new ModelNotAvailableException(modelId,
                    "Model " + modelId + " requires the " + backend.tierRestriction().toValue() + " plan or higher");
        }
        if (request.mode().requiresUpscale() && !backend.supportsScale(request.scale())) {
            throw new ModelNotAvailableException(modelId,
                    "Model " + modelId + " does not support " + request.scale() + "x output");
        }
        if (!backendRegistry.backendFor(backend.providerKind()).supportsMode(backend, request.mode())) {
            throw new ModelNotAvailableException(modelId,
                    "Model " + modelId + " does not support " + request.mode().toValue() + " mode");
        }
        return backend;
    }

    private BackendDescriptor chooseAutomatically(ProcessImageRequest request, AccountSnapshot account) {
        if (request.analysis() != null) {
            Recommendation recommendation = recommendationEngine.recommend(
                    request.analysis(), account.tier(), request.mode(), request.scale());
            log.debug("Recommended {} ({})", recommendation.recommendedModel(), recommendation.reasoning());
            return modelCatalog.getBackend(recommendation.recommendedModel())
                    .orElseThrow(() -> new ModelNotFoundException(recommendation.recommendedModel()));
        }

        Set<ModelCapability> required = request.mode().requiredCapabilities();
        SelectionCriteria criteria = new SelectionCriteria(
                account.tier(),
                request.mode(),
                request.scale(),
                required,
                new SelectionPreferences(
                        request.enhanceFaces(),
                        request.enhancement() != null && request.enhancement().denoise(),
                        request.prioritizeQuality()),
                account.totalCredits()
        );
        return modelSelector.selectBest(criteria)
                .orElseThrow(() -> new NoEligibleModelException(
                        "No model available for the " + account.tier().toValue() + " plan at "
                                + request.scale() + "x"));
    }
}
