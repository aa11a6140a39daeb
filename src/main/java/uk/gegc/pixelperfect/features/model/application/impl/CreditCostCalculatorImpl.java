package uk.gegc.pixelperfect.features.model.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.pixelperfect.features.model.application.CreditCostCalculator;
import uk.gegc.pixelperfect.features.model.application.CreditCostProperties;
import uk.gegc.pixelperfect.features.model.application.ModelCatalog;
import uk.gegc.pixelperfect.features.model.domain.exception.ModelNotFoundException;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Service
@RequiredArgsConstructor
public class CreditCostCalculatorImpl implements CreditCostCalculator {

    private final ModelCatalog modelCatalog;
    private final CreditCostProperties properties;

    @Override
    public long creditCost(String backendId, ProcessingMode mode) {
        BackendDescriptor backend = modelCatalog.getBackend(backendId)
                .orElseThrow(() -> new ModelNotFoundException(backendId));
        return creditCost(backend, mode);
    }

    @Override
    public long creditCost(BackendDescriptor backend, ProcessingMode mode) {
        long base = baseCredits(mode == null ? ProcessingMode.UPSCALE : mode);
        return BigDecimal.valueOf(base)
                .multiply(backend.creditMultiplier())
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
    }

    private long baseCredits(ProcessingMode mode) {
        return switch (mode) {
            case UPSCALE, BOTH -> properties.getUpscaleBase();
            case ENHANCE, CUSTOM -> properties.getEnhanceBase();
        };
    }
}
