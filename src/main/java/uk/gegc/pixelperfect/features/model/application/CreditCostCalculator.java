package uk.gegc.pixelperfect.features.model.application;

import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;

public interface CreditCostCalculator {

    /**
     * Credits charged for one job on the given backend. Output scale does not affect the price.
     *
     * @throws uk.gegc.pixelperfect.features.model.domain.exception.ModelNotFoundException for unknown ids
     */
    long creditCost(String backendId, ProcessingMode mode);

    long creditCost(BackendDescriptor backend, ProcessingMode mode);
}
