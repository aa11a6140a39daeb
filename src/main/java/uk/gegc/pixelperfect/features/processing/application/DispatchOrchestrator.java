package uk.gegc.pixelperfect.features.processing.application;

import uk.gegc.pixelperfect.features.processing.domain.model.ProcessingOutcome;

/**
 * Runs one job through debit, backend call and completion or refund.
 *
 * <p>The outcome is returned, not thrown. A failure after the debit always includes a refund attempt;
 * a refund that fails is logged and does not replace the original error.
 */
public interface DispatchOrchestrator {

    ProcessingOutcome dispatch(DispatchRequest request);
}
