package uk.gegc.pixelperfect.features.processing.application;

import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.processing.domain.model.ImageInput;

import java.util.UUID;

/**
 * Everything the orchestrator needs for one job. {@code creditCost} is the billed amount of record.
 */
public record DispatchRequest(
        UUID userId,
        BackendDescriptor backend,
        long creditCost,
        ImageInput input
) {
}
