package uk.gegc.pixelperfect.features.model.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;

@Schema(name = "CreditEstimateDto", description = "Credits a job would cost")
public record CreditEstimateDto(
        String modelId,
        ProcessingMode mode,
        int scale,
        long credits
) {
}
