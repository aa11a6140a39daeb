package uk.gegc.pixelperfect.features.processing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.pixelperfect.features.ratelimit.application.BatchCheckResult;

import java.time.Instant;

@Schema(name = "BatchUsageDto", description = "Jobs counted in the current batch window")
public record BatchUsageDto(
        @Schema(description = "Jobs started in the current window")
        int current,
        @Schema(description = "Jobs allowed per window for the user's tier")
        int limit,
        @Schema(description = "Jobs still allowed in the current window")
        int remaining,
        @Schema(description = "When the oldest counted job leaves the window")
        Instant resetAt
) {

    public static BatchUsageDto from(BatchCheckResult result) {
        return new BatchUsageDto(result.currentCount(), result.limit(), result.remaining(), result.resetAt());
    }
}
