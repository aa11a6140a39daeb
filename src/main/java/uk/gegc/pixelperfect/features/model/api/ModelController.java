package uk.gegc.pixelperfect.features.model.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.pixelperfect.features.billing.application.CreditLedgerClient;
import uk.gegc.pixelperfect.features.model.api.dto.BackendDescriptorDto;
import uk.gegc.pixelperfect.features.model.api.dto.CreditEstimateDto;
import uk.gegc.pixelperfect.features.model.api.dto.RecommendRequest;
import uk.gegc.pixelperfect.features.model.api.dto.RecommendationDto;
import uk.gegc.pixelperfect.features.model.application.CreditCostCalculator;
import uk.gegc.pixelperfect.features.model.application.ModelCatalog;
import uk.gegc.pixelperfect.features.model.application.RecommendationEngine;
import uk.gegc.pixelperfect.features.model.domain.model.ProcessingMode;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;
import uk.gegc.pixelperfect.shared.security.AuthenticatedUsers;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/v1/models")
@RequiredArgsConstructor
@Validated
@Tag(name = "Models", description = "Model catalog, recommendations and credit estimates")
public class ModelController {

    private final ModelCatalog modelCatalog;
    private final RecommendationEngine recommendationEngine;
    private final CreditCostCalculator creditCostCalculator;
    private final CreditLedgerClient ledgerClient;

    @Operation(summary = "List models", description = "Enabled models usable on the given plan, or on every plan when omitted")
    @ApiResponse(responseCode = "200", description = "Models listed")
    @GetMapping
    public ResponseEntity<List<BackendDescriptorDto>> listModels(
            @Parameter(description = "Plan to filter by", example = "pro")
            @RequestParam(required = false) String tier) {
        var backends = tier == null || tier.isBlank()
                ? modelCatalog.listEnabled()
                : modelCatalog.listByTier(SubscriptionTier.fromValue(tier));
        List<BackendDescriptorDto> body = backends.stream()
                .map(backend -> BackendDescriptorDto.from(backend,
                        creditCostCalculator.creditCost(backend, ProcessingMode.UPSCALE),
                        creditCostCalculator.creditCost(backend, ProcessingMode.ENHANCE)))
                .toList();
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Recommend a model", description = "Maps image analysis signals to the best model for the plan")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recommendation produced",
                    content = @Content(schema = @Schema(implementation = RecommendationDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "No model serves this plan at this scale",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/recommend")
    public ResponseEntity<RecommendationDto> recommend(
            @RequestBody @Valid RecommendRequest request,
            Principal principal) {
        SubscriptionTier tier = request.tier() != null
                ? request.tier()
                : ledgerClient.getAccount(AuthenticatedUsers.resolveUserId(principal)).tier();
        return ResponseEntity.ok(RecommendationDto.from(
                recommendationEngine.recommend(request.analysis(), tier, request.mode(), request.scale())));
    }

    @Operation(summary = "Estimate credits", description = "Credits a job on the model would cost; scale does not change the price")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Estimate produced",
                    content = @Content(schema = @Schema(implementation = CreditEstimateDto.class))),
            @ApiResponse(responseCode = "404", description = "Unknown model",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/credit-estimate")
    public ResponseEntity<CreditEstimateDto> estimate(
            @RequestParam String modelId,
            @RequestParam(defaultValue = "upscale") String mode,
            @RequestParam(defaultValue = "2") int scale) {
        ProcessingMode processingMode = ProcessingMode.fromValue(mode);
        long credits = creditCostCalculator.creditCost(modelId, processingMode);
        return ResponseEntity.ok(new CreditEstimateDto(modelId, processingMode, scale, credits));
    }
}
