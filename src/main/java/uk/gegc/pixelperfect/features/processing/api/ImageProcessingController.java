package uk.gegc.pixelperfect.features.processing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.pixelperfect.features.processing.api.dto.BatchUsageDto;
import uk.gegc.pixelperfect.features.processing.api.dto.ProcessImageRequest;
import uk.gegc.pixelperfect.features.processing.api.dto.ProcessImageResponse;
import uk.gegc.pixelperfect.features.processing.application.ImageProcessingService;
import uk.gegc.pixelperfect.shared.security.AuthenticatedUsers;

import java.security.Principal;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/images")
@RequiredArgsConstructor
@Validated
@Tag(name = "Image Processing", description = "Upscale and enhance images billed in credits")
public class ImageProcessingController {

    private final ImageProcessingService imageProcessingService;

    @Operation(
            summary = "Process an image",
            description = "Debits credits, runs the chosen or automatically selected model and returns the result. "
                    + "Credits are refunded when processing fails."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Image processed",
                    content = @Content(schema = @Schema(implementation = ProcessImageResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "402", description = "Insufficient credits",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Model not available for the user's plan",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Unknown model",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Image rejected by safety filters",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Batch limit reached or backend rate limited",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Backend failed or returned no output",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "504", description = "Backend timed out",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/process")
    public ResponseEntity<ProcessImageResponse> process(
            @RequestBody @Valid ProcessImageRequest request,
            Principal principal) {
        UUID userId = AuthenticatedUsers.resolveUserId(principal);
        return ResponseEntity.ok(ProcessImageResponse.from(imageProcessingService.process(userId, request)));
    }

    @Operation(summary = "Get batch usage", description = "Jobs started in the current window and the plan limit")
    @ApiResponse(responseCode = "200", description = "Usage retrieved",
            content = @Content(schema = @Schema(implementation = BatchUsageDto.class)))
    @GetMapping("/batch-usage")
    public ResponseEntity<BatchUsageDto> getBatchUsage(Principal principal) {
        UUID userId = AuthenticatedUsers.resolveUserId(principal);
        return ResponseEntity.ok()
                .header("Cache-Control", "private, no-store")
                .body(BatchUsageDto.from(imageProcessingService.getBatchUsage(userId)));
    }
}
