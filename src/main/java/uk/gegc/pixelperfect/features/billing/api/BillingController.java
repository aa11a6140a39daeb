package uk.gegc.pixelperfect.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.pixelperfect.features.billing.api.dto.BalanceDto;
import uk.gegc.pixelperfect.features.billing.application.CreditLedgerClient;
import uk.gegc.pixelperfect.shared.security.AuthenticatedUsers;

import java.security.Principal;

@RestController
@RequestMapping("/api/v1/billing")
@RequiredArgsConstructor
@Tag(name = "Credits", description = "Credit balance")
public class BillingController {

    private final CreditLedgerClient ledgerClient;

    @Operation(summary = "Get credit balance", description = "Returns the authenticated user's balance per pool.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Balance retrieved",
                    content = @Content(schema = @Schema(implementation = BalanceDto.class))),
            @ApiResponse(responseCode = "401", description = "No authenticated user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/balance")
    public ResponseEntity<BalanceDto> getBalance(Principal principal) {
        BalanceDto balance = BalanceDto.from(ledgerClient.getAccount(AuthenticatedUsers.resolveUserId(principal)));
        return ResponseEntity.ok()
                .header("Cache-Control", "private, max-age=30")
                .body(balance);
    }
}
