package uk.gegc.pixelperfect.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.pixelperfect.features.billing.application.AccountSnapshot;
import uk.gegc.pixelperfect.features.model.domain.model.SubscriptionTier;

import java.util.UUID;

@Schema(name = "BalanceDto", description = "Credit balance split by pool")
public record BalanceDto(
        UUID userId,
        SubscriptionTier tier,
        @Schema(description = "Credits granted by the subscription, spent first") long subscriptionCredits,
        @Schema(description = "Credits bought as packs") long purchasedCredits,
        long totalCredits
) {

    public static BalanceDto from(AccountSnapshot account) {
        return new BalanceDto(
                account.userId(),
                account.tier(),
                account.subscriptionCredits(),
                account.purchasedCredits(),
                account.totalCredits()
        );
    }
}
