package uk.gegc.pixelperfect.features.billing.domain.model;

public enum CreditTransactionType {
    PURCHASE,
    SUBSCRIPTION,
    USAGE,
    REFUND
}
