package uk.gegc.pixelperfect.features.model.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Subscription tiers, declared in ascending rank.
 */
public enum SubscriptionTier {
    FREE,
    HOBBY,
    PRO,
    BUSINESS;

    public int rank() {
        return ordinal();
    }

    /**
     * Whether a user on this tier may use something restricted to {@code required}.
     */
    public boolean includes(SubscriptionTier required) {
        return required == null || rank() >= required.rank();
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SubscriptionTier fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FREE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
