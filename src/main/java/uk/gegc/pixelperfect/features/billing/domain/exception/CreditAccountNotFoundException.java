package uk.gegc.pixelperfect.features.billing.domain.exception;

import java.util.UUID;

public class CreditAccountNotFoundException extends RuntimeException {

    public CreditAccountNotFoundException(UUID userId) {
        super("No credit account for user " + userId);
    }
}
