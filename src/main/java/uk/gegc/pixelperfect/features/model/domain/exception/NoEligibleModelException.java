package uk.gegc.pixelperfect.features.model.domain.exception;

public class NoEligibleModelException extends RuntimeException {

    public NoEligibleModelException(String message) {
        super(message);
    }
}
