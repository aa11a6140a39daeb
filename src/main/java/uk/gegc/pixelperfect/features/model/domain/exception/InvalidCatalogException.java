package uk.gegc.pixelperfect.features.model.domain.exception;

/**
 * Raised when the backend catalog configuration is inconsistent.
 */
public class InvalidCatalogException extends RuntimeException {

    public InvalidCatalogException(String message) {
        super(message);
    }
}
