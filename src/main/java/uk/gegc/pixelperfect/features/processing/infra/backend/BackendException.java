package uk.gegc.pixelperfect.features.processing.infra.backend;

/**
 * Failure reported by a backend in its response body rather than as a transport error.
 */
public class BackendException extends RuntimeException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
