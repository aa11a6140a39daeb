package uk.gegc.pixelperfect.features.processing.domain.exception;

import uk.gegc.pixelperfect.features.processing.domain.model.ProcessingErrorCode;

/**
 * Canonical processing failure. Every error leaving the dispatch layer has exactly one {@link ProcessingErrorCode}.
 */
public class ProcessingException extends RuntimeException {

    private final ProcessingErrorCode code;

    public ProcessingException(ProcessingErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ProcessingException(ProcessingErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ProcessingErrorCode getCode() {
        return code;
    }

    public static ProcessingException noOutput(String message) {
        return new ProcessingException(ProcessingErrorCode.NO_OUTPUT, message);
    }
}
