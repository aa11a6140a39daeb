package uk.gegc.pixelperfect.features.processing.domain.model;

import uk.gegc.pixelperfect.features.processing.domain.exception.ProcessingException;

/**
 * Result of a dispatch: either a {@link CanonicalResult} or a {@link ProcessingException}, never both.
 */
public final class ProcessingOutcome {

    private final CanonicalResult result;
    private final ProcessingException error;
    private final ProcessingJob job;

    private ProcessingOutcome(CanonicalResult result, ProcessingException error, ProcessingJob job) {
        this.result = result;
        this.error = error;
        this.job = job;
    }

    public static ProcessingOutcome success(CanonicalResult result, ProcessingJob job) {
        return new ProcessingOutcome(result, null, job);
    }

    public static ProcessingOutcome failure(ProcessingException error, ProcessingJob job) {
        return new ProcessingOutcome(null, error, job);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public CanonicalResult result() {
        if (result == null) {
            throw new IllegalStateException("Outcome is a failure: " + error.getCode());
        }
        return result;
    }

    public ProcessingException error() {
        if (error == null) {
            throw new IllegalStateException("Outcome is a success");
        }
        return error;
    }

    public ProcessingJob job() {
        return job;
    }

    public CanonicalResult orElseThrow() {
        if (error != null) {
            throw error;
        }
        return result;
    }
}
