package uk.gegc.pixelperfect.features.processing.domain.model;

import lombok.Getter;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * One processing attempt. Lives for the duration of a request and is never persisted.
 * A job that fails before its debit stops in {@link JobState#FAILED}; one that fails after its debit
 * always moves on to {@link JobState#REFUNDED}.
 */
@Getter
public class ProcessingJob {

    private final String jobId;
    private final UUID userId;
    private final BackendDescriptor backend;
    private final long creditCost;
    private JobState state = JobState.CREATED;
    private final List<JobState> history = new ArrayList<>(List.of(JobState.CREATED));

    public ProcessingJob(String jobId, UUID userId, BackendDescriptor backend, long creditCost) {
        this.jobId = jobId;
        this.userId = userId;
        this.backend = backend;
        this.creditCost = creditCost;
    }

    public void transitionTo(JobState next) {
        if (!state.allowedNext().contains(next)) {
            throw new IllegalStateException("Job " + jobId + " cannot move from " + state + " to " + next);
        }
        state = next;
        history.add(next);
    }

    public boolean wasDebited() {
        return history.contains(JobState.DEBITED);
    }

    public List<JobState> getHistory() {
        return Collections.unmodifiableList(history);
    }
}
