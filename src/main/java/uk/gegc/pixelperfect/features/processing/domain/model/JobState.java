package uk.gegc.pixelperfect.features.processing.domain.model;

import java.util.EnumSet;
import java.util.Set;

public enum JobState {
    CREATED,
    DEBITED,
    CALLING_BACKEND,
    COMPLETED,
    FAILED,
    REFUNDED;

    public Set<JobState> allowedNext() {
        return switch (this) {
            case CREATED -> EnumSet.of(DEBITED, FAILED);
            case DEBITED -> EnumSet.of(CALLING_BACKEND, FAILED);
            case CALLING_BACKEND -> EnumSet.of(COMPLETED, FAILED);
            case FAILED -> EnumSet.of(REFUNDED);
            case COMPLETED, REFUNDED -> EnumSet.noneOf(JobState.class);
        };
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }
}
