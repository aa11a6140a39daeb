package uk.gegc.pixelperfect.features.model.domain.model;

/**
 * Transport family of a backend. Also determines the job id prefix.
 */
public enum ProviderKind {
    REPLICATE("rep"),
    GEMINI("gem");

    private final String jobIdPrefix;

    ProviderKind(String jobIdPrefix) {
        this.jobIdPrefix = jobIdPrefix;
    }

    public String getJobIdPrefix() {
        return jobIdPrefix;
    }
}
