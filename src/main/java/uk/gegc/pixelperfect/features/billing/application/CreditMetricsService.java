package uk.gegc.pixelperfect.features.billing.application;

/**
 * Ledger and dispatch counters.
 */
public interface CreditMetricsService {

    void incrementCreditsDebited(long amount, String backendId);

    void incrementCreditsRefunded(long amount, String backendId);

    void incrementInsufficientCredits();

    void incrementRefundFailed();

    void incrementJobCompleted(String backendId);

    void incrementJobFailed(String backendId, String errorCode);

    void recordBackendLatency(String backendId, long latencyMs);
}
