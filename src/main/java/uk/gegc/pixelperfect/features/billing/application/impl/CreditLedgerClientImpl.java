package uk.gegc.pixelperfect.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.pixelperfect.features.billing.application.AccountSnapshot;
import uk.gegc.pixelperfect.features.billing.application.CreditLedgerClient;
import uk.gegc.pixelperfect.features.billing.application.CreditLedgerLogger;
import uk.gegc.pixelperfect.features.billing.application.CreditMetricsService;
import uk.gegc.pixelperfect.features.billing.application.CreditStore;
import uk.gegc.pixelperfect.features.billing.application.DebitResult;
import uk.gegc.pixelperfect.features.billing.domain.exception.CreditLedgerException;
import uk.gegc.pixelperfect.features.billing.domain.exception.InsufficientCreditsException;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class CreditLedgerClientImpl implements CreditLedgerClient {

    private final CreditStore creditStore;
    private final CreditMetricsService metricsService;

    @Override
    public DebitResult debit(UUID userId, long amount, String jobId, String description) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        try {
            DebitResult result = creditStore.debit(userId, amount, jobId, description);
            CreditLedgerLogger.logLedgerWrite(log, result.replayed() ? "warn" : "info",
                    result.replayed()
                            ? "Debit for job {} already recorded; balance unchanged"
                            : "Debited credits for job {}",
                    userId, "USAGE", amount, jobId, result.newBalance(), jobId);
            return result;
        } catch (InsufficientCreditsException ex) {
            metricsService.incrementInsufficientCredits();
            log.info("Debit rejected for job {}: required={} available={}",
                    jobId, ex.getRequiredCredits(), ex.getAvailableCredits());
            throw ex;
        } catch (RuntimeException ex) {
            CreditLedgerLogger.logLedgerFailure(log, "Debit failed for job {}: {}",
                    userId, "USAGE", amount, jobId, jobId, ex.getMessage());
            throw new CreditLedgerException("Failed to debit credits for job " + jobId, ex);
        }
    }

    @Override
    public long refund(UUID userId, long amount, String jobId) {
        try {
            long balance = creditStore.credit(userId, amount, jobId);
            CreditLedgerLogger.logLedgerWrite(log, "info", "Refunded credits for job {}",
                    userId, "REFUND", amount, jobId, balance, jobId);
            return balance;
        } catch (RuntimeException ex) {
            throw new CreditLedgerException("Failed to refund credits for job " + jobId, ex);
        }
    }

    @Override
    public AccountSnapshot getAccount(UUID userId) {
        try {
            return creditStore.getAccount(userId);
        } catch (RuntimeException ex) {
            throw new CreditLedgerException("Failed to load credit account for user " + userId, ex);
        }
    }
}
