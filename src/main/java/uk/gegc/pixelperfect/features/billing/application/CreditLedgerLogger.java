package uk.gegc.pixelperfect.features.billing.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging for ledger writes. Fields are exposed through MDC for the duration of one log call.
 */
public final class CreditLedgerLogger {

    private CreditLedgerLogger() {
    }

    public static void logLedgerWrite(Logger logger, String level, String message,
                                      UUID userId, String txType, long amount, String jobId,
                                      long balanceAfter, Object... args) {
        MDC.put("credits.userId", userId != null ? userId.toString() : null);
        MDC.put("credits.txType", txType);
        MDC.put("credits.amount", String.valueOf(amount));
        MDC.put("credits.jobId", jobId);
        MDC.put("credits.balanceAfter", String.valueOf(balanceAfter));
        try {
            log(logger, level, message, args);
        } finally {
            clearCreditMDC();
        }
    }

    public static void logLedgerFailure(Logger logger, String message, UUID userId, String txType,
                                        long amount, String jobId, Object... args) {
        MDC.put("credits.userId", userId != null ? userId.toString() : null);
        MDC.put("credits.txType", txType);
        MDC.put("credits.amount", String.valueOf(amount));
        MDC.put("credits.jobId", jobId);
        try {
            logger.error(message, args);
        } finally {
            clearCreditMDC();
        }
    }

    private static void log(Logger logger, String level, String message, Object... args) {
        switch (level.toLowerCase()) {
            case "warn" -> logger.warn(message, args);
            case "error" -> logger.error(message, args);
            case "debug" -> logger.debug(message, args);
            default -> logger.info(message, args);
        }
    }

    public static void clearCreditMDC() {
        MDC.remove("credits.userId");
        MDC.remove("credits.txType");
        MDC.remove("credits.amount");
        MDC.remove("credits.jobId");
        MDC.remove("credits.balanceAfter");
    }
}
