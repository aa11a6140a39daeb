package uk.gegc.pixelperfect.features.billing.domain.exception;

/**
 * Any ledger failure other than an insufficient balance.
 */
public class CreditLedgerException extends RuntimeException {

    public CreditLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
