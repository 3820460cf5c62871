package com.flagship.money_transfer.exception;

/**
 * The transaction ran past its deadline and was rolled back.
 */
public class TransactionTimeoutException extends LedgerException {

    public TransactionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
