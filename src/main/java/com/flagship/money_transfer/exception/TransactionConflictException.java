package com.flagship.money_transfer.exception;

/**
 * The store aborted the transaction because of a serialization failure
 * or a deadlock. Nothing was written; the whole operation may be retried.
 */
public class TransactionConflictException extends LedgerException {

    public TransactionConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
