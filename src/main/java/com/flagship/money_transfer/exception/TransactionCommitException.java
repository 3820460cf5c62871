package com.flagship.money_transfer.exception;

/**
 * Commit failed for an infrastructure reason. Whether the writes became
 * durable is unknown; callers must treat the operation as failed and
 * reconcile before retrying.
 */
public class TransactionCommitException extends LedgerException {

    public TransactionCommitException(String message, Throwable cause) {
        super(message, cause);
    }
}
