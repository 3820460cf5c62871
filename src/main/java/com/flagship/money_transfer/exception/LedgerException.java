package com.flagship.money_transfer.exception;

/**
 * Base type for every failure the transfer layer reports to its callers.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the caller may safely re-issue the whole operation.
     * Nothing in this layer retries on its own.
     */
    public boolean isRetryable() {
        return false;
    }
}
