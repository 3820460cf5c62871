package com.flagship.money_transfer.exception;

/**
 * Malformed or illegal transfer request, rejected before any write.
 */
public class InvalidTransferException extends LedgerException {

    public InvalidTransferException(String message) {
        super(message);
    }
}
