package com.flagship.money_transfer.exception;

public class AccountNotFoundException extends LedgerException {

    public AccountNotFoundException(long accountId) {
        super("Account not found: " + accountId);
    }

    public AccountNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
