package com.flagship.money_transfer.exception;

/**
 * The unit of work failed and the rollback that followed failed too.
 *
 * The original failure is the cause; the rollback failure is available
 * from {@link #getRollbackFailure()} and is also attached as suppressed,
 * so neither shows up without the other in a stack trace.
 */
public class TransactionRollbackException extends LedgerException {

    private final Throwable rollbackFailure;

    public TransactionRollbackException(Throwable originalFailure, Throwable rollbackFailure) {
        super(String.format("Transaction failed: %s; rollback failed: %s",
                originalFailure.getMessage(), rollbackFailure.getMessage()), originalFailure);
        this.rollbackFailure = rollbackFailure;
        addSuppressed(rollbackFailure);
    }

    public Throwable getOriginalFailure() {
        return getCause();
    }

    public Throwable getRollbackFailure() {
        return rollbackFailure;
    }
}
