package com.flagship.money_transfer.transfer;

import com.flagship.money_transfer.exception.AccountNotFoundException;
import com.flagship.money_transfer.exception.InvalidTransferException;
import com.flagship.money_transfer.exception.LedgerException;
import com.flagship.money_transfer.exception.TransactionCommitException;
import com.flagship.money_transfer.exception.TransactionConflictException;
import com.flagship.money_transfer.exception.TransactionRollbackException;
import com.flagship.money_transfer.exception.TransactionTimeoutException;
import com.flagship.money_transfer.ledger.Account;
import com.flagship.money_transfer.ledger.Entry;
import com.flagship.money_transfer.ledger.Transfer;
import com.flagship.money_transfer.observability.TransferMetrics;
import com.flagship.money_transfer.store.QueryHandle;
import com.flagship.money_transfer.store.TransactionExecutor;
import com.flagship.money_transfer.store.TransactionOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Moves money between two accounts in a single database transaction.
 *
 * One transfer writes, in this order:
 * 1. A transfer record
 * 2. A debit entry for the source account
 * 3. A credit entry for the destination account
 * 4. Both account balances, lower account id first
 *
 * Either all of it commits or none of it does. Balance updates read the
 * account with a row lock, so concurrent transfers touching the same account
 * queue up instead of losing updates, and the fixed lock order keeps
 * opposite-direction transfers from deadlocking.
 *
 * Conflicts reported by the store ({@link TransactionConflictException}) are
 * never retried here; callers re-issue the whole transfer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MoneyTransferService {

    private final TransactionExecutor transactionExecutor;
    private final TransferMetrics transferMetrics;

    public TransferResult transferMoney(TransferRequest request) {
        return transferMoney(request, TransactionOptions.defaults());
    }

    /**
     * Performs a transfer.
     *
     * @param request the accounts and amount
     * @param options isolation override, deadline and diagnostic label for this call
     * @return the transfer, both entries and both updated accounts
     * @throws InvalidTransferException if the request is malformed; nothing is written
     * @throws AccountNotFoundException if either account does not exist
     * @throws TransactionConflictException if the store aborted the transaction; safe to retry
     * @throws TransactionTimeoutException if the deadline passed; rolled back
     * @throws TransactionRollbackException if the transfer failed and so did its rollback
     * @throws TransactionCommitException if commit failed; outcome unknown
     */
    public TransferResult transferMoney(TransferRequest request, TransactionOptions options) {
        long startTime = System.currentTimeMillis();
        try {
            validate(request);

            TransferResult result = transactionExecutor.execute(options,
                    queries -> transferInTransaction(queries, request));

            long duration = System.currentTimeMillis() - startTime;
            transferMetrics.recordTransfer(TransferMetrics.OUTCOME_SUCCESS, duration);
            transferMetrics.recordAmount(request.getAmount());
            log.info("Transfer completed: transferId={}, from={}, to={}, amount={}, duration={}ms",
                    result.getTransfer().getId(), request.getFromAccountId(), request.getToAccountId(),
                    request.getAmount(), duration);
            return result;

        } catch (LedgerException e) {
            long duration = System.currentTimeMillis() - startTime;
            transferMetrics.recordTransfer(outcomeOf(e), duration);
            log.warn("Transfer failed: request={}, error={}, retryable={}, duration={}ms",
                    request, e.getMessage(), e.isRetryable(), duration);
            throw e;
        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            transferMetrics.recordTransfer(TransferMetrics.OUTCOME_ERROR, duration);
            log.error("Transfer failed unexpectedly: request={}, duration={}ms", request, duration, e);
            throw e;
        }
    }

    private TransferResult transferInTransaction(QueryHandle queries, TransferRequest request) {
        long fromId = request.getFromAccountId();
        long toId = request.getToAccountId();
        long amount = request.getAmount();

        log.debug("create transfer");
        Transfer transfer = queries.createTransfer(fromId, toId, amount);

        log.debug("create entry 1");
        Entry fromEntry = queries.createEntry(fromId, -amount);

        log.debug("create entry 2");
        Entry toEntry = queries.createEntry(toId, amount);

        Account fromAccount;
        Account toAccount;
        if (AccountLockOrder.lockSourceFirst(fromId, toId)) {
            fromAccount = addToBalance(queries, fromId, -amount);
            toAccount = addToBalance(queries, toId, amount);
        } else {
            toAccount = addToBalance(queries, toId, amount);
            fromAccount = addToBalance(queries, fromId, -amount);
        }

        return TransferResult.builder()
                .transfer(transfer)
                .fromEntry(fromEntry)
                .toEntry(toEntry)
                .fromAccount(fromAccount)
                .toAccount(toAccount)
                .build();
    }

    private Account addToBalance(QueryHandle queries, long accountId, long delta) {
        log.debug("get account {}", accountId);
        Account current = queries.getAccountForUpdate(accountId);

        long newBalance;
        try {
            newBalance = Math.addExact(current.getBalance(), delta);
        } catch (ArithmeticException e) {
            throw new InvalidTransferException(
                    String.format("Balance of account %d would overflow: balance=%d, change=%d",
                            accountId, current.getBalance(), delta));
        }

        log.debug("update account {}", accountId);
        return queries.updateAccount(accountId, newBalance);
    }

    private void validate(TransferRequest request) {
        if (request == null) {
            throw new InvalidTransferException("Transfer request is required");
        }
        if (request.getFromAccountId() == null || request.getToAccountId() == null) {
            throw new InvalidTransferException("Source and destination account IDs are required");
        }
        if (request.getAmount() <= 0) {
            throw new InvalidTransferException("Transfer amount must be positive: " + request.getAmount());
        }
        if (request.getFromAccountId().equals(request.getToAccountId())) {
            throw new InvalidTransferException(
                    "Source and destination accounts must be different: " + request.getFromAccountId());
        }
    }

    private static String outcomeOf(LedgerException e) {
        if (e instanceof InvalidTransferException) {
            return TransferMetrics.OUTCOME_INVALID;
        }
        if (e instanceof AccountNotFoundException) {
            return TransferMetrics.OUTCOME_NOT_FOUND;
        }
        if (e instanceof TransactionConflictException) {
            return TransferMetrics.OUTCOME_CONFLICT;
        }
        if (e instanceof TransactionTimeoutException) {
            return TransferMetrics.OUTCOME_TIMEOUT;
        }
        if (e instanceof TransactionRollbackException) {
            return TransferMetrics.OUTCOME_ROLLBACK_FAILED;
        }
        if (e instanceof TransactionCommitException) {
            return TransferMetrics.OUTCOME_COMMIT_FAILED;
        }
        return TransferMetrics.OUTCOME_ERROR;
    }
}
