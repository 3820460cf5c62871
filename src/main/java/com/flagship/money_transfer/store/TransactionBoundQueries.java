package com.flagship.money_transfer.store;

import com.flagship.money_transfer.ledger.Account;
import com.flagship.money_transfer.ledger.CurrencyCode;
import com.flagship.money_transfer.ledger.Entry;
import com.flagship.money_transfer.ledger.Transfer;

import java.util.List;
import java.util.Optional;

/**
 * Query handle scoped to one transaction.
 *
 * Spring binds the transaction's connection to the thread that began it, so a
 * statement issued from any other thread, or after the transaction ended,
 * would silently run outside of it. This handle refuses both.
 */
final class TransactionBoundQueries implements QueryHandle {

    private final QueryHandle delegate;
    private final Thread ownerThread;
    private volatile boolean released;

    TransactionBoundQueries(QueryHandle delegate) {
        this.delegate = delegate;
        this.ownerThread = Thread.currentThread();
    }

    void release() {
        released = true;
    }

    private QueryHandle queries() {
        if (released) {
            throw new IllegalStateException("Transaction has already completed; its query handle is no longer usable");
        }
        if (Thread.currentThread() != ownerThread) {
            throw new IllegalStateException(
                "Query handle is bound to the transaction of thread " + ownerThread.getName()
                    + " and cannot be used from " + Thread.currentThread().getName());
        }
        return delegate;
    }

    @Override
    public Account createAccount(String owner, long balance, CurrencyCode currency) {
        return queries().createAccount(owner, balance, currency);
    }

    @Override
    public Account getAccount(long accountId) {
        return queries().getAccount(accountId);
    }

    @Override
    public Account getAccountForUpdate(long accountId) {
        return queries().getAccountForUpdate(accountId);
    }

    @Override
    public Account updateAccount(long accountId, long newBalance) {
        return queries().updateAccount(accountId, newBalance);
    }

    @Override
    public Entry createEntry(long accountId, long amount) {
        return queries().createEntry(accountId, amount);
    }

    @Override
    public Optional<Entry> getEntry(long entryId) {
        return queries().getEntry(entryId);
    }

    @Override
    public List<Entry> listEntries(long accountId, int limit, int offset) {
        return queries().listEntries(accountId, limit, offset);
    }

    @Override
    public Transfer createTransfer(long fromAccountId, long toAccountId, long amount) {
        return queries().createTransfer(fromAccountId, toAccountId, amount);
    }

    @Override
    public Optional<Transfer> getTransfer(long transferId) {
        return queries().getTransfer(transferId);
    }

    @Override
    public List<Transfer> listTransfers(long fromAccountId, long toAccountId, int limit, int offset) {
        return queries().listTransfers(fromAccountId, toAccountId, limit, offset);
    }
}
