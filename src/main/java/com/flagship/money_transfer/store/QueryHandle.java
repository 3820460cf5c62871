package com.flagship.money_transfer.store;

import com.flagship.money_transfer.ledger.Account;
import com.flagship.money_transfer.ledger.CurrencyCode;
import com.flagship.money_transfer.ledger.Entry;
import com.flagship.money_transfer.ledger.Transfer;

import java.util.List;
import java.util.Optional;

/**
 * Single-statement operations on the ledger tables.
 *
 * Each call is one SQL statement. Whether it runs on its own or as part of
 * a larger transaction depends on the implementation handed to the caller:
 * {@link JdbcQueries} auto-commits every statement, while the handle given
 * to a {@link TransactionWork} runs every statement inside that work's
 * transaction.
 */
public interface QueryHandle {

    Account createAccount(String owner, long balance, CurrencyCode currency);

    /**
     * @throws com.flagship.money_transfer.exception.AccountNotFoundException if no such account
     */
    Account getAccount(long accountId);

    /**
     * Reads an account and takes a row-level write lock on it, held until the
     * surrounding transaction ends. Without a transaction the lock is released
     * as soon as the statement completes.
     *
     * @throws com.flagship.money_transfer.exception.AccountNotFoundException if no such account
     */
    Account getAccountForUpdate(long accountId);

    /**
     * Overwrites the balance of an account.
     *
     * @throws com.flagship.money_transfer.exception.AccountNotFoundException if no such account
     */
    Account updateAccount(long accountId, long newBalance);

    /**
     * @throws com.flagship.money_transfer.exception.AccountNotFoundException if the account does not exist
     */
    Entry createEntry(long accountId, long amount);

    Optional<Entry> getEntry(long entryId);

    List<Entry> listEntries(long accountId, int limit, int offset);

    /**
     * @throws com.flagship.money_transfer.exception.AccountNotFoundException if either account does not exist
     */
    Transfer createTransfer(long fromAccountId, long toAccountId, long amount);

    Optional<Transfer> getTransfer(long transferId);

    /**
     * Transfers leaving {@code fromAccountId} or arriving at {@code toAccountId}, oldest first.
     */
    List<Transfer> listTransfers(long fromAccountId, long toAccountId, int limit, int offset);
}
