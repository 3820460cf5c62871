package com.flagship.money_transfer.store;

import com.flagship.money_transfer.exception.AccountNotFoundException;
import com.flagship.money_transfer.ledger.Account;
import com.flagship.money_transfer.ledger.CurrencyCode;
import com.flagship.money_transfer.ledger.Entry;
import com.flagship.money_transfer.ledger.Transfer;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of the ledger queries.
 *
 * Statements go through {@link JdbcTemplate}, so they join whatever Spring
 * transaction is bound to the calling thread and auto-commit otherwise.
 * No JPA: every statement is plain SQL against the schema in schema.sql.
 */
@Component
@RequiredArgsConstructor
public class JdbcQueries implements QueryHandle {

    private static final String ACCOUNT_COLUMNS = "id, owner, balance, currency, created_at";
    private static final String ENTRY_COLUMNS = "id, account_id, amount, created_at";
    private static final String TRANSFER_COLUMNS = "id, from_account_id, to_account_id, amount, created_at";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Account createAccount(String owner, long balance, CurrencyCode currency) {
        return jdbcTemplate.queryForObject(
            "INSERT INTO accounts (owner, balance, currency) VALUES (?, ?, ?) RETURNING " + ACCOUNT_COLUMNS,
            accountRowMapper(),
            owner,
            balance,
            currency.name()
        );
    }

    @Override
    public Account getAccount(long accountId) {
        return jdbcTemplate.query(
                "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE id = ? LIMIT 1",
                accountRowMapper(),
                accountId
            ).stream()
            .findFirst()
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Override
    public Account getAccountForUpdate(long accountId) {
        // NO KEY UPDATE: inserts into entries/transfers only need a KEY SHARE lock
        // on the referenced account, so they are not blocked by this one.
        return jdbcTemplate.query(
                "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE id = ? LIMIT 1 FOR NO KEY UPDATE",
                accountRowMapper(),
                accountId
            ).stream()
            .findFirst()
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Override
    public Account updateAccount(long accountId, long newBalance) {
        return jdbcTemplate.query(
                "UPDATE accounts SET balance = ? WHERE id = ? RETURNING " + ACCOUNT_COLUMNS,
                accountRowMapper(),
                newBalance,
                accountId
            ).stream()
            .findFirst()
            .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Override
    public Entry createEntry(long accountId, long amount) {
        try {
            return jdbcTemplate.queryForObject(
                "INSERT INTO entries (account_id, amount) VALUES (?, ?) RETURNING " + ENTRY_COLUMNS,
                entryRowMapper(),
                accountId,
                amount
            );
        } catch (DataIntegrityViolationException e) {
            if (SqlStates.is(e, SqlStates.FOREIGN_KEY_VIOLATION)) {
                throw new AccountNotFoundException("Account not found: " + accountId, e);
            }
            throw e;
        }
    }

    @Override
    public Optional<Entry> getEntry(long entryId) {
        return jdbcTemplate.query(
                "SELECT " + ENTRY_COLUMNS + " FROM entries WHERE id = ? LIMIT 1",
                entryRowMapper(),
                entryId
            ).stream()
            .findFirst();
    }

    @Override
    public List<Entry> listEntries(long accountId, int limit, int offset) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM entries WHERE account_id = ? ORDER BY id LIMIT ? OFFSET ?",
            entryRowMapper(),
            accountId,
            limit,
            offset
        );
    }

    @Override
    public Transfer createTransfer(long fromAccountId, long toAccountId, long amount) {
        try {
            return jdbcTemplate.queryForObject(
                "INSERT INTO transfers (from_account_id, to_account_id, amount) VALUES (?, ?, ?) " +
                "RETURNING " + TRANSFER_COLUMNS,
                transferRowMapper(),
                fromAccountId,
                toAccountId,
                amount
            );
        } catch (DataIntegrityViolationException e) {
            if (SqlStates.is(e, SqlStates.FOREIGN_KEY_VIOLATION)) {
                throw new AccountNotFoundException(
                    String.format("Account not found: %d or %d", fromAccountId, toAccountId), e);
            }
            throw e;
        }
    }

    @Override
    public Optional<Transfer> getTransfer(long transferId) {
        return jdbcTemplate.query(
                "SELECT " + TRANSFER_COLUMNS + " FROM transfers WHERE id = ? LIMIT 1",
                transferRowMapper(),
                transferId
            ).stream()
            .findFirst();
    }

    @Override
    public List<Transfer> listTransfers(long fromAccountId, long toAccountId, int limit, int offset) {
        return jdbcTemplate.query(
            "SELECT " + TRANSFER_COLUMNS + " FROM transfers " +
            "WHERE from_account_id = ? OR to_account_id = ? ORDER BY id LIMIT ? OFFSET ?",
            transferRowMapper(),
            fromAccountId,
            toAccountId,
            limit,
            offset
        );
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getLong("id"),
            rs.getString("owner"),
            rs.getLong("balance"),
            CurrencyCode.valueOf(rs.getString("currency")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private RowMapper<Entry> entryRowMapper() {
        return (rs, rowNum) -> new Entry(
            rs.getLong("id"),
            rs.getLong("account_id"),
            rs.getLong("amount"),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private RowMapper<Transfer> transferRowMapper() {
        return (rs, rowNum) -> new Transfer(
            rs.getLong("id"),
            rs.getLong("from_account_id"),
            rs.getLong("to_account_id"),
            rs.getLong("amount"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
