package com.flagship.money_transfer.ledger;

import com.flagship.money_transfer.store.JdbcQueries;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the ledger: entries and transfers as they were written.
 */
@Service
@RequiredArgsConstructor
public class LedgerService {

    private static final int MAX_PAGE_SIZE = 1000;

    private final JdbcQueries queries;

    public List<Entry> getEntries(long accountId, int limit, int offset) {
        validatePage(limit, offset);
        return queries.listEntries(accountId, limit, offset);
    }

    public Optional<Entry> getEntry(long entryId) {
        return queries.getEntry(entryId);
    }

    /**
     * Transfers sent by {@code fromAccountId} or received by {@code toAccountId}.
     */
    public List<Transfer> getTransfers(long fromAccountId, long toAccountId, int limit, int offset) {
        validatePage(limit, offset);
        return queries.listTransfers(fromAccountId, toAccountId, limit, offset);
    }

    public Optional<Transfer> getTransfer(long transferId) {
        return queries.getTransfer(transferId);
    }

    private void validatePage(int limit, int offset) {
        if (limit <= 0 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_PAGE_SIZE + ": " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative: " + offset);
        }
    }
}
