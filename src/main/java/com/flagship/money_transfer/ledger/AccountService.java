package com.flagship.money_transfer.ledger;

import com.flagship.money_transfer.store.JdbcQueries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for opening and looking up accounts.
 * Single statements, no explicit transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final JdbcQueries queries;

    public Account openAccount(String owner, long initialBalance, CurrencyCode currency) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Account owner is required");
        }
        if (currency == null) {
            throw new IllegalArgumentException("Currency is required");
        }
        if (initialBalance < 0) {
            throw new IllegalArgumentException("Initial balance must not be negative: " + initialBalance);
        }

        Account account = queries.createAccount(owner, initialBalance, currency);
        log.debug("Opened account {} for {} with balance {} {}",
                account.getId(), owner, initialBalance, currency);
        return account;
    }

    /**
     * @throws com.flagship.money_transfer.exception.AccountNotFoundException if no such account
     */
    public Account getAccount(long accountId) {
        return queries.getAccount(accountId);
    }
}
