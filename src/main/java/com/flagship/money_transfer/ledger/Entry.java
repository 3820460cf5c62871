package com.flagship.money_transfer.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Domain model for a Ledger Entry.
 * Represents a single change to one account's balance.
 *
 * Negative amount = money leaving the account (debit),
 * positive amount = money entering it (credit).
 * Entries are immutable once written.
 */
@Value
public class Entry {
    long id;
    long accountId;
    long amount;
    Instant createdAt;

    public boolean isDebit() {
        return amount < 0;
    }
}
