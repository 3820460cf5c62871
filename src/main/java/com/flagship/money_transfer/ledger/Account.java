package com.flagship.money_transfer.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Domain model for an Account.
 *
 * Balance is held in signed integer currency units (cents for USD).
 * An Account value is a snapshot: a new instance is returned by every
 * balance update rather than mutating this one.
 */
@Value
public class Account {
    long id;
    String owner;
    long balance;
    CurrencyCode currency;
    Instant createdAt;
}
