package com.flagship.money_transfer.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Record of money moved from one account to another.
 * Amount is always positive; direction is given by the account ids.
 */
@Value
public class Transfer {
    long id;
    long fromAccountId;
    long toAccountId;
    long amount;
    Instant createdAt;
}
