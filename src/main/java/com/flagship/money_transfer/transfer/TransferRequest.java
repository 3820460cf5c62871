package com.flagship.money_transfer.transfer;

import lombok.Value;

/**
 * Request to move {@code amount} currency units from one account to another.
 *
 * Invariants (checked by {@link MoneyTransferService} before any write):
 * - amount is positive
 * - source and destination are different accounts
 */
@Value(staticConstructor = "of")
public class TransferRequest {
    Long fromAccountId;
    Long toAccountId;
    long amount;
}
