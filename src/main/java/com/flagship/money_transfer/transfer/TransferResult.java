package com.flagship.money_transfer.transfer;

import com.flagship.money_transfer.ledger.Account;
import com.flagship.money_transfer.ledger.Entry;
import com.flagship.money_transfer.ledger.Transfer;
import lombok.Builder;
import lombok.Value;

/**
 * Everything written by one committed transfer.
 *
 * Accounts are the state right after their balance update, inside the
 * transfer's transaction.
 */
@Value
@Builder
public class TransferResult {
    Transfer transfer;
    Account fromAccount;
    Account toAccount;
    Entry fromEntry;
    Entry toEntry;
}
