package com.flagship.money_transfer.transfer;

/**
 * Global order in which a transfer locks its two account rows.
 *
 * Two transfers over the same pair of accounts, in either direction, always
 * lock the lower id first. Neither can then hold one row while waiting for
 * the other's, which is the only way they could deadlock.
 */
public final class AccountLockOrder {

    private AccountLockOrder() {
    }

    /**
     * @return true if the source account's balance must be updated before the destination's
     */
    public static boolean lockSourceFirst(long fromAccountId, long toAccountId) {
        return fromAccountId < toAccountId;
    }
}
