package com.flagship.money_transfer.ledger;

/**
 * Currency code enum following ISO-4217 standard.
 *
 * Stored by name in the accounts table, so an unknown code can never be
 * read back into an Account.
 */
public enum CurrencyCode {
    USD, // US Dollar
    EUR, // Euro
    GBP, // British Pound
    INR, // Indian Rupee
    JPY  // Japanese Yen
}
