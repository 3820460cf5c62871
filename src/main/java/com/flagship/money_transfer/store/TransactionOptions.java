package com.flagship.money_transfer.store;

import lombok.Builder;
import lombok.Value;
import org.springframework.transaction.annotation.Isolation;

import java.time.Duration;

/**
 * Per-call transaction settings.
 *
 * Any field left null falls back to the executor's configured default.
 * The label is only diagnostic: it names the transaction and is put in the
 * MDC under {@code txLabel} while the transaction runs.
 */
@Value
@Builder
public class TransactionOptions {
    Isolation isolation;
    Duration timeout;
    String label;

    public static TransactionOptions defaults() {
        return TransactionOptions.builder().build();
    }

    public static TransactionOptions labeled(String label) {
        return TransactionOptions.builder().label(label).build();
    }
}
