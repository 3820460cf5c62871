package com.flagship.money_transfer.config;

import com.flagship.money_transfer.store.JdbcQueries;
import com.flagship.money_transfer.store.TransactionExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Isolation;

import java.time.Duration;

/**
 * Transaction defaults for the transfer layer.
 *
 * - money-transfer.transaction.default-isolation: isolation used when a call
 *   does not ask for one. DEFAULT leaves it to the database (READ COMMITTED
 *   on PostgreSQL); balance updates are then protected by row locks.
 * - money-transfer.transaction.default-timeout-seconds: deadline for calls
 *   that do not set one; -1 disables it.
 */
@Configuration
public class TransactionConfig {

    @Bean
    public TransactionExecutor transactionExecutor(
            PlatformTransactionManager transactionManager,
            JdbcQueries queries,
            @Value("${money-transfer.transaction.default-isolation:DEFAULT}") Isolation defaultIsolation,
            @Value("${money-transfer.transaction.default-timeout-seconds:-1}") int defaultTimeoutSeconds) {
        Duration defaultTimeout = defaultTimeoutSeconds > 0 ? Duration.ofSeconds(defaultTimeoutSeconds) : null;
        return new TransactionExecutor(transactionManager, queries, defaultIsolation, defaultTimeout);
    }
}
