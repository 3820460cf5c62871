package com.flagship.money_transfer.store;

import com.flagship.money_transfer.exception.LedgerException;
import com.flagship.money_transfer.exception.TransactionCommitException;
import com.flagship.money_transfer.exception.TransactionConflictException;
import com.flagship.money_transfer.exception.TransactionRollbackException;
import com.flagship.money_transfer.exception.TransactionTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs a unit of work inside its own database transaction.
 *
 * For every call this executor:
 * 1. Begins a new transaction (never joins one already bound to the thread)
 * 2. Hands the work a query handle bound to that transaction
 * 3. Commits if the work returns, rolls back if it throws
 *
 * Failure reporting:
 * - Rollback succeeded: the work's failure is rethrown (translated to
 *   {@link TransactionConflictException} or {@link TransactionTimeoutException}
 *   where the store signalled one)
 * - Rollback failed too: {@link TransactionRollbackException} carrying both
 * - Commit failed: {@link TransactionCommitException}, outcome unknown
 *
 * The executor holds no per-call state and is safe to share between threads.
 * Each call owns its connection for the whole transaction.
 */
@Slf4j
public class TransactionExecutor {

    public static final String TX_LABEL_MDC_KEY = "txLabel";

    private final PlatformTransactionManager transactionManager;
    private final QueryHandle queries;
    private final Isolation defaultIsolation;
    private final Duration defaultTimeout;

    public TransactionExecutor(PlatformTransactionManager transactionManager, QueryHandle queries) {
        this(transactionManager, queries, Isolation.DEFAULT, null);
    }

    /**
     * @param defaultTimeout deadline applied when the options carry none; null for no deadline
     */
    public TransactionExecutor(PlatformTransactionManager transactionManager, QueryHandle queries,
                               Isolation defaultIsolation, Duration defaultTimeout) {
        this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager must not be null");
        this.queries = Objects.requireNonNull(queries, "queries must not be null");
        this.defaultIsolation = Objects.requireNonNull(defaultIsolation, "defaultIsolation must not be null");
        this.defaultTimeout = defaultTimeout;
    }

    public <T> T execute(TransactionWork<T> work) {
        return execute(TransactionOptions.defaults(), work);
    }

    public <T> T execute(TransactionOptions options, TransactionWork<T> work) {
        Objects.requireNonNull(work, "work must not be null");
        TransactionOptions effective = options != null ? options : TransactionOptions.defaults();

        String label = effective.getLabel();
        String outerLabel = MDC.get(TX_LABEL_MDC_KEY);
        if (label != null) {
            MDC.put(TX_LABEL_MDC_KEY, label);
        }
        try {
            return executeInTransaction(definitionFor(effective), work);
        } finally {
            if (label != null) {
                restoreLabel(outerLabel);
            }
        }
    }

    private static void restoreLabel(String outerLabel) {
        if (outerLabel != null) {
            MDC.put(TX_LABEL_MDC_KEY, outerLabel);
        } else {
            MDC.remove(TX_LABEL_MDC_KEY);
        }
    }

    private <T> T executeInTransaction(TransactionDefinition definition, TransactionWork<T> work) {
        log.debug("Beginning transaction: isolation={}, timeout={}s",
                isolationName(definition.getIsolationLevel()), definition.getTimeout());
        TransactionStatus status = transactionManager.getTransaction(definition);

        TransactionBoundQueries boundQueries = new TransactionBoundQueries(queries);
        T result;
        try {
            result = work.execute(boundQueries);
        } catch (RuntimeException e) {
            RuntimeException failure = translate(e);
            rollback(status, failure);
            throw failure;
        } catch (Error e) {
            rollback(status, e);
            throw e;
        } finally {
            boundQueries.release();
        }

        commit(status);
        return result;
    }

    private void rollback(TransactionStatus status, Throwable failure) {
        try {
            transactionManager.rollback(status);
            log.debug("Transaction rolled back: {}", failure.getMessage());
        } catch (RuntimeException rollbackFailure) {
            log.error("Rollback failed after transaction error: error={}, rollbackError={}",
                    failure.getMessage(), rollbackFailure.getMessage());
            throw new TransactionRollbackException(failure, rollbackFailure);
        }
    }

    private void commit(TransactionStatus status) {
        try {
            transactionManager.commit(status);
            log.debug("Transaction committed");
        } catch (RuntimeException e) {
            RuntimeException translated = translate(e);
            if (translated != e) {
                // The store refused the commit and rolled back; nothing was written.
                throw translated;
            }
            log.error("Commit failed, transaction outcome is unknown: {}", e.getMessage());
            throw new TransactionCommitException("Commit failed: " + e.getMessage(), e);
        }
    }

    private RuntimeException translate(RuntimeException e) {
        if (e instanceof LedgerException) {
            return e;
        }
        if (e instanceof TransactionTimedOutException
                || e instanceof QueryTimeoutException
                || SqlStates.is(e, SqlStates.QUERY_CANCELED)) {
            return new TransactionTimeoutException("Transaction deadline exceeded: " + e.getMessage(), e);
        }
        if (e instanceof ConcurrencyFailureException
                || SqlStates.is(e, SqlStates.SERIALIZATION_FAILURE)
                || SqlStates.is(e, SqlStates.DEADLOCK_DETECTED)) {
            return new TransactionConflictException(
                    "Transaction aborted by a concurrent conflict, retry the operation: " + e.getMessage(), e);
        }
        return e;
    }

    private TransactionDefinition definitionFor(TransactionOptions options) {
        DefaultTransactionDefinition definition =
                new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        Isolation isolation = options.getIsolation() != null ? options.getIsolation() : defaultIsolation;
        definition.setIsolationLevel(isolation.value());

        Duration timeout = options.getTimeout() != null ? options.getTimeout() : defaultTimeout;
        if (timeout != null) {
            definition.setTimeout(toTimeoutSeconds(timeout));
        }
        if (options.getLabel() != null) {
            definition.setName(options.getLabel());
        }
        return definition;
    }

    // Spring transaction timeouts have whole-second resolution; round up so a
    // sub-second deadline still gets one.
    private static int toTimeoutSeconds(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Transaction timeout must be positive: " + timeout);
        }
        long seconds = (timeout.toMillis() + 999) / 1000;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
    }

    private static String isolationName(int level) {
        for (Isolation isolation : Isolation.values()) {
            if (isolation.value() == level) {
                return isolation.name();
            }
        }
        return String.valueOf(level);
    }
}
