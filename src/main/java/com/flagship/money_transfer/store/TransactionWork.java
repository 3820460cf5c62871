package com.flagship.money_transfer.store;

/**
 * A unit of work run by {@link TransactionExecutor}.
 *
 * The queries handed in are bound to the executor's transaction and must not
 * be kept or passed to another thread. Throwing from {@link #execute} rolls the
 * transaction back; returning normally commits it.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(QueryHandle queries);
}
