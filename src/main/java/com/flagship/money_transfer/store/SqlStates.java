package com.flagship.money_transfer.store;

import java.sql.SQLException;
import java.util.Optional;

/**
 * PostgreSQL SQLSTATE codes the store reacts to.
 */
final class SqlStates {

    static final String FOREIGN_KEY_VIOLATION = "23503";
    static final String SERIALIZATION_FAILURE = "40001";
    static final String DEADLOCK_DETECTED = "40P01";
    static final String QUERY_CANCELED = "57014";

    private SqlStates() {
    }

    /**
     * Finds the first SQLSTATE in the cause chain of a (usually translated) exception.
     */
    static Optional<String> of(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return Optional.of(sqlException.getSQLState());
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return Optional.empty();
    }

    static boolean is(Throwable ex, String sqlState) {
        return of(ex).map(sqlState::equals).orElse(false);
    }
}
