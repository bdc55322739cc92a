package com.ivamare.bulkload.exception;

import org.postgresql.util.PSQLState;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Classifies failures raised by units of work.
 *
 * <p>The pool only distinguishes two kinds: a <em>statement timeout</em>, which
 * policies recover from by escalating the deadline or splitting the range, and
 * everything else, which consumes retry budget. {@link #isTransient},
 * {@link #getTransientReason} and {@link #getSqlState} do not change how a
 * failure is handled; workers and the supervisor put them in failure logs.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    /** query_canceled, reported when {@code statement_timeout} fires. */
    public static final String QUERY_CANCELED = PSQLState.QUERY_CANCELED.getState();

    private static final Set<String> TRANSIENT_SQL_STATE_CLASSES = Set.of(
        "08",  // connection exception
        "53",  // insufficient resources
        "40"   // transaction rollback
    );

    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "57P01",  // admin_shutdown
        "57P02",  // crash_shutdown
        "57P03"   // cannot_connect_now
    );

    private static final int MAX_CAUSE_DEPTH = 16;

    private DatabaseExceptionClassifier() {
    }

    /**
     * Check whether a failure is the database cancelling a statement that ran
     * past its deadline.
     *
     * @param ex the failure, may be null
     * @return true for SQLSTATE 57014, {@link SQLTimeoutException}, Spring's
     *         {@link QueryTimeoutException} or a transaction deadline
     *         ({@link TransactionTimedOutException}) anywhere in the cause chain
     */
    public static boolean isStatementTimeout(Throwable ex) {
        Throwable current = ex;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof QueryTimeoutException || current instanceof SQLTimeoutException
                    || current instanceof TransactionTimedOutException) {
                return true;
            }
            if (current instanceof SQLException sqlEx && QUERY_CANCELED.equals(sqlEx.getSQLState())) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Check whether a failure looks temporary (lost connection, resource
     * exhaustion, serialization failure).
     *
     * @param ex the failure, may be null
     * @return true if retrying may succeed without any change
     */
    public static boolean isTransient(Throwable ex) {
        return getTransientReason(ex) != null;
    }

    /**
     * Get the SQL state from an exception if available.
     *
     * @param ex the exception to inspect
     * @return the SQL state code, or null if not available
     */
    public static String getSqlState(Throwable ex) {
        Throwable current = ex;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
                return sqlEx.getSQLState();
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    /**
     * Describe why a failure is considered transient.
     *
     * @param ex the failure, may be null
     * @return short description, or null if the failure is not transient
     */
    public static String getTransientReason(Throwable ex) {
        Throwable current = ex;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof CannotGetJdbcConnectionException) {
                return "no connection available";
            }
            if (current instanceof TransientDataAccessException
                    || current instanceof DataAccessResourceFailureException) {
                return "Spring " + current.getClass().getSimpleName();
            }
            if (current instanceof SQLTransientException || current instanceof SQLRecoverableException) {
                return "JDBC " + current.getClass().getSimpleName();
            }
            if (current instanceof SQLException sqlEx) {
                String state = sqlEx.getSQLState();
                if (state != null && (TRANSIENT_SQL_STATES.contains(state)
                        || (state.length() >= 2 && TRANSIENT_SQL_STATE_CLASSES.contains(state.substring(0, 2))))) {
                    return "SQL state " + state;
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }
}
