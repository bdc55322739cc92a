package com.ivamare.bulkload.jdbc;

import java.time.Duration;
import java.util.List;

/**
 * Runs SQL on behalf of units of work, each statement bounded by a timeout
 * enforced by the database driver.
 *
 * <p>A statement that runs past its timeout is cancelled by the server and
 * surfaces as an exception recognised by
 * {@link com.ivamare.bulkload.exception.DatabaseExceptionClassifier#isStatementTimeout}.
 */
public interface StatementExecutor {

    /**
     * Execute one statement outside of any transaction.
     *
     * @param sql the statement
     * @param timeout statement timeout
     * @param args positional parameters
     * @return update count (0 for DDL)
     */
    int execute(String sql, Duration timeout, Object... args);

    /**
     * Execute several statements atomically in one transaction.
     *
     * @param statements statements, run in order
     * @param timeout timeout for the whole transaction
     * @return sum of update counts
     */
    int executeInTransaction(List<String> statements, Duration timeout);
}
