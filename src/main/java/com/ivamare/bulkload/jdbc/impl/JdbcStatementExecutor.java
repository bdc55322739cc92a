package com.ivamare.bulkload.jdbc.impl;

import com.ivamare.bulkload.jdbc.StatementExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.time.Duration;
import java.util.List;

/**
 * JDBC implementation of {@link StatementExecutor}.
 *
 * <p>Single statements set {@link PreparedStatement#setQueryTimeout} directly,
 * after {@link JdbcTemplate} has applied its own statement settings, so the
 * caller's deadline wins over any template-wide query timeout. Transactions use a {@link TransactionTemplate} with the timeout applied to
 * the transaction, which Spring propagates to every statement inside it.
 */
public class JdbcStatementExecutor implements StatementExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcStatementExecutor.class);

    private final JdbcTemplate jdbcTemplate;
    private final PlatformTransactionManager transactionManager;

    public JdbcStatementExecutor(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionManager = transactionManager;
    }

    @Override
    public int execute(String sql, Duration timeout, Object... args) {
        int seconds = toSeconds(timeout);
        log.trace("Executing with {}s timeout: {}", seconds, sql);
        Integer rows = jdbcTemplate.execute(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            return ps;
        }, (PreparedStatementCallback<Integer>) ps -> {
            ps.setQueryTimeout(seconds);
            return ps.executeUpdate();
        });
        return rows != null ? rows : 0;
    }

    @Override
    public int executeInTransaction(List<String> statements, Duration timeout) {
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        tx.setTimeout(toSeconds(timeout));
        Integer total = tx.execute(status -> {
            int count = 0;
            for (String sql : statements) {
                log.trace("Executing in transaction: {}", sql);
                count += jdbcTemplate.update(sql);
            }
            return count;
        });
        return total != null ? total : 0;
    }

    /**
     * JDBC timeouts have whole-second resolution; anything shorter rounds up to one second.
     */
    static int toSeconds(Duration timeout) {
        long seconds = timeout.toSeconds();
        if (timeout.toNanosPart() > 0 || seconds == 0) {
            seconds++;
        }
        return (int) Math.min(Integer.MAX_VALUE, seconds);
    }
}
