package com.ivamare.bulkload.migration;

import com.ivamare.bulkload.jdbc.StatementExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory {@link StatementExecutor} that records every statement in
 * execution order. Range statements report {@code hi - lo} rows.
 */
class RecordingExecutor implements StatementExecutor {

    @FunctionalInterface
    interface Fault {
        /**
         * @return the exception to throw for this statement, or null to run it
         */
        RuntimeException check(String sql, Object[] args);
    }

    private final List<String> statements = new ArrayList<>();
    private volatile Fault fault = (sql, args) -> null;

    RecordingExecutor failWhen(Fault fault) {
        this.fault = fault;
        return this;
    }

    @Override
    public int execute(String sql, Duration timeout, Object... args) {
        RuntimeException failure = fault.check(sql, args);
        synchronized (statements) {
            statements.add(sql);
        }
        if (failure != null) {
            throw failure;
        }
        if (args.length == 2 && args[0] instanceof Long lo && args[1] instanceof Long hi) {
            return (int) (hi - lo);
        }
        return 0;
    }

    @Override
    public int executeInTransaction(List<String> sql, Duration timeout) {
        for (String statement : sql) {
            RuntimeException failure = fault.check(statement, new Object[0]);
            synchronized (statements) {
                statements.add(statement);
            }
            if (failure != null) {
                throw failure;
            }
        }
        return 0;
    }

    List<String> statements() {
        synchronized (statements) {
            return new ArrayList<>(statements);
        }
    }

    List<String> statementsContaining(String fragment) {
        return statements().stream().filter(sql -> sql.contains(fragment)).toList();
    }

    long count(String fragment) {
        return statementsContaining(fragment).size();
    }
}
