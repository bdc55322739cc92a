package com.ivamare.bulkload.exception;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.postgresql.util.PSQLException;
import org.postgresql.util.PSQLState;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.transaction.TransactionTimedOutException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseExceptionClassifierTest {

    @Nested
    class StatementTimeout {

        @Test
        void shouldRecognizeQueryCanceledState() {
            assertTrue(DatabaseExceptionClassifier.isStatementTimeout(
                new SQLException("canceling statement due to statement timeout", "57014")));
        }

        @Test
        void shouldRecognizeDriverException() {
            assertTrue(DatabaseExceptionClassifier.isStatementTimeout(
                new PSQLException("canceling statement due to statement timeout", PSQLState.QUERY_CANCELED)));
        }

        @Test
        void shouldRecognizeJdbcAndSpringTimeouts() {
            assertTrue(DatabaseExceptionClassifier.isStatementTimeout(new SQLTimeoutException("timeout")));
            assertTrue(DatabaseExceptionClassifier.isStatementTimeout(new QueryTimeoutException("timeout")));
        }

        @Test
        void shouldRecognizeTransactionDeadline() {
            assertTrue(DatabaseExceptionClassifier.isStatementTimeout(
                new TransactionTimedOutException("Transaction timed out: deadline was Mon Oct 19 10:00:00 UTC 2026")));
            assertTrue(DatabaseExceptionClassifier.isStatementTimeout(
                new IllegalStateException("copy failed", new TransactionTimedOutException("timed out"))));
        }

        @Test
        void shouldLookThroughWrappers() {
            SQLException cause = new SQLException("canceling statement", "57014");
            RuntimeException wrapped = new RuntimeException(new UncategorizedSQLException("copy", "INSERT", cause));

            assertTrue(DatabaseExceptionClassifier.isStatementTimeout(wrapped));
        }

        @Test
        void shouldNotTreatOtherFailuresAsTimeouts() {
            assertFalse(DatabaseExceptionClassifier.isStatementTimeout(null));
            assertFalse(DatabaseExceptionClassifier.isStatementTimeout(new SQLException("duplicate key", "23505")));
            assertFalse(DatabaseExceptionClassifier.isStatementTimeout(new IllegalStateException("boom")));
            assertFalse(DatabaseExceptionClassifier.isStatementTimeout(
                new DataIntegrityViolationException("not null")));
        }
    }

    @Nested
    class Transient {

        @ParameterizedTest
        @ValueSource(strings = {"08006", "08P01", "53300", "40001", "40P01", "57P01"})
        void shouldClassifyStatesAsTransient(String state) {
            assertTrue(DatabaseExceptionClassifier.isTransient(new SQLException("failure", state)));
            assertEquals("SQL state " + state,
                DatabaseExceptionClassifier.getTransientReason(new SQLException("failure", state)));
        }

        @ParameterizedTest
        @ValueSource(strings = {"23505", "42P01", "42601"})
        void shouldNotClassifyStatesAsTransient(String state) {
            assertFalse(DatabaseExceptionClassifier.isTransient(new SQLException("failure", state)));
        }

        @Test
        void shouldClassifyConnectionFailuresAsTransient() {
            assertEquals("no connection available", DatabaseExceptionClassifier.getTransientReason(
                new CannotGetJdbcConnectionException("pool exhausted")));
        }

        @Test
        void shouldReturnNullReasonForPermanentFailures() {
            assertNull(DatabaseExceptionClassifier.getTransientReason(new IllegalArgumentException()));
            assertNull(DatabaseExceptionClassifier.getTransientReason(null));
        }
    }

    @Nested
    class SqlState {

        @Test
        void shouldExtractNestedSqlState() {
            RuntimeException wrapped = new RuntimeException(new SQLException("x", "42P01"));

            assertEquals("42P01", DatabaseExceptionClassifier.getSqlState(wrapped));
        }

        @Test
        void shouldReturnNullWithoutSqlException() {
            assertNull(DatabaseExceptionClassifier.getSqlState(new RuntimeException("x")));
        }
    }
}
