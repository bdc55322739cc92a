package com.ivamare.bulkload.jdbc.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcStatementExecutorTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private PlatformTransactionManager transactionManager;

    private JdbcStatementExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new JdbcStatementExecutor(jdbcTemplate, transactionManager);
    }

    @Nested
    class ExecuteTests {

        private final DataSource dataSource = mock(DataSource.class);
        private final Connection connection = mock(Connection.class);
        private final PreparedStatement statement = mock(PreparedStatement.class);

        @BeforeEach
        void setUp() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);
            when(connection.prepareStatement(anyString())).thenReturn(statement);
        }

        @Test
        void shouldSetQueryTimeoutAndBindArguments() throws Exception {
            when(statement.executeUpdate()).thenReturn(42);
            JdbcStatementExecutor real = new JdbcStatementExecutor(new JdbcTemplate(dataSource), transactionManager);

            int rows = real.execute("INSERT INTO t SELECT * FROM s WHERE k >= ? AND k < ?",
                Duration.ofSeconds(30), 10L, 20L);

            assertEquals(42, rows);
            verify(connection).prepareStatement("INSERT INTO t SELECT * FROM s WHERE k >= ? AND k < ?");
            verify(statement).setObject(1, 10L);
            verify(statement).setObject(2, 20L);
            verify(statement).setQueryTimeout(30);
            verify(statement).close();
            verify(connection).close();
        }

        @Test
        void shouldNotBindWithoutArguments() throws Exception {
            JdbcStatementExecutor real = new JdbcStatementExecutor(new JdbcTemplate(dataSource), transactionManager);

            real.execute("VACUUM ANALYZE t", Duration.ofMinutes(2));

            verify(statement).setQueryTimeout(120);
            verify(statement, never()).setObject(anyInt(), any());
        }

        @Test
        void shouldOverrideTemplateWideQueryTimeout() throws Exception {
            JdbcTemplate template = new JdbcTemplate(dataSource);
            template.setQueryTimeout(5);
            when(statement.executeUpdate()).thenReturn(7);

            int rows = new JdbcStatementExecutor(template, transactionManager)
                .execute("INSERT INTO t SELECT * FROM s", Duration.ofMinutes(2));

            assertEquals(7, rows);
            InOrder order = inOrder(statement);
            order.verify(statement).setQueryTimeout(5);
            order.verify(statement).setQueryTimeout(120);
            order.verify(statement).executeUpdate();
        }
    }

    @Nested
    class TransactionTests {

        @Test
        void shouldRunAllStatementsInOneTransactionWithTimeout() {
            SimpleTransactionStatus status = new SimpleTransactionStatus();
            when(transactionManager.getTransaction(any())).thenReturn(status);
            when(jdbcTemplate.update(anyString())).thenReturn(0, 1);

            int total = executor.executeInTransaction(List.of("CREATE TABLE a (id BIGINT)", "INSERT INTO a VALUES (1)"),
                Duration.ofSeconds(5));

            assertEquals(1, total);
            ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
            verify(transactionManager).getTransaction(definition.capture());
            assertEquals(5, definition.getValue().getTimeout());
            verify(jdbcTemplate).update("CREATE TABLE a (id BIGINT)");
            verify(jdbcTemplate).update("INSERT INTO a VALUES (1)");
            verify(transactionManager).commit(status);
        }

        @Test
        void shouldRollBackWhenStatementFails() {
            SimpleTransactionStatus status = new SimpleTransactionStatus();
            when(transactionManager.getTransaction(any())).thenReturn(status);
            when(jdbcTemplate.update("ALTER TABLE a ADD PRIMARY KEY (id)"))
                .thenThrow(new IllegalStateException("duplicate key"));

            assertThrows(IllegalStateException.class, () -> executor.executeInTransaction(
                List.of("ALTER TABLE a ADD PRIMARY KEY (id)", "ANALYZE a"), Duration.ofSeconds(5)));

            verify(transactionManager).rollback(status);
            verify(transactionManager, never()).commit(any());
            verify(jdbcTemplate, never()).update("ANALYZE a");
        }
    }

    @Test
    void shouldRoundTimeoutsUpToWholeSeconds() {
        assertEquals(1, JdbcStatementExecutor.toSeconds(Duration.ZERO));
        assertEquals(1, JdbcStatementExecutor.toSeconds(Duration.ofMillis(10)));
        assertEquals(1, JdbcStatementExecutor.toSeconds(Duration.ofSeconds(1)));
        assertEquals(2, JdbcStatementExecutor.toSeconds(Duration.ofMillis(1500)));
        assertEquals(300, JdbcStatementExecutor.toSeconds(Duration.ofMinutes(5)));
    }
}
