package com.ivamare.bulkload;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.bulkload.jdbc.ConnectionCapacityCheck;
import com.ivamare.bulkload.jdbc.StatementExecutor;
import com.ivamare.bulkload.migration.BulkCopyDriver;
import com.ivamare.bulkload.migration.PartitionLifecycleDriver;
import com.ivamare.bulkload.migration.TableSetupDriver;
import com.ivamare.bulkload.pool.PoolRegistry;
import com.ivamare.bulkload.pool.RetryLedger;
import com.ivamare.bulkload.schema.PartitionSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("BulkLoadAutoConfiguration")
class BulkLoadAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(BulkLoadAutoConfiguration.class))
        .withUserConfiguration(MockDataSourceConfig.class);

    @Test
    @DisplayName("should create core beans when enabled")
    void shouldCreateCoreBeansWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ObjectMapper.class);
            assertThat(context).hasSingleBean(StatementExecutor.class);
            assertThat(context).hasSingleBean(ConnectionCapacityCheck.class);
            assertThat(context).hasSingleBean(PoolRegistry.class);
            assertThat(context).hasSingleBean(RetryLedger.class);
            assertThat(context).hasSingleBean(BulkCopyDriver.class);
        });
    }

    @Test
    @DisplayName("should not create schema beans without a parent table")
    void shouldNotCreateSchemaBeansWithoutParentTable() {
        contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(PartitionSchema.class);
            assertThat(context).doesNotHaveBean(TableSetupDriver.class);
            assertThat(context).doesNotHaveBean(PartitionLifecycleDriver.class);
        });
    }

    @Test
    @DisplayName("should create schema beans from properties")
    void shouldCreateSchemaBeansFromProperties() {
        contextRunner
            .withPropertyValues(
                "bulkload.schema.parent-table=ledger",
                "bulkload.schema.key-column=id",
                "bulkload.schema.source-table=ledger_v1",
                "bulkload.schema.columns[0].name=id",
                "bulkload.schema.columns[0].type=BIGINT",
                "bulkload.schema.columns[1].name=memo",
                "bulkload.schema.columns[1].type=TEXT",
                "bulkload.schema.columns[1].not-null=false",
                "bulkload.schema.indexes[0].name=memo",
                "bulkload.schema.indexes[0].definition=(memo)")
            .run(context -> {
                assertThat(context).hasSingleBean(TableSetupDriver.class);
                assertThat(context).hasSingleBean(PartitionLifecycleDriver.class);

                PartitionSchema schema = context.getBean(PartitionSchema.class);
                assertThat(schema.parentTable()).isEqualTo("ledger");
                assertThat(schema.indexCount()).isEqualTo(1);
                assertThat(schema.createParent().get(0))
                    .isEqualTo("CREATE TABLE ledger (id BIGINT NOT NULL, memo TEXT, PRIMARY KEY (id)) "
                        + "PARTITION BY RANGE (id)");
            });
    }

    @Test
    @DisplayName("should bind pool and copy settings")
    void shouldBindPoolAndCopySettings() {
        contextRunner
            .withPropertyValues(
                "bulkload.pool.workers=8",
                "bulkload.pool.initial-timeout=30s",
                "bulkload.copy.batch-size=5000",
                "bulkload.copy.timeout=2m",
                "bulkload.copy.max-escalations=4")
            .run(context -> {
                BulkLoadProperties properties = context.getBean(BulkLoadProperties.class);
                assertThat(properties.getPool().getWorkers()).isEqualTo(8);
                assertThat(properties.getPool().toRetryPolicy().initialTimeout()).isEqualTo(Duration.ofSeconds(30));
                assertThat(properties.getCopy().getBatchSize()).isEqualTo(5000);
                assertThat(properties.getCopy().toRetryPolicy().initialTimeout()).isEqualTo(Duration.ofMinutes(2));
                assertThat(properties.getCopy().toRetryPolicy().maxEscalations()).isEqualTo(4);
            });
    }

    @Test
    @DisplayName("should not create beans when disabled")
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner
            .withPropertyValues("bulkload.enabled=false", "bulkload.schema.parent-table=ledger")
            .run(context -> {
                assertThat(context).doesNotHaveBean(PoolRegistry.class);
                assertThat(context).doesNotHaveBean(BulkCopyDriver.class);
                assertThat(context).doesNotHaveBean(PartitionLifecycleDriver.class);
            });
    }

    @Test
    @DisplayName("should use custom StatementExecutor if provided")
    void shouldUseCustomStatementExecutorIfProvided() {
        contextRunner
            .withUserConfiguration(CustomExecutorConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(StatementExecutor.class);
                assertThat(context.getBean(StatementExecutor.class)).isSameAs(CustomExecutorConfig.CUSTOM_EXECUTOR);
            });
    }

    @Configuration
    static class MockDataSourceConfig {
        @Bean
        public DataSource dataSource() {
            return mock(DataSource.class);
        }

        @Bean
        public JdbcTemplate jdbcTemplate() {
            return mock(JdbcTemplate.class);
        }

        @Bean
        public PlatformTransactionManager transactionManager() {
            return mock(PlatformTransactionManager.class);
        }
    }

    @Configuration
    static class CustomExecutorConfig {
        static final StatementExecutor CUSTOM_EXECUTOR = mock(StatementExecutor.class);

        @Bean
        public StatementExecutor statementExecutor() {
            return CUSTOM_EXECUTOR;
        }
    }
}
