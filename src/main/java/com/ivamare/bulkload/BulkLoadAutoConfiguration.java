package com.ivamare.bulkload;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.bulkload.jdbc.ConnectionCapacityCheck;
import com.ivamare.bulkload.jdbc.StatementExecutor;
import com.ivamare.bulkload.jdbc.impl.JdbcStatementExecutor;
import com.ivamare.bulkload.migration.BulkCopyDriver;
import com.ivamare.bulkload.migration.PartitionLifecycleDriver;
import com.ivamare.bulkload.migration.TableSetupDriver;
import com.ivamare.bulkload.pool.PoolRegistry;
import com.ivamare.bulkload.pool.RetryLedger;
import com.ivamare.bulkload.schema.PartitionSchema;
import com.ivamare.bulkload.schema.TemplatePartitionSchema;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * Auto-configuration for bulk loading.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Statement executor</li>
 *   <li>Pool registry and retry ledger</li>
 *   <li>Bulk copy driver</li>
 *   <li>Partition schema, table setup and partition lifecycle drivers (when {@code bulkload.schema.parent-table} is set)</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * bulkload.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class
})
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "bulkload", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(BulkLoadProperties.class)
public class BulkLoadAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper bulkLoadObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    // --- Database ---

    @Bean
    @ConditionalOnMissingBean
    public StatementExecutor statementExecutor(JdbcTemplate jdbcTemplate,
                                               PlatformTransactionManager transactionManager) {
        return new JdbcStatementExecutor(jdbcTemplate, transactionManager);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionCapacityCheck connectionCapacityCheck(DataSource dataSource) {
        return new ConnectionCapacityCheck(dataSource);
    }

    // --- Pools ---

    @Bean
    @ConditionalOnMissingBean
    public PoolRegistry poolRegistry(ConnectionCapacityCheck connectionCapacityCheck) {
        return new PoolRegistry(connectionCapacityCheck);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryLedger retryLedger(ObjectMapper objectMapper) {
        return new RetryLedger(objectMapper);
    }

    // --- Drivers ---

    @Bean
    @ConditionalOnMissingBean
    public BulkCopyDriver bulkCopyDriver(StatementExecutor statementExecutor, PoolRegistry poolRegistry,
                                         BulkLoadProperties properties) {
        return new BulkCopyDriver(
            statementExecutor,
            poolRegistry,
            properties.getCopy().toRetryPolicy(),
            properties.getCopy().getWorkers()
        );
    }

    /**
     * Beans for one partitioned table described under {@code bulkload.schema}.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "bulkload.schema", name = "parent-table")
    static class PartitionedTableConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public PartitionSchema partitionSchema(BulkLoadProperties properties) {
            BulkLoadProperties.SchemaProperties schema = properties.getSchema();
            return new TemplatePartitionSchema(
                schema.getParentTable(),
                schema.getKeyColumn(),
                schema.toColumns(),
                schema.toIndexes(),
                schema.getSourceTable(),
                schema.getSourceFilter()
            );
        }

        @Bean
        @ConditionalOnMissingBean
        public TableSetupDriver tableSetupDriver(PartitionSchema partitionSchema,
                                                 StatementExecutor statementExecutor,
                                                 PoolRegistry poolRegistry,
                                                 BulkLoadProperties properties) {
            return new TableSetupDriver(
                partitionSchema,
                statementExecutor,
                poolRegistry,
                properties.getPool().toRetryPolicy(),
                properties.getPool().getSetupWorkers()
            );
        }

        @Bean
        @ConditionalOnMissingBean
        public PartitionLifecycleDriver partitionLifecycleDriver(PartitionSchema partitionSchema,
                                                                 StatementExecutor statementExecutor,
                                                                 PoolRegistry poolRegistry,
                                                                 BulkLoadProperties properties) {
            return new PartitionLifecycleDriver(
                "lifecycle-" + partitionSchema.parentTable(),
                partitionSchema,
                statementExecutor,
                poolRegistry,
                properties.getPool().toRetryPolicy(),
                properties.getCopy().toRetryPolicy(),
                properties.getPool().getWorkers(),
                properties.getCopy().getBatchSize()
            );
        }
    }
}
