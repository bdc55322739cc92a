package com.ivamare.bulkload;

import com.ivamare.bulkload.policy.RetryPolicy;
import com.ivamare.bulkload.schema.Column;
import com.ivamare.bulkload.schema.IndexDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for bulk loading.
 *
 * <p>Example configuration:
 * <pre>
 * bulkload:
 *   enabled: true
 *   pool:
 *     workers: 50
 *     setup-workers: 20
 *     retries: 3
 *     initial-timeout: 60s
 *     timeout-increment: 60s
 *     max-escalations: 0
 *   copy:
 *     workers: 100
 *     batch-size: 100000
 *     retries: 3
 *     timeout: 5m
 *     timeout-increment: 5m
 *   schema:
 *     parent-table: transactions
 *     key-column: tx_sequence_number
 *     source-table: transactions_v1
 *     columns:
 *       - name: tx_sequence_number
 *         type: BIGINT
 *         not-null: true
 *       - name: checkpoint_sequence_number
 *         type: BIGINT
 *         not-null: true
 *     indexes:
 *       - name: checkpoint
 *         definition: (checkpoint_sequence_number)
 * </pre>
 */
@ConfigurationProperties(prefix = "bulkload")
public class BulkLoadProperties {

    /**
     * Enable/disable bulk load auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Settings for pools running DDL (create, constrain, index, attach, drop).
     */
    private PoolProperties pool = new PoolProperties();

    /**
     * Settings for pools copying rows.
     */
    private CopyProperties copy = new CopyProperties();

    /**
     * Layout of the partitioned table built by the lifecycle driver.
     */
    private SchemaProperties schema = new SchemaProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public PoolProperties getPool() {
        return pool;
    }

    public void setPool(PoolProperties pool) {
        this.pool = pool;
    }

    public CopyProperties getCopy() {
        return copy;
    }

    public void setCopy(CopyProperties copy) {
        this.copy = copy;
    }

    public SchemaProperties getSchema() {
        return schema;
    }

    public void setSchema(SchemaProperties schema) {
        this.schema = schema;
    }

    /**
     * DDL pool configuration.
     */
    public static class PoolProperties {

        /**
         * Number of concurrent statements in the partition lifecycle pool.
         */
        private int workers = 50;

        /**
         * Upper bound on workers when creating or dropping tables.
         */
        private int setupWorkers = 20;

        /**
         * Retry budget for errors.
         */
        private int retries = 3;

        /**
         * Statement timeout of a first attempt.
         */
        private Duration initialTimeout = Duration.ofSeconds(60);

        /**
         * Added to the statement timeout after each timeout.
         */
        private Duration timeoutIncrement = Duration.ofSeconds(60);

        /**
         * Escalations allowed per statement before it fails, 0 for unlimited.
         */
        private int maxEscalations = 0;

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(retries, initialTimeout, timeoutIncrement, maxEscalations);
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getSetupWorkers() {
            return setupWorkers;
        }

        public void setSetupWorkers(int setupWorkers) {
            this.setupWorkers = setupWorkers;
        }

        public int getRetries() {
            return retries;
        }

        public void setRetries(int retries) {
            this.retries = retries;
        }

        public Duration getInitialTimeout() {
            return initialTimeout;
        }

        public void setInitialTimeout(Duration initialTimeout) {
            this.initialTimeout = initialTimeout;
        }

        public Duration getTimeoutIncrement() {
            return timeoutIncrement;
        }

        public void setTimeoutIncrement(Duration timeoutIncrement) {
            this.timeoutIncrement = timeoutIncrement;
        }

        public int getMaxEscalations() {
            return maxEscalations;
        }

        public void setMaxEscalations(int maxEscalations) {
            this.maxEscalations = maxEscalations;
        }
    }

    /**
     * Copy pool configuration.
     */
    public static class CopyProperties {

        /**
         * Number of concurrent copy statements.
         */
        private int workers = 100;

        /**
         * Keys per initial copy batch. Batches that time out are halved.
         */
        private long batchSize = 100_000;

        /**
         * Retry budget for errors.
         */
        private int retries = 3;

        /**
         * Statement timeout of a copy batch.
         */
        private Duration timeout = Duration.ofMinutes(5);

        /**
         * Added to the timeout of a single-key batch that still times out.
         */
        private Duration timeoutIncrement = Duration.ofMinutes(5);

        /**
         * Escalations allowed per single-key batch before it fails, 0 for unlimited.
         */
        private int maxEscalations = 0;

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(retries, timeout, timeoutIncrement, maxEscalations);
        }

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public long getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(long batchSize) {
            this.batchSize = batchSize;
        }

        public int getRetries() {
            return retries;
        }

        public void setRetries(int retries) {
            this.retries = retries;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getTimeoutIncrement() {
            return timeoutIncrement;
        }

        public void setTimeoutIncrement(Duration timeoutIncrement) {
            this.timeoutIncrement = timeoutIncrement;
        }

        public int getMaxEscalations() {
            return maxEscalations;
        }

        public void setMaxEscalations(int maxEscalations) {
            this.maxEscalations = maxEscalations;
        }
    }

    /**
     * Partitioned table layout. The schema beans are only created when
     * {@code parent-table} is set.
     */
    public static class SchemaProperties {

        private String parentTable;

        private String keyColumn;

        /**
         * Table rows are copied from, with the same column names.
         */
        private String sourceTable;

        /**
         * Extra SQL condition on source rows.
         */
        private String sourceFilter;

        private List<ColumnProperties> columns = new ArrayList<>();

        private List<IndexProperties> indexes = new ArrayList<>();

        public List<Column> toColumns() {
            return columns.stream().map(c -> new Column(c.getName(), c.getType(), c.isNotNull())).toList();
        }

        public List<IndexDefinition> toIndexes() {
            return indexes.stream().map(i -> new IndexDefinition(i.getName(), i.getDefinition())).toList();
        }

        public String getParentTable() {
            return parentTable;
        }

        public void setParentTable(String parentTable) {
            this.parentTable = parentTable;
        }

        public String getKeyColumn() {
            return keyColumn;
        }

        public void setKeyColumn(String keyColumn) {
            this.keyColumn = keyColumn;
        }

        public String getSourceTable() {
            return sourceTable;
        }

        public void setSourceTable(String sourceTable) {
            this.sourceTable = sourceTable;
        }

        public String getSourceFilter() {
            return sourceFilter;
        }

        public void setSourceFilter(String sourceFilter) {
            this.sourceFilter = sourceFilter;
        }

        public List<ColumnProperties> getColumns() {
            return columns;
        }

        public void setColumns(List<ColumnProperties> columns) {
            this.columns = columns;
        }

        public List<IndexProperties> getIndexes() {
            return indexes;
        }

        public void setIndexes(List<IndexProperties> indexes) {
            this.indexes = indexes;
        }
    }

    public static class ColumnProperties {

        private String name;
        private String type;
        private boolean notNull = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public boolean isNotNull() {
            return notNull;
        }

        public void setNotNull(boolean notNull) {
            this.notNull = notNull;
        }
    }

    public static class IndexProperties {

        private String name;
        private String definition;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDefinition() {
            return definition;
        }

        public void setDefinition(String definition) {
            this.definition = definition;
        }
    }
}
