package com.ivamare.bulkload;

import com.ivamare.bulkload.policy.RetryPolicy;
import com.ivamare.bulkload.schema.Column;
import com.ivamare.bulkload.schema.IndexDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BulkLoadProperties")
class BulkLoadPropertiesTest {

    @Test
    @DisplayName("should have default values")
    void shouldHaveDefaultValues() {
        BulkLoadProperties properties = new BulkLoadProperties();

        assertTrue(properties.isEnabled());
        assertEquals(50, properties.getPool().getWorkers());
        assertEquals(20, properties.getPool().getSetupWorkers());
        assertEquals(100, properties.getCopy().getWorkers());
        assertEquals(100_000, properties.getCopy().getBatchSize());
        assertNull(properties.getSchema().getParentTable());
    }

    @Test
    @DisplayName("should build the DDL retry policy")
    void shouldBuildDdlRetryPolicy() {
        BulkLoadProperties.PoolProperties pool = new BulkLoadProperties.PoolProperties();

        assertEquals(RetryPolicy.defaultPolicy(), pool.toRetryPolicy());

        pool.setRetries(1);
        pool.setInitialTimeout(Duration.ofSeconds(10));
        pool.setTimeoutIncrement(Duration.ofSeconds(20));
        pool.setMaxEscalations(5);

        assertEquals(new RetryPolicy(1, Duration.ofSeconds(10), Duration.ofSeconds(20), 5), pool.toRetryPolicy());
    }

    @Test
    @DisplayName("should build the copy retry policy")
    void shouldBuildCopyRetryPolicy() {
        BulkLoadProperties.CopyProperties copy = new BulkLoadProperties.CopyProperties();

        assertEquals(new RetryPolicy(3, Duration.ofMinutes(5), Duration.ofMinutes(5), 0), copy.toRetryPolicy());
    }

    @Test
    @DisplayName("should convert schema columns and indexes")
    void shouldConvertSchemaColumnsAndIndexes() {
        BulkLoadProperties.ColumnProperties id = new BulkLoadProperties.ColumnProperties();
        id.setName("id");
        id.setType("BIGINT");
        BulkLoadProperties.ColumnProperties memo = new BulkLoadProperties.ColumnProperties();
        memo.setName("memo");
        memo.setType("TEXT");
        memo.setNotNull(false);
        BulkLoadProperties.IndexProperties index = new BulkLoadProperties.IndexProperties();
        index.setName("memo");
        index.setDefinition("(memo)");

        BulkLoadProperties.SchemaProperties schema = new BulkLoadProperties.SchemaProperties();
        schema.setColumns(List.of(id, memo));
        schema.setIndexes(List.of(index));

        assertEquals(List.of(new Column("id", "BIGINT", true), new Column("memo", "TEXT", false)), schema.toColumns());
        assertEquals(List.of(new IndexDefinition("memo", "(memo)")), schema.toIndexes());
    }
}
