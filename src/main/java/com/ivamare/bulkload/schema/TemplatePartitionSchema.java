package com.ivamare.bulkload.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link PartitionSchema} generated from a table layout.
 *
 * <p>Partition {@code n} of {@code parent} is named {@code parent_partition_n};
 * its indexes are named {@code <table>_<index>} on both the partition and the
 * parent, and its range check {@code <partition>_partition_check}.
 *
 * <p>Example:
 * <pre>
 * PartitionSchema schema = new TemplatePartitionSchema(
 *     "transactions", "tx_sequence_number",
 *     List.of(new Column("tx_sequence_number", "BIGINT", true),
 *             new Column("checkpoint_sequence_number", "BIGINT", true)),
 *     List.of(new IndexDefinition("checkpoint", "(checkpoint_sequence_number)")),
 *     "transactions_v1", null);
 * </pre>
 */
public class TemplatePartitionSchema implements PartitionSchema {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String parentTable;
    private final String keyColumn;
    private final List<Column> columns;
    private final List<IndexDefinition> indexes;
    private final String sourceTable;
    private final String sourceFilter;

    /**
     * @param parentTable partitioned parent table
     * @param keyColumn column the table is partitioned on, also its primary key
     * @param columns columns of the table, including {@code keyColumn}
     * @param indexes secondary indexes, built in order
     * @param sourceTable table rows are copied from, with the same column names
     * @param sourceFilter extra condition on source rows, or null
     */
    public TemplatePartitionSchema(
            String parentTable,
            String keyColumn,
            List<Column> columns,
            List<IndexDefinition> indexes,
            String sourceTable,
            String sourceFilter) {
        this.parentTable = identifier(parentTable);
        this.keyColumn = identifier(keyColumn);
        this.columns = List.copyOf(columns);
        this.indexes = List.copyOf(indexes);
        this.sourceTable = identifier(sourceTable);
        this.sourceFilter = sourceFilter == null || sourceFilter.isBlank() ? null : sourceFilter;

        if (this.columns.isEmpty()) {
            throw new IllegalArgumentException("at least one column is required");
        }
        this.columns.forEach(c -> identifier(c.name()));
        this.indexes.forEach(i -> identifier(i.name()));
        if (this.columns.stream().noneMatch(c -> c.name().equals(keyColumn))) {
            throw new IllegalArgumentException("key column " + keyColumn + " is not among the columns");
        }
    }

    @Override
    public String parentTable() {
        return parentTable;
    }

    @Override
    public String partitionTable(int number) {
        return parentTable + "_partition_" + number;
    }

    @Override
    public int indexCount() {
        return indexes.size();
    }

    @Override
    public List<String> createParent() {
        String definitions = columns.stream()
            .map(c -> c.name() + " " + c.type() + (c.notNull() || c.name().equals(keyColumn) ? " NOT NULL" : ""))
            .collect(Collectors.joining(", "));

        List<String> statements = new ArrayList<>();
        statements.add("CREATE TABLE " + parentTable + " (" + definitions
            + ", PRIMARY KEY (" + keyColumn + ")) PARTITION BY RANGE (" + keyColumn + ")");
        for (IndexDefinition index : indexes) {
            statements.add("CREATE INDEX " + indexName(parentTable, index)
                + " ON ONLY " + parentTable + " " + index.definition());
        }
        return statements;
    }

    @Override
    public List<String> createPartition(int number) {
        String table = partitionTable(number);
        String definitions = columns.stream()
            .map(c -> c.name() + " " + c.type())
            .collect(Collectors.joining(", "));
        return List.of(
            "CREATE TABLE " + table + " (" + definitions + ")",
            disableAutovacuum(table));
    }

    @Override
    public String disableAutovacuum(String table) {
        return "ALTER TABLE " + identifier(table) + " SET (autovacuum_enabled = false)";
    }

    @Override
    public String resetAutovacuum(String table) {
        return "ALTER TABLE " + identifier(table) + " RESET (autovacuum_enabled)";
    }

    @Override
    public String copyBatch(int number) {
        String names = columns.stream().map(Column::name).collect(Collectors.joining(", "));
        return "INSERT INTO " + partitionTable(number) + " (" + names + ")"
            + " SELECT " + names + " FROM " + sourceTable
            + " WHERE " + keyColumn + " >= ? AND " + keyColumn + " < ?"
            + (sourceFilter != null ? " AND (" + sourceFilter + ")" : "");
    }

    @Override
    public String constrain(Partition partition) {
        String table = partitionTable(partition.number());
        StringBuilder sql = new StringBuilder("ALTER TABLE ").append(table)
            .append(" ADD PRIMARY KEY (").append(keyColumn).append(")");
        for (Column column : columns) {
            if (column.notNull() && !column.name().equals(keyColumn)) {
                sql.append(", ALTER COLUMN ").append(column.name()).append(" SET NOT NULL");
            }
        }
        sql.append(", ADD CONSTRAINT ").append(rangeCheck(table))
            .append(" CHECK (").append(partition.lo()).append(" <= ").append(keyColumn)
            .append(" AND ").append(keyColumn).append(" < ").append(partition.hi()).append(")");
        return sql.toString();
    }

    @Override
    public String createIndex(int number, int index) {
        if (index < 0 || index >= indexes.size()) {
            throw new IndexOutOfBoundsException("no index " + index + " among " + indexes.size());
        }
        String table = partitionTable(number);
        IndexDefinition definition = indexes.get(index);
        return "CREATE INDEX " + indexName(table, definition) + " ON " + table + " " + definition.definition();
    }

    @Override
    public List<String> attach(Partition partition) {
        String table = partitionTable(partition.number());
        List<String> statements = new ArrayList<>();
        statements.add("ALTER TABLE " + parentTable + " ATTACH PARTITION " + table
            + " FOR VALUES FROM (" + partition.lo() + ") TO (" + partition.hi() + ")");
        for (IndexDefinition index : indexes) {
            statements.add("ALTER INDEX " + indexName(parentTable, index)
                + " ATTACH PARTITION " + indexName(table, index));
        }
        return statements;
    }

    @Override
    public String dropRangeCheck(int number) {
        String table = partitionTable(number);
        return "ALTER TABLE " + table + " DROP CONSTRAINT " + rangeCheck(table);
    }

    @Override
    public String analyze(String table) {
        return "VACUUM ANALYZE " + identifier(table);
    }

    @Override
    public String drop(String table) {
        return "DROP TABLE IF EXISTS " + identifier(table);
    }

    private static String indexName(String table, IndexDefinition index) {
        return table + "_" + index.name();
    }

    private static String rangeCheck(String table) {
        return table + "_partition_check";
    }

    private static String identifier(String name) {
        Objects.requireNonNull(name, "identifier is required");
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid SQL identifier: " + name);
        }
        return name;
    }
}
