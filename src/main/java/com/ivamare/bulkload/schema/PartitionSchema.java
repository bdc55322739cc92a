package com.ivamare.bulkload.schema;

import java.util.List;

/**
 * SQL text for building a range-partitioned table one partition at a time.
 *
 * <p>Partitions are created detached and unconstrained so that rows can be
 * copied in without index or constraint maintenance, then constrained,
 * indexed and attached to the parent.
 */
public interface PartitionSchema {

    String parentTable();

    String partitionTable(int number);

    int indexCount();

    /**
     * @return statements creating the partitioned parent table and its indexes
     */
    List<String> createParent();

    /**
     * @return statements creating an unconstrained partition table with autovacuum disabled,
     *         to be run in one transaction
     */
    List<String> createPartition(int number);

    String disableAutovacuum(String table);

    String resetAutovacuum(String table);

    /**
     * @return insert copying source rows with keys in {@code [?, ?)} into the partition
     */
    String copyBatch(int number);

    /**
     * @return statement adding the primary key, NOT NULL constraints and the range check
     */
    String constrain(Partition partition);

    /**
     * @param index ordinal of the index, {@code 0 <= index < indexCount()}
     */
    String createIndex(int number, int index);

    /**
     * @return statements attaching the partition and each of its indexes to the parent,
     *         to be run in one transaction
     */
    List<String> attach(Partition partition);

    String dropRangeCheck(int number);

    String analyze(String table);

    String drop(String table);
}
