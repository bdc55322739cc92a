package com.ivamare.bulkload.schema;

/**
 * @param name column name
 * @param type SQL type
 * @param notNull whether the column is NOT NULL once the partition is constrained
 */
public record Column(String name, String type, boolean notNull) {
}
