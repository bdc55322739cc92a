package com.ivamare.bulkload.schema;

/**
 * A secondary index built on every partition.
 *
 * @param name suffix of the index name, appended to the table name
 * @param definition everything after {@code ON <table>}, e.g. {@code (checkpoint)} or {@code USING GIN (filters)}
 */
public record IndexDefinition(String name, String definition) {
}
