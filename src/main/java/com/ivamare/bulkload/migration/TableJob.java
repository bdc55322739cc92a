package com.ivamare.bulkload.migration;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ivamare.bulkload.pool.Job;

/**
 * Table creation and removal run by the {@link TableSetupDriver}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TableJob.CreateParent.class, name = "create-parent"),
    @JsonSubTypes.Type(value = TableJob.CreatePartition.class, name = "create-partition"),
    @JsonSubTypes.Type(value = TableJob.DropTable.class, name = "drop")
})
public sealed interface TableJob extends Job
        permits TableJob.CreateParent, TableJob.CreatePartition, TableJob.DropTable {

    record CreateParent(String table) implements TableJob {
        @Override
        public String label() {
            return "create " + table;
        }
    }

    record CreatePartition(int number) implements TableJob {
        @Override
        public String label() {
            return "create partition-" + number;
        }
    }

    record DropTable(String table) implements TableJob {
        @Override
        public String label() {
            return "drop " + table;
        }
    }
}
