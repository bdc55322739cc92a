package com.ivamare.bulkload.migration;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ivamare.bulkload.pool.Job;
import com.ivamare.bulkload.pool.RangeJob;
import com.ivamare.bulkload.schema.Partition;

import java.util.Objects;

/**
 * Work performed on one partition by the {@link PartitionLifecycleDriver}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PartitionJob.PhaseStep.class, name = "phase"),
    @JsonSubTypes.Type(value = PartitionJob.CopyBatch.class, name = "copy")
})
public sealed interface PartitionJob extends Job permits PartitionJob.PhaseStep, PartitionJob.CopyBatch {

    Partition partition();

    /**
     * A single-statement phase. {@code index} selects the index for
     * {@link Phase#BUILD_INDEX} and is 0 otherwise.
     */
    record PhaseStep(Partition partition, Phase phase, int index) implements PartitionJob {

        public PhaseStep {
            Objects.requireNonNull(partition, "partition is required");
            Objects.requireNonNull(phase, "phase is required");
            if (phase == Phase.BULK_COPY) {
                throw new IllegalArgumentException("bulk copy runs as copy batches");
            }
            if (index < 0 || (index > 0 && phase != Phase.BUILD_INDEX)) {
                throw new IllegalArgumentException("invalid index " + index + " for " + phase.label());
            }
        }

        public static PhaseStep of(Partition partition, Phase phase) {
            return new PhaseStep(partition, phase, 0);
        }

        @Override
        public String label() {
            String label = "partition-" + partition.number() + "/" + phase.label();
            return phase == Phase.BUILD_INDEX ? label + "#" + index : label;
        }
    }

    /**
     * Copy of the source rows with keys in {@code [lo, hi)} into the partition.
     */
    record CopyBatch(Partition partition, long lo, long hi) implements PartitionJob, RangeJob<CopyBatch> {

        public CopyBatch {
            Objects.requireNonNull(partition, "partition is required");
            if (lo >= hi || lo < partition.lo() || hi > partition.hi()) {
                throw new IllegalArgumentException(
                    "batch [" + lo + ", " + hi + ") outside partition " + partition.range());
            }
        }

        @Override
        public CopyBatch withBounds(long lo, long hi) {
            return new CopyBatch(partition, lo, hi);
        }

        @Override
        public String label() {
            return "partition-" + partition.number() + "/copy[" + lo + ", " + hi + ")";
        }
    }
}
