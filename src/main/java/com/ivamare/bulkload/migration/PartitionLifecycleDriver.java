package com.ivamare.bulkload.migration;

import com.ivamare.bulkload.exception.UnrecoverableConditionException;
import com.ivamare.bulkload.jdbc.StatementExecutor;
import com.ivamare.bulkload.migration.PartitionJob.CopyBatch;
import com.ivamare.bulkload.migration.PartitionJob.PhaseStep;
import com.ivamare.bulkload.policy.RangeSplitting;
import com.ivamare.bulkload.policy.RetryPolicy;
import com.ivamare.bulkload.pool.Decision;
import com.ivamare.bulkload.pool.FinalizePolicy;
import com.ivamare.bulkload.pool.Pool;
import com.ivamare.bulkload.pool.PoolHandle;
import com.ivamare.bulkload.pool.PoolRegistry;
import com.ivamare.bulkload.pool.Signals;
import com.ivamare.bulkload.pool.WorkItem;
import com.ivamare.bulkload.pool.WorkResult;
import com.ivamare.bulkload.schema.KeyRange;
import com.ivamare.bulkload.schema.Partition;
import com.ivamare.bulkload.schema.PartitionSchema;
import com.ivamare.bulkload.schema.Partitions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives partitions of a range-partitioned table through their lifecycle:
 * disable autovacuum, bulk copy, constrain, build indexes, attach, drop the
 * range check, reset autovacuum and analyze.
 *
 * <p>Every partition runs its own chain on a shared pool. The next phase of a
 * partition is only enqueued when the previous one succeeds, so a partition is
 * never attached before its rows are copied and its indexes exist. Bulk copy
 * is split into disjoint batches that run concurrently and are halved when
 * they time out; the partition moves on to constrain once all of its batches
 * have landed. Indexes are built one at a time.
 *
 * <p>Counters:
 * <ul>
 *   <li>{@code phase:<phase>} partitions that completed the phase</li>
 *   <li>{@code rows:<partition table>} rows copied into the partition</li>
 * </ul>
 */
public class PartitionLifecycleDriver {

    private static final Logger log = LoggerFactory.getLogger(PartitionLifecycleDriver.class);

    public static final String PHASE_COUNTER_PREFIX = "phase:";
    public static final String ROWS_COUNTER_PREFIX = "rows:";

    private final String name;
    private final PartitionSchema schema;
    private final StatementExecutor executor;
    private final PoolRegistry registry;
    private final RetryPolicy phasePolicy;
    private final RetryPolicy copyPolicy;
    private final int workers;
    private final long batchSize;

    /**
     * @param name pool name
     * @param schema SQL for the partitioned table
     * @param executor statement executor
     * @param registry registry the pool is started through
     * @param phasePolicy retry and deadline policy for single-statement phases
     * @param copyPolicy retry and deadline policy for copy batches
     * @param workers number of concurrent statements
     * @param batchSize keys per initial copy batch
     */
    public PartitionLifecycleDriver(
            String name,
            PartitionSchema schema,
            StatementExecutor executor,
            PoolRegistry registry,
            RetryPolicy phasePolicy,
            RetryPolicy copyPolicy,
            int workers,
            long batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.name = name;
        this.schema = schema;
        this.executor = executor;
        this.registry = registry;
        this.phasePolicy = phasePolicy;
        this.copyPolicy = copyPolicy;
        this.workers = workers;
        this.batchSize = batchSize;
    }

    /**
     * Start the lifecycle of each partition from its first phase.
     *
     * @param partitions detached, unconstrained partitions that already exist
     * @return handle onto the pool
     */
    public PoolHandle<PartitionJob> start(List<Partition> partitions) {
        List<WorkItem<PartitionJob>> pending = new ArrayList<>(partitions.size());
        for (Partition partition : partitions) {
            pending.add(phaseItem(PhaseStep.of(partition, Phase.DISABLE_AUTOVACUUM)));
        }
        log.info("Starting lifecycle of {} partitions of {}", partitions.size(), schema.parentTable());
        return launch(pending);
    }

    /**
     * Resume from the retry items of an earlier run. Copy batches of a partition
     * that are not in {@code items} are assumed to have landed.
     *
     * @param items failed and cancelled items of an earlier run
     * @return handle onto the pool
     */
    public PoolHandle<PartitionJob> resume(List<WorkItem<PartitionJob>> items) {
        log.info("Resuming lifecycle of {} partitions of {} from {} items",
            items.stream().map(item -> item.job().partition().number()).distinct().count(),
            schema.parentTable(), items.size());
        return launch(items);
    }

    private PoolHandle<PartitionJob> launch(List<WorkItem<PartitionJob>> pending) {
        return registry.start(Pool.<PartitionJob>builder()
            .name(name)
            .workers(workers)
            .pending(pending)
            .unitOfWork(this::execute)
            .finalizePolicy(new LifecycleFinalizer(outstandingBatches(pending))));
    }

    /**
     * Run the statement of one job.
     *
     * @return rows copied for a copy batch, null otherwise
     */
    Object execute(WorkItem<PartitionJob> item) {
        Duration timeout = item.timeout();
        PartitionJob job = item.job();
        Partition partition = job.partition();

        if (job instanceof CopyBatch batch) {
            return executor.execute(schema.copyBatch(partition.number()), timeout, batch.lo(), batch.hi());
        }

        PhaseStep step = (PhaseStep) job;
        String table = schema.partitionTable(partition.number());
        switch (step.phase()) {
            case DISABLE_AUTOVACUUM -> executor.execute(schema.disableAutovacuum(table), timeout);
            case CONSTRAIN -> executor.execute(schema.constrain(partition), timeout);
            case BUILD_INDEX -> executor.execute(schema.createIndex(partition.number(), step.index()), timeout);
            case ATTACH -> executor.executeInTransaction(schema.attach(partition), timeout);
            case DROP_RANGE_CHECK -> executor.execute(schema.dropRangeCheck(partition.number()), timeout);
            case RESET_AUTOVACUUM -> executor.execute(schema.resetAutovacuum(table), timeout);
            case ANALYZE -> executor.execute(schema.analyze(table), timeout);
            case BULK_COPY -> throw new IllegalStateException("bulk copy runs as copy batches");
        }
        return null;
    }

    private static Map<Integer, Integer> outstandingBatches(List<WorkItem<PartitionJob>> pending) {
        Map<Integer, Integer> outstanding = new HashMap<>();
        for (WorkItem<PartitionJob> item : pending) {
            if (item.job() instanceof CopyBatch batch) {
                outstanding.merge(batch.partition().number(), 1, Integer::sum);
            }
        }
        return outstanding;
    }

    private WorkItem<PartitionJob> phaseItem(PartitionJob job) {
        return phasePolicy.seed(job);
    }

    private WorkItem<PartitionJob> copyItem(PartitionJob job) {
        return copyPolicy.seed(job);
    }

    /**
     * Advances each partition's chain. Runs on the supervisor thread only.
     */
    private final class LifecycleFinalizer implements FinalizePolicy<PartitionJob> {

        private final Map<Integer, Integer> outstanding;

        LifecycleFinalizer(Map<Integer, Integer> outstanding) {
            this.outstanding = outstanding;
        }

        @Override
        public Decision<PartitionJob> apply(WorkResult<PartitionJob> result, Signals<PartitionJob> signals) {
            WorkItem<PartitionJob> item = result.item();
            return switch (result.status()) {
                case SUCCESS -> advance(result, signals);
                case TIMEOUT -> onTimeout(item);
                case ERROR -> {
                    log.debug("{} failed: {}", item.label(), result.outcome().cause().toString());
                    yield policyFor(item.job()).retry(item);
                }
            };
        }

        private Decision<PartitionJob> onTimeout(WorkItem<PartitionJob> item) {
            if (item.job() instanceof CopyBatch batch) {
                List<CopyBatch> halves = RangeSplitting.halve(batch);
                if (halves.isEmpty()) {
                    return copyPolicy.escalate(item);
                }
                outstanding.merge(batch.partition().number(), 1, Integer::sum);
                log.debug("{} timed out, splitting at {}", item.label(), halves.get(1).lo());
                return Decision.followUp(item.withJob(halves.get(0)), item.withJob(halves.get(1)));
            }
            log.debug("{} timed out after {}s, escalating", item.label(), item.timeout().toSeconds());
            return phasePolicy.escalate(item);
        }

        private Decision<PartitionJob> advance(WorkResult<PartitionJob> result, Signals<PartitionJob> signals) {
            PartitionJob job = result.job();
            Partition partition = job.partition();

            if (job instanceof CopyBatch batch) {
                signals.increment(ROWS_COUNTER_PREFIX + schema.partitionTable(partition.number()),
                    result.outcome().payloadAsLong());
                return batchLanded(batch, signals);
            }

            PhaseStep step = (PhaseStep) job;
            switch (step.phase()) {
                case DISABLE_AUTOVACUUM -> {
                    completed(step.phase(), partition, signals);
                    return startCopy(partition);
                }
                case CONSTRAIN -> {
                    completed(step.phase(), partition, signals);
                    return Decision.followUp(phaseItem(schema.indexCount() > 0
                        ? new PhaseStep(partition, Phase.BUILD_INDEX, 0)
                        : PhaseStep.of(partition, Phase.ATTACH)));
                }
                case BUILD_INDEX -> {
                    if (step.index() + 1 < schema.indexCount()) {
                        return Decision.followUp(phaseItem(new PhaseStep(partition, Phase.BUILD_INDEX, step.index() + 1)));
                    }
                    completed(step.phase(), partition, signals);
                    return Decision.followUp(phaseItem(PhaseStep.of(partition, Phase.ATTACH)));
                }
                case ANALYZE -> {
                    completed(step.phase(), partition, signals);
                    log.info("Partition {} [{}, {}) is ready", schema.partitionTable(partition.number()),
                        partition.lo(), partition.hi());
                    return Decision.done();
                }
                default -> {
                    completed(step.phase(), partition, signals);
                    return Decision.followUp(phaseItem(PhaseStep.of(partition, step.phase().next())));
                }
            }
        }

        private Decision<PartitionJob> startCopy(Partition partition) {
            if (outstanding.containsKey(partition.number())) {
                throw new UnrecoverableConditionException("DUPLICATE_COPY",
                    "Partition " + partition.number() + " is already being copied",
                    Map.of("partition", partition.number()));
            }
            List<WorkItem<PartitionJob>> batches = new ArrayList<>();
            for (KeyRange range : Partitions.batches(partition.lo(), partition.hi(), batchSize)) {
                batches.add(copyItem(new CopyBatch(partition, range.lo(), range.hi())));
            }
            outstanding.put(partition.number(), batches.size());
            log.debug("partition-{} copying in {} batches", partition.number(), batches.size());
            return Decision.followUp(batches);
        }

        private Decision<PartitionJob> batchLanded(CopyBatch batch, Signals<PartitionJob> signals) {
            Partition partition = batch.partition();
            Integer left = outstanding.computeIfPresent(partition.number(), (number, count) -> count - 1);
            if (left == null || left < 0) {
                throw new UnrecoverableConditionException("UNTRACKED_BATCH",
                    "Copy batch " + batch.label() + " landed for a partition that is not being copied",
                    Map.of("partition", partition.number(), "lo", batch.lo(), "hi", batch.hi()));
            }
            if (left > 0) {
                return Decision.done();
            }
            outstanding.remove(partition.number());
            completed(Phase.BULK_COPY, partition, signals);
            return Decision.followUp(phaseItem(PhaseStep.of(partition, Phase.CONSTRAIN)));
        }

        private void completed(Phase phase, Partition partition, Signals<PartitionJob> signals) {
            signals.increment(PHASE_COUNTER_PREFIX + phase.label(), 1);
            log.debug("partition-{} completed {}", partition.number(), phase.label());
        }

        private RetryPolicy policyFor(PartitionJob job) {
            return job instanceof CopyBatch ? copyPolicy : phasePolicy;
        }
    }
}
