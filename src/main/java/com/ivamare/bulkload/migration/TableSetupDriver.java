package com.ivamare.bulkload.migration;

import com.ivamare.bulkload.jdbc.StatementExecutor;
import com.ivamare.bulkload.migration.TableJob.CreateParent;
import com.ivamare.bulkload.migration.TableJob.CreatePartition;
import com.ivamare.bulkload.migration.TableJob.DropTable;
import com.ivamare.bulkload.policy.DeadlineEscalation;
import com.ivamare.bulkload.policy.RetryPolicy;
import com.ivamare.bulkload.policy.SuccessHandler;
import com.ivamare.bulkload.pool.Decision;
import com.ivamare.bulkload.pool.Pool;
import com.ivamare.bulkload.pool.PoolHandle;
import com.ivamare.bulkload.pool.PoolRegistry;
import com.ivamare.bulkload.pool.WorkItem;
import com.ivamare.bulkload.schema.Partition;
import com.ivamare.bulkload.schema.PartitionSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates and drops the tables of a partitioned schema.
 *
 * <p>Partitions are created detached, unconstrained and with autovacuum
 * disabled, ready for the {@link PartitionLifecycleDriver}. Every table is an
 * independent job, so tables are created concurrently.
 */
public class TableSetupDriver {

    private static final Logger log = LoggerFactory.getLogger(TableSetupDriver.class);

    public static final String CREATED_COUNTER = "created";
    public static final String DROPPED_COUNTER = "dropped";

    private final PartitionSchema schema;
    private final StatementExecutor executor;
    private final PoolRegistry registry;
    private final RetryPolicy retryPolicy;
    private final int maxWorkers;

    public TableSetupDriver(PartitionSchema schema, StatementExecutor executor, PoolRegistry registry,
                            RetryPolicy retryPolicy, int maxWorkers) {
        this.schema = schema;
        this.executor = executor;
        this.registry = registry;
        this.retryPolicy = retryPolicy;
        this.maxWorkers = maxWorkers;
    }

    /**
     * Create the parent table and the given partitions.
     *
     * @param partitions partitions to create
     * @return handle onto the pool
     */
    public PoolHandle<TableJob> createAll(List<Partition> partitions) {
        List<WorkItem<TableJob>> pending = new ArrayList<>(partitions.size() + 1);
        pending.add(item(new CreateParent(schema.parentTable())));
        for (Partition partition : partitions) {
            pending.add(item(new CreatePartition(partition.number())));
        }
        log.info("Creating {} with {} partitions", schema.parentTable(), partitions.size());
        return launch("create-tables", pending);
    }

    /**
     * Drop the given partitions and the parent table.
     *
     * @param partitions partitions to drop
     * @return handle onto the pool
     */
    public PoolHandle<TableJob> dropAll(List<Partition> partitions) {
        List<WorkItem<TableJob>> pending = new ArrayList<>(partitions.size() + 1);
        for (Partition partition : partitions) {
            pending.add(item(new DropTable(schema.partitionTable(partition.number()))));
        }
        pending.add(item(new DropTable(schema.parentTable())));
        log.info("Dropping {} and {} partitions", schema.parentTable(), partitions.size());
        return launch("drop-tables", pending);
    }

    /**
     * Resume from the retry items of an earlier run.
     *
     * @param name pool name
     * @param items failed and cancelled items of an earlier run
     * @return handle onto the pool
     */
    public PoolHandle<TableJob> resume(String name, List<WorkItem<TableJob>> items) {
        return launch(name, items);
    }

    private PoolHandle<TableJob> launch(String name, List<WorkItem<TableJob>> pending) {
        SuccessHandler<TableJob> count = (result, signals) -> {
            signals.increment(result.job() instanceof DropTable ? DROPPED_COUNTER : CREATED_COUNTER, 1);
            return Decision.done();
        };
        return registry.start(Pool.<TableJob>builder()
            .name(name)
            .workers(Math.max(1, Math.min(maxWorkers, pending.size())))
            .pending(pending)
            .unitOfWork(this::execute)
            .finalizePolicy(new DeadlineEscalation<>(retryPolicy, count)));
    }

    Object execute(WorkItem<TableJob> item) {
        TableJob job = item.job();
        if (job instanceof CreateParent) {
            executor.executeInTransaction(schema.createParent(), item.timeout());
        } else if (job instanceof CreatePartition create) {
            executor.executeInTransaction(schema.createPartition(create.number()), item.timeout());
        } else if (job instanceof DropTable drop) {
            executor.execute(schema.drop(drop.table()), item.timeout());
        }
        return null;
    }

    private WorkItem<TableJob> item(TableJob job) {
        return retryPolicy.seed(job);
    }
}
