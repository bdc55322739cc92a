package com.ivamare.bulkload.migration;

import com.ivamare.bulkload.jdbc.StatementExecutor;
import com.ivamare.bulkload.policy.RangeSplitting;
import com.ivamare.bulkload.policy.RetryPolicy;
import com.ivamare.bulkload.policy.SuccessHandler;
import com.ivamare.bulkload.pool.Decision;
import com.ivamare.bulkload.pool.Pool;
import com.ivamare.bulkload.pool.PoolHandle;
import com.ivamare.bulkload.pool.PoolRegistry;
import com.ivamare.bulkload.pool.WorkItem;
import com.ivamare.bulkload.schema.KeyRange;
import com.ivamare.bulkload.schema.Partitions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copies a key range from a source into several target tables in batches.
 *
 * <p>Each target has an insert statement taking the batch bounds as its two
 * parameters, {@code lo} inclusive and {@code hi} exclusive. Batches that time
 * out are halved. Rows copied are counted per target under
 * {@code rows:<target>}.
 */
public class BulkCopyDriver {

    private static final Logger log = LoggerFactory.getLogger(BulkCopyDriver.class);

    public static final String ROWS_COUNTER_PREFIX = "rows:";

    private final StatementExecutor executor;
    private final PoolRegistry registry;
    private final RetryPolicy retryPolicy;
    private final int workers;

    public BulkCopyDriver(StatementExecutor executor, PoolRegistry registry, RetryPolicy retryPolicy, int workers) {
        this.executor = executor;
        this.registry = registry;
        this.retryPolicy = retryPolicy;
        this.workers = workers;
    }

    /**
     * Copy {@code [lo, hi)} into every target.
     *
     * @param name pool name
     * @param statements insert statement per target table
     * @param lo inclusive lower bound
     * @param hi exclusive upper bound
     * @param batchSize keys per initial batch
     * @return handle onto the pool
     */
    public PoolHandle<TableCopy> start(String name, Map<String, String> statements, long lo, long hi, long batchSize) {
        List<WorkItem<TableCopy>> pending = new ArrayList<>();
        for (KeyRange batch : Partitions.batches(lo, hi, batchSize)) {
            for (String target : statements.keySet()) {
                pending.add(retryPolicy.seed(new TableCopy(target, batch.lo(), batch.hi())));
            }
        }
        log.info("Copying [{}, {}) into {} tables in {} jobs", lo, hi, statements.size(), pending.size());
        return launch(name, statements, pending);
    }

    /**
     * Resume from the retry items of an earlier run.
     *
     * @param name pool name
     * @param statements insert statement per target table
     * @param items failed and cancelled items of an earlier run
     * @return handle onto the pool
     */
    public PoolHandle<TableCopy> resume(String name, Map<String, String> statements, List<WorkItem<TableCopy>> items) {
        for (WorkItem<TableCopy> item : items) {
            if (!statements.containsKey(item.job().target())) {
                throw new IllegalArgumentException("No copy statement for target " + item.job().target());
            }
        }
        log.info("Resuming copy from {} jobs", items.size());
        return launch(name, statements, items);
    }

    private PoolHandle<TableCopy> launch(String name, Map<String, String> statements,
                                         List<WorkItem<TableCopy>> pending) {
        Map<String, String> sql = new LinkedHashMap<>(statements);
        SuccessHandler<TableCopy> countRows = (result, signals) -> {
            signals.increment(ROWS_COUNTER_PREFIX + result.job().target(), result.outcome().payloadAsLong());
            return Decision.done();
        };
        return registry.start(Pool.<TableCopy>builder()
            .name(name)
            .workers(workers)
            .pending(pending)
            .unitOfWork(item -> executor.execute(
                sql.get(item.job().target()), item.timeout(), item.job().lo(), item.job().hi()))
            .finalizePolicy(new RangeSplitting<>(retryPolicy, countRows)));
    }
}
