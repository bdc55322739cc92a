package com.ivamare.bulkload.pool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builder for starting {@link Pool}s.
 *
 * @param <J> the job type
 */
public class PoolBuilder<J extends Job> {

    private String name;
    private int workers = 1;
    private final List<WorkItem<J>> pending = new ArrayList<>();
    private UnitOfWork<J> unitOfWork;
    private FinalizePolicy<J> finalizePolicy;

    /**
     * Set the pool name used for thread names and logs.
     *
     * @param name the pool name
     * @return this builder
     */
    public PoolBuilder<J> name(String name) {
        this.name = name;
        return this;
    }

    /**
     * Set the number of workers (default: 1).
     *
     * @param workers number of concurrent workers
     * @return this builder
     */
    public PoolBuilder<J> workers(int workers) {
        this.workers = workers;
        return this;
    }

    /**
     * Add initial pending work.
     *
     * @param items work items, dispatched in iteration order
     * @return this builder
     */
    public PoolBuilder<J> pending(Collection<WorkItem<J>> items) {
        this.pending.addAll(items);
        return this;
    }

    /**
     * Set the job body executed by workers.
     *
     * @param unitOfWork the unit of work
     * @return this builder
     */
    public PoolBuilder<J> unitOfWork(UnitOfWork<J> unitOfWork) {
        this.unitOfWork = unitOfWork;
        return this;
    }

    /**
     * Set the finalize policy (default: no follow-up work).
     *
     * @param finalizePolicy the policy
     * @return this builder
     */
    public PoolBuilder<J> finalizePolicy(FinalizePolicy<J> finalizePolicy) {
        this.finalizePolicy = finalizePolicy;
        return this;
    }

    String name() {
        return name;
    }

    int workers() {
        return workers;
    }

    /**
     * Start the pool.
     *
     * @return handle onto the running pool
     * @throws IllegalStateException if required properties not set
     */
    public PoolHandle<J> start() {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("name is required");
        }
        if (unitOfWork == null) {
            throw new IllegalStateException("unitOfWork is required");
        }
        if (workers < 1) {
            throw new IllegalStateException("workers must be >= 1");
        }
        return Pool.start(name, workers, pending, unitOfWork, finalizePolicy);
    }
}
