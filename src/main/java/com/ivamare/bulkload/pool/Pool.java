package com.ivamare.bulkload.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Factory wiring a fixed number of workers and one supervisor together.
 *
 * <p>{@link #start} returns immediately; all execution proceeds on the pool's
 * own threads. Observe progress through {@link PoolHandle#signals()} and wait
 * for the end with {@link PoolHandle#completion()}.
 */
public final class Pool {

    private static final Logger log = LoggerFactory.getLogger(Pool.class);

    private Pool() {
    }

    public static <J extends Job> PoolBuilder<J> builder() {
        return new PoolBuilder<>();
    }

    /**
     * Start a pool.
     *
     * @param name pool name, used for thread names and logs
     * @param workerCount number of workers, at least 1
     * @param initialPending work to start with, dispatched in order
     * @param unitOfWork job body run by the workers
     * @param finalizePolicy decides follow-up work for each reply
     * @return handle onto the running pool
     * @throws IllegalArgumentException if {@code workerCount < 1}
     */
    public static <J extends Job> PoolHandle<J> start(
            String name,
            int workerCount,
            Collection<WorkItem<J>> initialPending,
            UnitOfWork<J> unitOfWork,
            FinalizePolicy<J> finalizePolicy) {

        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(initialPending, "initialPending is required");
        Objects.requireNonNull(unitOfWork, "unitOfWork is required");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, was " + workerCount);
        }
        FinalizePolicy<J> policy = finalizePolicy != null ? finalizePolicy : FinalizePolicy.none();

        Signals<J> signals = new Signals<>(name, initialPending);
        Supervisor<J> supervisor = new Supervisor<>(name, signals, policy);

        List<PoolWorker<J>> workers = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            PoolWorker<J> worker = new PoolWorker<>(name + "-worker-" + i, unitOfWork, supervisor.mailbox());
            supervisor.register(worker);
            workers.add(worker);
        }

        ExecutorService workerThreads = Executors.newFixedThreadPool(
            workerCount, new CustomizableThreadFactory(name + "-worker-"));
        ExecutorService supervisorThread = Executors.newSingleThreadExecutor(
            new CustomizableThreadFactory(name + "-supervisor-"));

        List<CompletableFuture<Void>> threads = new ArrayList<>(workerCount + 1);
        threads.add(CompletableFuture.runAsync(supervisor, supervisorThread));
        for (PoolWorker<J> worker : workers) {
            threads.add(CompletableFuture.runAsync(worker, workerThreads));
        }
        workerThreads.shutdown();
        supervisorThread.shutdown();

        CompletableFuture<SignalsSnapshot<J>> completion = CompletableFuture
            .allOf(threads.toArray(CompletableFuture[]::new))
            .thenApply(ignored -> signals.snapshot());

        log.info("Started pool {} with {} workers and {} pending items", name, workerCount, initialPending.size());
        return new PoolHandle<>(name, workerCount, supervisor.killSwitch(), signals, completion);
    }
}
