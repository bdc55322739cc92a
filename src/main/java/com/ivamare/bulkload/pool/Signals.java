package com.ivamare.bulkload.pool;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared aggregate state of a running pool.
 *
 * <p>The supervisor thread is the only writer. Finalize policies run on that
 * thread and may update caller-defined counters through {@link #increment}.
 * Every other thread observes the pool through {@link #snapshot()}, which
 * returns a consistent copy.
 *
 * @param <J> the job type
 */
public final class Signals<J extends Job> {

    private final String pool;
    private final Deque<WorkItem<J>> pending = new ArrayDeque<>();
    private final List<WorkResult<J>> failed = new ArrayList<>();
    private final List<WorkItem<J>> cancelled = new ArrayList<>();
    private final List<WorkItem<J>> abandoned = new ArrayList<>();
    private final Map<String, Long> counters = new LinkedHashMap<>();
    private final Instant startedAt = Instant.now();

    private int inFlight;
    private int peakInFlight;
    private long landed;
    private long totalEnqueued;
    private PoolState state = PoolState.RUNNING;
    private Instant finishedAt;

    private volatile Thread owner;

    public Signals(String pool, Collection<WorkItem<J>> initialPending) {
        this.pool = pool;
        this.pending.addAll(initialPending);
        this.totalEnqueued = initialPending.size();
    }

    public String pool() {
        return pool;
    }

    // --- Caller-defined counters (finalize thread only) ---

    /**
     * Add {@code delta} to a caller-defined counter, creating it at zero.
     *
     * @param key counter name
     * @param delta amount to add
     * @return the new value
     * @throws IllegalStateException if called from a thread other than the supervisor's
     */
    public synchronized long increment(String key, long delta) {
        checkOwner();
        return counters.merge(key, delta, Long::sum);
    }

    public synchronized long counter(String key) {
        return counters.getOrDefault(key, 0L);
    }

    // --- Supervisor bookkeeping ---

    void bindOwner(Thread thread) {
        this.owner = thread;
    }

    synchronized boolean hasPending() {
        return !pending.isEmpty();
    }

    synchronized boolean isQuiescent() {
        return pending.isEmpty() && inFlight == 0;
    }

    synchronized int inFlight() {
        return inFlight;
    }

    synchronized WorkItem<J> dispatch() {
        checkOwner();
        WorkItem<J> next = pending.poll();
        if (next != null) {
            inFlight++;
            peakInFlight = Math.max(peakInFlight, inFlight);
        }
        return next;
    }

    synchronized void land(WorkResult<J> result) {
        checkOwner();
        inFlight--;
        landed++;
    }

    synchronized void recordFailure(WorkResult<J> result) {
        checkOwner();
        failed.add(result);
    }

    synchronized void enqueue(List<WorkItem<J>> items) {
        checkOwner();
        pending.addAll(items);
        totalEnqueued += items.size();
    }

    /**
     * Follow-up work produced after the kill signal closed goes straight to
     * {@code cancelled} so a resumed run picks it up.
     */
    synchronized void cancel(List<WorkItem<J>> items) {
        checkOwner();
        cancelled.addAll(items);
        totalEnqueued += items.size();
    }

    synchronized int cancelPending() {
        checkOwner();
        int count = pending.size();
        cancelled.addAll(pending);
        pending.clear();
        return count;
    }

    synchronized void abandon(Collection<WorkItem<J>> items) {
        checkOwner();
        abandoned.addAll(items);
    }

    synchronized void transition(PoolState next) {
        this.state = next;
        if (next.isTerminal()) {
            this.finishedAt = Instant.now();
        }
    }

    synchronized PoolState state() {
        return state;
    }

    private void checkOwner() {
        Thread current = owner;
        if (current != null && current != Thread.currentThread()) {
            throw new IllegalStateException(
                "Signals of pool " + pool + " can only be modified by its supervisor");
        }
    }

    // --- Readers ---

    /**
     * @return consistent copy of the pool's state
     */
    public synchronized SignalsSnapshot<J> snapshot() {
        Duration elapsed = Duration.between(startedAt, finishedAt != null ? finishedAt : Instant.now());
        return new SignalsSnapshot<>(
            pool,
            state,
            List.copyOf(pending),
            inFlight,
            peakInFlight,
            landed,
            List.copyOf(failed),
            List.copyOf(cancelled),
            List.copyOf(abandoned),
            Map.copyOf(counters),
            totalEnqueued,
            elapsed
        );
    }
}
