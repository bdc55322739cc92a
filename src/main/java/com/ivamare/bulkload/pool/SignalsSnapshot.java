package com.ivamare.bulkload.pool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of a pool's {@link Signals}.
 *
 * @param pool pool name
 * @param state lifecycle state
 * @param pending queued items, head first
 * @param inFlight items currently held by workers
 * @param peakInFlight highest {@code inFlight} observed
 * @param landed replies received
 * @param failed items that errored or timed out with no follow-up work, or that a policy failed
 * @param cancelled items still pending when the kill signal closed
 * @param abandoned items in flight when the pool aborted
 * @param counters caller-defined counters
 * @param totalEnqueued initial items plus every follow-up
 * @param elapsed time since the pool started (until it finished)
 * @param <J> the job type
 */
public record SignalsSnapshot<J extends Job>(
    String pool,
    PoolState state,
    List<WorkItem<J>> pending,
    int inFlight,
    int peakInFlight,
    long landed,
    List<WorkResult<J>> failed,
    List<WorkItem<J>> cancelled,
    List<WorkItem<J>> abandoned,
    Map<String, Long> counters,
    long totalEnqueued,
    Duration elapsed
) {

    public long counter(String key) {
        return counters.getOrDefault(key, 0L);
    }

    public int failCount() {
        return failed.size();
    }

    /**
     * Work to re-supply as {@code initialPending} when resuming: failed items
     * followed by cancelled ones.
     */
    public List<WorkItem<J>> retryItems() {
        List<WorkItem<J>> retry = new ArrayList<>(failed.size() + cancelled.size());
        failed.forEach(result -> retry.add(result.item()));
        retry.addAll(cancelled);
        return retry;
    }

    /**
     * Progress estimate. Only exact when no item spawns follow-up work.
     */
    public Progress progress() {
        long total = pending.size() + inFlight + landed;
        double percent = total == 0 ? 100.0 : landed * 100.0 / total;
        return new Progress(pending.size(), inFlight, landed, total, percent);
    }

    public record Progress(int pending, int inFlight, long landed, long total, double percent) {}
}
