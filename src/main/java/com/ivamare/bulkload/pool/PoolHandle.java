package com.ivamare.bulkload.pool;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller's view of a running pool: the kill switch, its signals, and a future
 * that completes once the supervisor and every worker have terminated.
 *
 * <p>Example:
 * <pre>
 * PoolHandle&lt;CopyBatch&gt; handle = Pool.&lt;CopyBatch&gt;builder()
 *     .name("copy")
 *     .workers(20)
 *     .pending(batches)
 *     .unitOfWork(item -&gt; copy(item.job()))
 *     .finalizePolicy(new RangeSplitting&lt;&gt;(retryPolicy, countRows))
 *     .start();
 *
 * SignalsSnapshot&lt;CopyBatch&gt; done = handle.await(Duration.ofHours(6));
 * </pre>
 *
 * @param <J> the job type
 */
public final class PoolHandle<J extends Job> {

    private final String name;
    private final int workers;
    private final KillSwitch killSwitch;
    private final Signals<J> signals;
    private final CompletableFuture<SignalsSnapshot<J>> completion;

    PoolHandle(String name, int workers, KillSwitch killSwitch, Signals<J> signals,
               CompletableFuture<SignalsSnapshot<J>> completion) {
        this.name = name;
        this.workers = workers;
        this.killSwitch = killSwitch;
        this.signals = signals;
        this.completion = completion;
    }

    public String name() {
        return name;
    }

    public int workers() {
        return workers;
    }

    /**
     * Close the kill signal. Pending work is cancelled, in-flight work drains.
     * Safe to call any number of times.
     */
    public void kill() {
        killSwitch.close();
    }

    public boolean isKilled() {
        return killSwitch.isClosed();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public SignalsSnapshot<J> signals() {
        return signals.snapshot();
    }

    /**
     * @return future completing with the final signals once every pool thread has terminated
     */
    public CompletableFuture<SignalsSnapshot<J>> completion() {
        return completion;
    }

    /**
     * Block until the pool has terminated.
     *
     * @param timeout maximum time to wait
     * @return final signals
     * @throws TimeoutException if the pool is still running after {@code timeout}
     * @throws InterruptedException if the calling thread is interrupted
     */
    public SignalsSnapshot<J> await(Duration timeout) throws TimeoutException, InterruptedException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Pool " + name + " terminated abnormally", e.getCause());
        }
    }
}
