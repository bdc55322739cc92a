package com.ivamare.bulkload.policy;

import com.ivamare.bulkload.pool.Decision;
import com.ivamare.bulkload.pool.FinalizePolicy;
import com.ivamare.bulkload.pool.RangeJob;
import com.ivamare.bulkload.pool.Signals;
import com.ivamare.bulkload.pool.WorkItem;
import com.ivamare.bulkload.pool.WorkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Finalize policy for statements over a key range {@code [lo, hi)}, such as
 * batch copies.
 *
 * <p>A timed-out range is halved into {@code [lo, mid)} and {@code [mid, hi)},
 * both keeping the original retry budget and timeout. A unit range cannot be
 * split further and falls back to deadline escalation. Errors are retried
 * until the budget runs out.
 *
 * @param <J> the range job type
 */
public class RangeSplitting<J extends RangeJob<J>> implements FinalizePolicy<J> {

    private static final Logger log = LoggerFactory.getLogger(RangeSplitting.class);

    private final RetryPolicy retryPolicy;
    private final SuccessHandler<J> onSuccess;

    public RangeSplitting(RetryPolicy retryPolicy) {
        this(retryPolicy, SuccessHandler.done());
    }

    public RangeSplitting(RetryPolicy retryPolicy, SuccessHandler<J> onSuccess) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
        this.onSuccess = Objects.requireNonNull(onSuccess, "onSuccess is required");
    }

    @Override
    public Decision<J> apply(WorkResult<J> result, Signals<J> signals) {
        return switch (result.status()) {
            case SUCCESS -> onSuccess.onSuccess(result, signals);
            case TIMEOUT -> split(result.item());
            case ERROR -> retryPolicy.retry(result.item());
        };
    }

    /**
     * @param item a range item that timed out
     * @return two halves, or an escalated copy for a unit range
     */
    Decision<J> split(WorkItem<J> item) {
        List<J> halves = halve(item.job());
        if (halves.isEmpty()) {
            log.debug("{} cannot be split, escalating", item.label());
            return retryPolicy.escalate(item);
        }
        log.debug("{} timed out, splitting at {}", item.label(), halves.get(1).lo());
        return Decision.followUp(item.withJob(halves.get(0)), item.withJob(halves.get(1)));
    }

    /**
     * Halve a range at {@code mid = lo + (hi - lo) / 2}.
     *
     * @param job the range job
     * @return {@code [lo, mid)} and {@code [mid, hi)}, or an empty list for a unit range
     */
    public static <R extends RangeJob<R>> List<R> halve(R job) {
        if (job.width() <= 1) {
            return List.of();
        }
        long mid = job.lo() + (job.hi() - job.lo()) / 2;
        return List.of(job.withBounds(job.lo(), mid), job.withBounds(mid, job.hi()));
    }
}
