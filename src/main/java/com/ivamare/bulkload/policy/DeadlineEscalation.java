package com.ivamare.bulkload.policy;

import com.ivamare.bulkload.pool.Decision;
import com.ivamare.bulkload.pool.FinalizePolicy;
import com.ivamare.bulkload.pool.Job;
import com.ivamare.bulkload.pool.Signals;
import com.ivamare.bulkload.pool.WorkResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Finalize policy for DDL-style statements whose cost does not depend on how
 * the work is divided: a timeout re-runs the same item with a longer deadline,
 * an error is retried until the item's budget runs out.
 *
 * @param <J> the job type
 */
public class DeadlineEscalation<J extends Job> implements FinalizePolicy<J> {

    private static final Logger log = LoggerFactory.getLogger(DeadlineEscalation.class);

    private final RetryPolicy retryPolicy;
    private final SuccessHandler<J> onSuccess;

    public DeadlineEscalation(RetryPolicy retryPolicy) {
        this(retryPolicy, SuccessHandler.done());
    }

    public DeadlineEscalation(RetryPolicy retryPolicy, SuccessHandler<J> onSuccess) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy is required");
        this.onSuccess = Objects.requireNonNull(onSuccess, "onSuccess is required");
    }

    @Override
    public Decision<J> apply(WorkResult<J> result, Signals<J> signals) {
        return switch (result.status()) {
            case SUCCESS -> onSuccess.onSuccess(result, signals);
            case TIMEOUT -> {
                log.debug("{} timed out after {}s, escalating", result.item().label(),
                    result.item().timeout().toSeconds());
                yield retryPolicy.escalate(result.item());
            }
            case ERROR -> retryPolicy.retry(result.item());
        };
    }
}
