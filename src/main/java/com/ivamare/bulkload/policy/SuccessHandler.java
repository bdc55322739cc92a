package com.ivamare.bulkload.policy;

import com.ivamare.bulkload.pool.Decision;
import com.ivamare.bulkload.pool.Job;
import com.ivamare.bulkload.pool.Signals;
import com.ivamare.bulkload.pool.WorkResult;

/**
 * Reaction to a successful work item, used by the finalize policies in this
 * package. Runs on the supervisor thread, so it may update counters.
 *
 * @param <J> the job type
 */
@FunctionalInterface
public interface SuccessHandler<J extends Job> {

    /**
     * @param result the successful result
     * @param signals the pool's signals
     * @return follow-up decision, typically {@link Decision#done()} or the next step of a chain
     */
    Decision<J> onSuccess(WorkResult<J> result, Signals<J> signals);

    static <J extends Job> SuccessHandler<J> done() {
        return (result, signals) -> Decision.done();
    }

    /**
     * Add the numeric payload of each success to a counter.
     *
     * @param counter counter name
     * @return handler that counts and produces no follow-up work
     */
    static <J extends Job> SuccessHandler<J> countPayload(String counter) {
        return (result, signals) -> {
            signals.increment(counter, result.outcome().payloadAsLong());
            return Decision.done();
        };
    }
}
