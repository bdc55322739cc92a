package com.ivamare.bulkload.pool;

/**
 * Caller-supplied policy that inspects each completed work item and decides on
 * follow-up work.
 *
 * <p>Policies run on the supervisor thread, so they may read and update
 * {@link Signals} counters directly. Throwing
 * {@link com.ivamare.bulkload.exception.UnrecoverableConditionException} (or any
 * other exception) is equivalent to returning {@link Decision#unrecoverable}.
 *
 * @param <J> the job type
 */
@FunctionalInterface
public interface FinalizePolicy<J extends Job> {

    /**
     * @param result the finished item and its outcome
     * @param signals the pool's signals
     * @return decision, never null
     */
    Decision<J> apply(WorkResult<J> result, Signals<J> signals);

    /**
     * Policy that never produces follow-up work.
     */
    static <J extends Job> FinalizePolicy<J> none() {
        return (result, signals) -> Decision.done();
    }
}
