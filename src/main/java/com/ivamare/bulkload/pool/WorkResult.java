package com.ivamare.bulkload.pool;

import java.util.Objects;

/**
 * A work item together with the outcome of executing it, as sent from a worker
 * back to the supervisor.
 *
 * @param item the item that was executed
 * @param outcome what happened
 * @param <J> the job type
 */
public record WorkResult<J extends Job>(
    WorkItem<J> item,
    Outcome outcome
) {

    public WorkResult {
        Objects.requireNonNull(item, "item is required");
        Objects.requireNonNull(outcome, "outcome is required");
    }

    public J job() {
        return item.job();
    }

    public OutcomeStatus status() {
        return outcome.status();
    }
}
