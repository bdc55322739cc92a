package com.ivamare.bulkload.policy;

import com.ivamare.bulkload.pool.Decision;
import com.ivamare.bulkload.pool.Job;
import com.ivamare.bulkload.pool.WorkItem;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry and deadline parameters shared by the finalize policies.
 *
 * @param retries Retry budget for errors given to every new work item
 * @param initialTimeout Statement timeout of a new work item
 * @param timeoutIncrement Amount added to the timeout on each escalation
 * @param maxEscalations Escalations allowed per item before it fails, 0 for unlimited
 */
public record RetryPolicy(
    int retries,
    Duration initialTimeout,
    Duration timeoutIncrement,
    int maxEscalations
) {

    public RetryPolicy {
        Objects.requireNonNull(initialTimeout, "initialTimeout is required");
        Objects.requireNonNull(timeoutIncrement, "timeoutIncrement is required");
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0");
        }
        if (initialTimeout.isNegative() || initialTimeout.isZero()) {
            throw new IllegalArgumentException("initialTimeout must be positive");
        }
        if (timeoutIncrement.isNegative() || timeoutIncrement.isZero()) {
            throw new IllegalArgumentException("timeoutIncrement must be positive");
        }
        if (maxEscalations < 0) {
            throw new IllegalArgumentException("maxEscalations must be >= 0");
        }
    }

    /**
     * Default policy: 3 retries, 60s timeout raised by 60s per escalation, no ceiling.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(60), Duration.ofSeconds(60), 0);
    }

    /**
     * Create a policy with no retries on error.
     *
     * @param timeout Initial timeout, also used as the escalation increment
     * @return No retry policy
     */
    public static RetryPolicy noRetry(Duration timeout) {
        return new RetryPolicy(0, timeout, timeout, 0);
    }

    /**
     * Create a fresh work item for a job.
     *
     * @param job the job
     * @return item with this policy's retry budget and initial timeout
     */
    public <J extends Job> WorkItem<J> seed(J job) {
        return WorkItem.of(job, retries, initialTimeout);
    }

    /**
     * Check if a timed-out item may have its deadline raised once more.
     *
     * @param item the item that timed out
     * @return true if no ceiling is configured or the ceiling has not been reached
     */
    public boolean canEscalate(WorkItem<?> item) {
        return maxEscalations == 0 || item.escalations() < maxEscalations;
    }

    /**
     * Decide what to do with an item that timed out: the same item with a
     * longer deadline, or a terminal failure once the ceiling is reached.
     *
     * @param item the item that timed out
     * @return follow-up decision
     */
    public <J extends Job> Decision<J> escalate(WorkItem<J> item) {
        if (!canEscalate(item)) {
            return Decision.fail();
        }
        return Decision.followUp(item.escalated(timeoutIncrement));
    }

    /**
     * Decide what to do with an item that errored: retry it with one less
     * unit of budget, or nothing once the budget is exhausted.
     *
     * @param item the item that errored
     * @return follow-up decision
     */
    public <J extends Job> Decision<J> retry(WorkItem<J> item) {
        if (item.retries() == 0) {
            return Decision.done();
        }
        return Decision.followUp(item.retried());
    }
}
