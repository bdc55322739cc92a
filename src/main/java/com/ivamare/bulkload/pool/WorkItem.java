package com.ivamare.bulkload.pool;

import java.time.Duration;
import java.util.Objects;

/**
 * One unit of work handed to a pool.
 *
 * <p>Work items are values: a retry, a deadline escalation or a split produces a
 * new item derived from the old one.
 *
 * @param job the job-specific parameters
 * @param retries remaining retry budget for errors (never negative)
 * @param timeout statement timeout the unit of work should apply
 * @param escalations how many times the timeout has been raised so far
 * @param <J> the job type
 */
public record WorkItem<J extends Job>(
    J job,
    int retries,
    Duration timeout,
    int escalations
) {

    public WorkItem {
        Objects.requireNonNull(job, "job is required");
        Objects.requireNonNull(timeout, "timeout is required");
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0, was " + retries);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, was " + timeout);
        }
        if (escalations < 0) {
            throw new IllegalArgumentException("escalations must be >= 0, was " + escalations);
        }
    }

    /**
     * Create a fresh item that has never been retried or escalated.
     */
    public static <J extends Job> WorkItem<J> of(J job, int retries, Duration timeout) {
        return new WorkItem<>(job, retries, timeout, 0);
    }

    public String label() {
        return job.label();
    }

    /**
     * @return copy of this item for the next attempt after an error
     * @throws IllegalStateException if the retry budget is exhausted
     */
    public WorkItem<J> retried() {
        if (retries == 0) {
            throw new IllegalStateException("No retries left for " + label());
        }
        return new WorkItem<>(job, retries - 1, timeout, escalations);
    }

    /**
     * @param increment amount to add to the current timeout
     * @return copy of this item with a longer deadline
     */
    public WorkItem<J> escalated(Duration increment) {
        return new WorkItem<>(job, retries, timeout.plus(increment), escalations + 1);
    }

    public WorkItem<J> withJob(J next) {
        return new WorkItem<>(next, retries, timeout, escalations);
    }

    public WorkItem<J> withTimeout(Duration deadline) {
        return new WorkItem<>(job, retries, deadline, 0);
    }

    @Override
    public String toString() {
        return label() + "{retries=" + retries + ", timeout=" + timeout.toSeconds() + "s}";
    }
}
