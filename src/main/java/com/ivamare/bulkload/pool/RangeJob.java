package com.ivamare.bulkload.pool;

/**
 * A job that operates on the half-open key range {@code [lo, hi)}.
 *
 * <p>Range jobs can be split by {@link com.ivamare.bulkload.policy.RangeSplitting}
 * when they time out.
 *
 * @param <J> the concrete job type
 */
public interface RangeJob<J extends RangeJob<J>> extends Job {

    /**
     * @return inclusive lower bound
     */
    long lo();

    /**
     * @return exclusive upper bound
     */
    long hi();

    /**
     * Copy this job onto new bounds, keeping every other parameter.
     *
     * @param lo inclusive lower bound
     * @param hi exclusive upper bound
     * @return the job over {@code [lo, hi)}
     */
    J withBounds(long lo, long hi);

    /**
     * @return number of keys covered by the range
     */
    default long width() {
        return hi() - lo();
    }
}
