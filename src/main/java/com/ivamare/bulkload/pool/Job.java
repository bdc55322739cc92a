package com.ivamare.bulkload.pool;

/**
 * The job-specific part of a {@link WorkItem}.
 *
 * <p>Each kind of work a driver submits is modelled as its own immutable record
 * implementing this interface, usually grouped under a sealed interface so that
 * finalize policies can dispatch over every kind.
 */
public interface Job {

    /**
     * Short human-readable tag used in logs and progress counters.
     *
     * @return label for this job
     */
    String label();
}
