package com.ivamare.bulkload.pool;

/**
 * Lifecycle of a pool as seen through its signals.
 */
public enum PoolState {
    /** Dispatching work. */
    RUNNING,
    /** Kill signal closed; waiting for in-flight replies. */
    DRAINING,
    /** Ran out of work and shut itself down. */
    COMPLETED,
    /** Killed from outside and drained. */
    KILLED,
    /** Wound down early because finalize reported an unrecoverable condition. */
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == KILLED || this == ABORTED;
    }
}
