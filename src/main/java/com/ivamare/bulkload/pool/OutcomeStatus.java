package com.ivamare.bulkload.pool;

/**
 * Classification of a finished unit of work.
 */
public enum OutcomeStatus {
    /** The unit of work returned normally. */
    SUCCESS,
    /** The statement deadline was exceeded; recoverable by policy. */
    TIMEOUT,
    /** Any other failure. */
    ERROR
}
