package com.ivamare.bulkload.pool;

import java.util.Objects;

/**
 * Result of executing a work item exactly once.
 *
 * @param status outcome classification
 * @param payload value returned by the unit of work (SUCCESS only, may be null)
 * @param cause the failure (TIMEOUT and ERROR only)
 */
public record Outcome(
    OutcomeStatus status,
    Object payload,
    Throwable cause
) {

    public Outcome {
        Objects.requireNonNull(status, "status is required");
        if (status != OutcomeStatus.SUCCESS && cause == null) {
            throw new IllegalArgumentException(status + " outcome requires a cause");
        }
    }

    public static Outcome success(Object payload) {
        return new Outcome(OutcomeStatus.SUCCESS, payload, null);
    }

    public static Outcome timeout(Throwable cause) {
        return new Outcome(OutcomeStatus.TIMEOUT, null, cause);
    }

    public static Outcome error(Throwable cause) {
        return new Outcome(OutcomeStatus.ERROR, null, cause);
    }

    public boolean isSuccess() {
        return status == OutcomeStatus.SUCCESS;
    }

    /**
     * Read the payload as a number, treating a missing payload as zero.
     *
     * @return payload as long
     * @throws IllegalStateException if the payload is not numeric
     */
    public long payloadAsLong() {
        if (payload == null) {
            return 0L;
        }
        if (payload instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalStateException("Payload is not numeric: " + payload.getClass().getName());
    }
}
