package com.ivamare.bulkload.pool;

import java.util.List;
import java.util.Objects;

/**
 * What a {@link FinalizePolicy} wants the supervisor to do after a reply.
 *
 * @param followUps items to append to the pending queue
 * @param failed whether the finished item should be recorded as terminally failed
 * @param unrecoverable whether the whole pool must wind down
 * @param reason explanation for an unrecoverable decision
 * @param <J> the job type
 */
public record Decision<J extends Job>(
    List<WorkItem<J>> followUps,
    boolean failed,
    boolean unrecoverable,
    String reason
) {

    public Decision {
        followUps = List.copyOf(followUps);
        if (unrecoverable) {
            Objects.requireNonNull(reason, "reason is required for an unrecoverable decision");
        }
    }

    /**
     * Nothing more to do for this item.
     */
    public static <J extends Job> Decision<J> done() {
        return new Decision<>(List.of(), false, false, null);
    }

    @SafeVarargs
    public static <J extends Job> Decision<J> followUp(WorkItem<J>... items) {
        return new Decision<>(List.of(items), false, false, null);
    }

    public static <J extends Job> Decision<J> followUp(List<WorkItem<J>> items) {
        return new Decision<>(items, false, false, null);
    }

    /**
     * Record the item in {@code failed} without follow-up work.
     */
    public static <J extends Job> Decision<J> fail() {
        return new Decision<>(List.of(), true, false, null);
    }

    /**
     * Stop the pool: pending work is cancelled and in-flight work is abandoned.
     */
    public static <J extends Job> Decision<J> unrecoverable(String reason) {
        return new Decision<>(List.of(), false, true, reason);
    }
}
