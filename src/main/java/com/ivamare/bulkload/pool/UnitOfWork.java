package com.ivamare.bulkload.pool;

/**
 * The job body executed by a worker, typically a single database statement.
 *
 * <p>Whatever is returned becomes the SUCCESS payload. A statement timeout
 * reported by the driver becomes a TIMEOUT outcome, anything else thrown becomes
 * an ERROR outcome.
 *
 * @param <J> the job type
 */
@FunctionalInterface
public interface UnitOfWork<J extends Job> {

    Object execute(WorkItem<J> item) throws Exception;
}
