package com.ivamare.bulkload.pool;

import com.ivamare.bulkload.exception.DatabaseExceptionClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Executes work items handed over by the supervisor, one at a time.
 *
 * <p>Each worker owns an inbox. It announces itself once on the supervisor's
 * mailbox, then alternates between taking an assignment and posting the result.
 * Only the supervisor writes to the inbox, so a stop always arrives after any
 * work assigned before it. An {@link InterruptedException} thrown by the unit of
 * work is an ordinary error; only an interrupt while idle makes the worker leave.
 */
final class PoolWorker<J extends Job> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PoolWorker.class);

    private final String name;
    private final UnitOfWork<J> unitOfWork;
    private final BlockingQueue<Supervisor.Message<J>> mailbox;
    private final BlockingQueue<Assignment<J>> inbox = new LinkedBlockingQueue<>();

    PoolWorker(String name, UnitOfWork<J> unitOfWork, BlockingQueue<Supervisor.Message<J>> mailbox) {
        this.name = name;
        this.unitOfWork = unitOfWork;
        this.mailbox = mailbox;
    }

    String name() {
        return name;
    }

    void assign(WorkItem<J> item) {
        inbox.add(new Assignment<>(item));
    }

    void stop() {
        inbox.add(Assignment.stop());
    }

    @Override
    public void run() {
        log.debug("Worker {} starting", name);
        mailbox.add(new Supervisor.Ready<>(this));
        try {
            while (true) {
                Assignment<J> assignment = inbox.take();
                if (assignment.isStop()) {
                    break;
                }
                WorkResult<J> result = execute(assignment.item());
                // a unit of work may leave the flag set; it must not end the loop
                if (Thread.interrupted()) {
                    log.debug("Worker {} cleared interrupt left by {}", name, assignment.item().label());
                }
                mailbox.add(new Supervisor.Reply<>(this, result));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker {} interrupted while idle, leaving the pool", name);
            mailbox.add(new Supervisor.Gone<>(this));
        }
        log.debug("Worker {} shutting down", name);
    }

    /**
     * Run the unit of work and classify what happened. Never throws.
     */
    WorkResult<J> execute(WorkItem<J> item) {
        try {
            Object payload = unitOfWork.execute(item);
            return new WorkResult<>(item, Outcome.success(payload));
        } catch (Throwable t) {
            if (DatabaseExceptionClassifier.isStatementTimeout(t)) {
                log.debug("Worker {} timed out on {} after {}s", name, item.label(), item.timeout().toSeconds());
                return new WorkResult<>(item, Outcome.timeout(t));
            }
            log.debug("Worker {} failed on {} (sqlState={}, transient={}): {}", name, item.label(),
                DatabaseExceptionClassifier.getSqlState(t), DatabaseExceptionClassifier.getTransientReason(t), t.toString());
            return new WorkResult<>(item, Outcome.error(t));
        }
    }

    record Assignment<J extends Job>(WorkItem<J> item) {

        static <J extends Job> Assignment<J> stop() {
            return new Assignment<>(null);
        }

        boolean isStop() {
            return item == null;
        }
    }
}
