package com.ivamare.bulkload.pool;

import com.ivamare.bulkload.exception.DatabaseExceptionClassifier;
import com.ivamare.bulkload.exception.UnrecoverableConditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Single-threaded owner of a pool's {@link Signals}.
 *
 * <p>The supervisor reacts to four kinds of message on its mailbox: a worker
 * becoming ready, a worker reply, a worker leaving, and the kill signal. Whenever a worker is
 * idle and work is pending it hands the head of the queue over. Replies are
 * passed to the finalize policy, whose follow-up work is appended to the queue.
 *
 * <p>Shutdown happens in one of three ways:
 * <ul>
 *   <li>quiescence (nothing pending or in flight) closes the kill switch and completes</li>
 *   <li>an external kill cancels pending work and drains in-flight replies</li>
 *   <li>an unrecoverable decision cancels pending work and abandons in-flight work</li>
 * </ul>
 * In every case the supervisor is the one that tells the workers to stop.
 */
final class Supervisor<J extends Job> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    private final String name;
    private final Signals<J> signals;
    private final FinalizePolicy<J> finalizePolicy;
    private final BlockingQueue<Message<J>> mailbox = new LinkedBlockingQueue<>();
    private final KillSwitch killSwitch = new KillSwitch(() -> mailbox.add(new Kill<>()));

    private final List<PoolWorker<J>> workers = new ArrayList<>();
    private final Deque<PoolWorker<J>> idle = new ArrayDeque<>();
    private final Map<PoolWorker<J>, WorkItem<J>> assigned = new IdentityHashMap<>();

    private boolean draining;
    private int live;

    Supervisor(String name, Signals<J> signals, FinalizePolicy<J> finalizePolicy) {
        this.name = name;
        this.signals = signals;
        this.finalizePolicy = finalizePolicy;
    }

    BlockingQueue<Message<J>> mailbox() {
        return mailbox;
    }

    KillSwitch killSwitch() {
        return killSwitch;
    }

    void register(PoolWorker<J> worker) {
        workers.add(worker);
    }

    @Override
    public void run() {
        signals.bindOwner(Thread.currentThread());
        log.info("Supervisor {} starting with {} workers and {} pending items",
            name, workers.size(), signals.snapshot().pending().size());
        live = workers.size();

        try {
            loop();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Supervisor {} interrupted, aborting", name);
            abort();
        } catch (RuntimeException e) {
            log.error("Supervisor {} crashed", name, e);
            abort();
        } finally {
            workers.forEach(PoolWorker::stop);
            killSwitch.close();
        }

        SignalsSnapshot<J> last = signals.snapshot();
        log.info("Supervisor {} finished: state={}, landed={}, failed={}, cancelled={}, abandoned={}",
            name, last.state(), last.landed(), last.failCount(),
            last.cancelled().size(), last.abandoned().size());
    }

    private void loop() throws InterruptedException {
        while (true) {
            dispatchIdle();

            if (!draining && signals.isQuiescent()) {
                log.info("Supervisor {} has no more work", name);
                signals.transition(PoolState.COMPLETED);
                return;
            }
            if (draining && signals.inFlight() == 0) {
                log.info("Supervisor {} drained", name);
                signals.transition(PoolState.KILLED);
                return;
            }

            Message<J> message = mailbox.take();
            if (message instanceof Ready<J> ready) {
                idle.add(ready.worker());
            } else if (message instanceof Reply<J> reply) {
                idle.add(reply.worker());
                if (!handleReply(reply)) {
                    abort();
                    return;
                }
            } else if (message instanceof Gone<J> gone) {
                if (!onGone(gone.worker())) {
                    abort();
                    return;
                }
            } else if (message instanceof Kill<?>) {
                onKill();
            }
        }
    }

    private void dispatchIdle() {
        while (!draining && !idle.isEmpty() && signals.hasPending()) {
            WorkItem<J> next = signals.dispatch();
            PoolWorker<J> worker = idle.poll();
            assigned.put(worker, next);
            log.debug("Supervisor {} -> {} {}", name, worker.name(), next);
            worker.assign(next);
        }
    }

    private void onKill() {
        if (draining || signals.state().isTerminal()) {
            return;
        }
        draining = true;
        signals.transition(PoolState.DRAINING);
        int cancelled = signals.cancelPending();
        log.info("Supervisor {} shutting down: cancelled {} pending items, waiting for {} in flight",
            name, cancelled, signals.inFlight());
    }

    /**
     * A worker was interrupted while idle and will take no more work. Anything
     * assigned to it in the meantime is replied to as an error.
     *
     * @return false if the pool cannot make progress any more
     */
    private boolean onGone(PoolWorker<J> worker) {
        idle.remove(worker);
        live--;
        log.warn("Supervisor {} lost worker {}, {} left", name, worker.name(), live);

        WorkItem<J> stranded = assigned.get(worker);
        if (stranded != null) {
            InterruptedException cause = new InterruptedException("worker " + worker.name() + " left the pool");
            if (!handleReply(new Reply<>(worker, new WorkResult<>(stranded, Outcome.error(cause))))) {
                return false;
            }
        }

        if (live == 0 && !draining && signals.hasPending()) {
            log.error("Supervisor {} has no workers left for {} pending items", name, signals.snapshot().pending().size());
            return false;
        }
        return true;
    }

    /**
     * @return false if finalize reported an unrecoverable condition
     */
    private boolean handleReply(Reply<J> reply) {
        WorkResult<J> result = reply.result();
        assigned.remove(reply.worker());
        log.debug("Supervisor {} <- {} {} {}", name, reply.worker().name(), result.item(), result.status());

        signals.land(result);
        Decision<J> decision = decide(result);

        // an unsuccessful attempt that nothing follows up on must stay visible in retryItems
        if ((result.status() != OutcomeStatus.SUCCESS && decision.followUps().isEmpty()) || decision.failed()) {
            signals.recordFailure(result);
            Throwable cause = result.outcome().cause();
            if (DatabaseExceptionClassifier.isTransient(cause)) {
                log.warn("Supervisor {} recorded terminal {} of {} on a transient error ({}), a resumed run may succeed: {}",
                    name, result.status(), result.item(), DatabaseExceptionClassifier.getTransientReason(cause), describe(cause));
            } else {
                log.warn("Supervisor {} recorded terminal {} of {}: {}", name, result.status(), result.item(), describe(cause));
            }
        }

        if (decision.unrecoverable()) {
            log.error("Supervisor {} unrecoverable condition after {}: {}",
                name, result.item(), decision.reason());
            return false;
        }

        List<WorkItem<J>> followUps = decision.followUps();
        if (!followUps.isEmpty()) {
            if (draining) {
                log.debug("Supervisor {} cancelling follow-ups {}", name, followUps);
                signals.cancel(followUps);
            } else {
                log.debug("Supervisor {} ++ {}", name, followUps);
                signals.enqueue(followUps);
            }
        }
        return true;
    }

    private Decision<J> decide(WorkResult<J> result) {
        try {
            Decision<J> decision = finalizePolicy.apply(result, signals);
            if (decision == null) {
                return Decision.unrecoverable("finalize policy returned no decision");
            }
            return decision;
        } catch (UnrecoverableConditionException e) {
            return Decision.unrecoverable(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Supervisor {} finalize policy failed on {}", name, result.item(), e);
            return Decision.unrecoverable("finalize policy failed: " + e);
        }
    }

    private void abort() {
        if (signals.state().isTerminal()) {
            return;
        }
        int cancelled = signals.cancelPending();
        signals.abandon(List.copyOf(assigned.values()));
        signals.transition(PoolState.ABORTED);
        log.error("Supervisor {} aborted: cancelled {} pending items, abandoned {} in flight",
            name, cancelled, assigned.size());
    }

    private static String describe(Throwable cause) {
        return cause == null ? "no error" : cause.toString();
    }

    // --- Mailbox messages ---

    interface Message<J extends Job> {}

    record Ready<J extends Job>(PoolWorker<J> worker) implements Message<J> {}

    record Reply<J extends Job>(PoolWorker<J> worker, WorkResult<J> result) implements Message<J> {}

    record Gone<J extends Job>(PoolWorker<J> worker) implements Message<J> {}

    record Kill<J extends Job>() implements Message<J> {}
}
