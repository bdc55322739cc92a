package com.ivamare.bulkload.pool;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Close-once cancellation signal shared by a pool's supervisor and its callers.
 *
 * <p>Closing is idempotent. The first close notifies the supervisor, which stops
 * dispatching and broadcasts a stop to every worker once nothing is in flight.
 */
public final class KillSwitch {

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Runnable onClose;

    KillSwitch(Runnable onClose) {
        this.onClose = onClose;
    }

    /**
     * Close the switch.
     *
     * @return true if this call closed it, false if it was already closed
     */
    public boolean close() {
        if (closed.compareAndSet(false, true)) {
            onClose.run();
            return true;
        }
        return false;
    }

    public boolean isClosed() {
        return closed.get();
    }
}
