package org.postevent.cdp.protocol;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for a registered event listener. Closing it removes the listener; further closes are no-ops.
 */
public final class Subscription implements AutoCloseable {
    private final Runnable remover;
    private final AtomicBoolean closed = new AtomicBoolean();

    Subscription(Runnable remover) {
        this.remover = remover;
    }

    public boolean isActive() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            remover.run();
        }
    }
}
