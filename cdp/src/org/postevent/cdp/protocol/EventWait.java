package org.postevent.cdp.protocol;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A pending wait for the first event matching a set of method names. The listener is registered
 * when this object is created and removed when {@link #await(Duration)} returns or throws, or when
 * {@link #close()} is called, whichever happens first.
 *
 * @see CDPBase#expectEvent(java.util.Collection)
 */
public final class EventWait implements AutoCloseable {
    private final Set<String> methods;
    private final CompletableFuture<RPC.Event> future;
    private final Subscription subscription;

    EventWait(Set<String> methods, CompletableFuture<RPC.Event> future, Subscription subscription) {
        this.methods = methods;
        this.future = future;
        this.subscription = subscription;
        future.whenComplete((event, ex) -> subscription.close());
    }

    /**
     * Blocks until a matching event arrives.
     *
     * @throws CDPTimeoutException if none arrives within {@code timeout}
     * @throws NotAttachedException if the session closes first
     */
    public RPC.Event await(Duration timeout) throws InterruptedException {
        long start = System.nanoTime();
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new CDPTimeoutException("Timed out waiting for " + String.join(" or ", methods),
                    Duration.ofNanos(System.nanoTime() - start));
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CDPException cdpException) {
                cdpException.actuallyFillInStackTrace();
                throw cdpException;
            }
            throw new RuntimeException(e.getCause());
        } finally {
            subscription.close();
        }
    }

    @Override
    public void close() {
        subscription.close();
        future.cancel(false);
    }
}
