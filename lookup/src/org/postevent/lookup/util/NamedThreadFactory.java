package org.postevent.lookup.util;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon threads named {@code name-1}, {@code name-2} and so on.
 */
public class NamedThreadFactory implements ThreadFactory {
    private final String name;
    private final AtomicInteger seq = new AtomicInteger();

    public NamedThreadFactory(String name) {
        this.name = name;
    }

    @Override
    public Thread newThread(@NotNull Runnable r) {
        Thread thread = new Thread(r, name + "-" + seq.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }
}
