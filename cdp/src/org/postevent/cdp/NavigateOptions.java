package org.postevent.cdp;

import java.time.Duration;
import java.util.Objects;

/**
 * @param timeout   how long to wait for the {@code waitUntil} event, counted from the start of the call
 * @param waitUntil the event that ends the navigation
 * @param settle    fixed pause after the event to let client-side rendering catch up
 */
public record NavigateOptions(Duration timeout, WaitUntil waitUntil, Duration settle) {
    public static final NavigateOptions DEFAULTS = new NavigateOptions(Duration.ofSeconds(30), WaitUntil.LOAD,
            Duration.ofMillis(500));

    public NavigateOptions {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(waitUntil, "waitUntil");
        Objects.requireNonNull(settle, "settle");
        if (timeout.isNegative()) throw new IllegalArgumentException("negative timeout: " + timeout);
        if (settle.isNegative()) throw new IllegalArgumentException("negative settle: " + settle);
    }

    public NavigateOptions withTimeout(Duration timeout) {
        return new NavigateOptions(timeout, waitUntil, settle);
    }

    public NavigateOptions withWaitUntil(WaitUntil waitUntil) {
        return new NavigateOptions(timeout, waitUntil, settle);
    }

    public NavigateOptions withSettle(Duration settle) {
        return new NavigateOptions(timeout, waitUntil, settle);
    }
}
