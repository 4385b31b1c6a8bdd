package org.postevent.cdp;

import java.time.Duration;
import java.util.Objects;

/**
 * @param timeout  give up once this much time has passed since the first check
 * @param interval pause between checks
 */
public record WaitOptions(Duration timeout, Duration interval) {
    public static final WaitOptions DEFAULTS = new WaitOptions(Duration.ofSeconds(10), Duration.ofMillis(100));

    public WaitOptions {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(interval, "interval");
        if (timeout.isNegative()) throw new IllegalArgumentException("negative timeout: " + timeout);
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
    }

    public static WaitOptions of(Duration timeout) {
        return new WaitOptions(timeout, DEFAULTS.interval());
    }
}
