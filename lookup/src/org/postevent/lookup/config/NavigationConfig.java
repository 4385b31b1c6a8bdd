package org.postevent.lookup.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.postevent.cdp.NavigateOptions;
import org.postevent.cdp.WaitOptions;
import org.postevent.cdp.WaitUntil;
import org.postevent.lookup.util.DurationDeserializer;

import java.time.Duration;

/**
 * @param timeout     how long a page may take to load
 * @param waitUntil   {@code load} or {@code domcontentloaded}
 * @param settle      pause after the load event
 * @param waitTimeout how long to poll for a source's {@code waitFor} selector
 */
public record NavigationConfig(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        WaitUntil waitUntil,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration settle,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration waitTimeout
) {
    public NavigateOptions toNavigateOptions() {
        return new NavigateOptions(timeout, waitUntil, settle);
    }

    public WaitOptions toWaitOptions() {
        return WaitOptions.of(waitTimeout);
    }
}
