package org.postevent.cdp;

import java.time.Duration;

public class NavigationTimedOutException extends NavigationException {
    private final Duration elapsed;

    public NavigationTimedOutException(String url, String event, Duration elapsed) {
        super(url, "Navigation timeout after " + elapsed.toMillis() + "ms waiting for " + event);
        this.elapsed = elapsed;
    }

    public Duration elapsed() {
        return elapsed;
    }
}
