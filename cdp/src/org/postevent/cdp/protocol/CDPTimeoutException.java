package org.postevent.cdp.protocol;

import java.time.Duration;

public class CDPTimeoutException extends CDPException {
    private final Duration elapsed;

    public CDPTimeoutException(String message) {
        this(message, null);
    }

    public CDPTimeoutException(String message, Duration elapsed) {
        super(elapsed == null ? message : message + " after " + elapsed.toMillis() + "ms");
        this.elapsed = elapsed;
        actuallyFillInStackTrace();
    }

    /**
     * How long the caller waited before giving up, or null if unknown.
     */
    public Duration elapsed() {
        return elapsed;
    }
}
