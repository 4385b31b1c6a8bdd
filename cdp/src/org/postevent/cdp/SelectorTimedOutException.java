package org.postevent.cdp;

import org.postevent.cdp.protocol.CDPTimeoutException;

import java.time.Duration;

public class SelectorTimedOutException extends CDPTimeoutException {
    private final String selector;

    public SelectorTimedOutException(String selector, Duration elapsed) {
        super("Timeout waiting for selector: " + selector, elapsed);
        this.selector = selector;
    }

    public String selector() {
        return selector;
    }
}
