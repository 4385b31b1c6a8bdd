package org.postevent.cdp.protocol;

/**
 * The connection to the browser was closed while a command or event wait was outstanding.
 */
public class CDPClosedException extends CDPException {
    public CDPClosedException() {
        super("CDP connection closed");
    }
}
