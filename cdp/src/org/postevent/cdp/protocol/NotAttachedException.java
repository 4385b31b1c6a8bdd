package org.postevent.cdp.protocol;

/**
 * A command was issued on a session that is not (or no longer) attached to its target.
 */
public class NotAttachedException extends CDPException {
    private final String targetId;

    public NotAttachedException(String targetId) {
        super("Session not attached to target " + targetId);
        this.targetId = targetId;
    }

    public String targetId() {
        return targetId;
    }
}
