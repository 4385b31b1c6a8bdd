package org.postevent.cdp.protocol;

/**
 * A target could not be created or a debugging session could not be attached to it.
 */
public class AttachException extends CDPException {
    private final String targetId;

    public AttachException(String targetId, String message, Throwable cause) {
        super(targetId == null ? message : message + " (target " + targetId + ")", cause);
        this.targetId = targetId;
        actuallyFillInStackTrace();
    }

    /**
     * The target involved, or null if it was never created.
     */
    public String targetId() {
        return targetId;
    }
}
