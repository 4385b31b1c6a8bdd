package org.postevent.cdp.protocol;

/**
 * An error reported by the browser in reply to a command.
 */
public class CDPException extends RuntimeException {
    private final int code;

    public CDPException(int code, String message) {
        super(message + " [" + code + "]");
        this.code = code;
    }

    protected CDPException(String message) {
        super(message);
        this.code = 0;
    }

    protected CDPException(String message, Throwable cause) {
        super(message, cause);
        this.code = 0;
    }

    // Filled in by actuallyFillInStackTrace() only when rethrown on the caller's thread.
    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }

    public void actuallyFillInStackTrace() {
        super.fillInStackTrace();
    }

    public int getCode() {
        return code;
    }
}
