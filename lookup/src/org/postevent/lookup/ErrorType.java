package org.postevent.lookup;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.postevent.cdp.NavigationFailedException;
import org.postevent.cdp.NavigationTimedOutException;
import org.postevent.cdp.protocol.AttachException;
import org.postevent.cdp.protocol.CDPClosedException;
import org.postevent.cdp.protocol.CDPTimeoutException;
import org.postevent.cdp.protocol.NotAttachedException;

import java.util.Locale;

/**
 * Broad category of a failed lookup, used to pick a message a user can act on.
 */
public enum ErrorType {
    TIMEOUT,
    NETWORK,
    BLOCKED,
    PARSE,
    DEBUGGER,
    UNKNOWN;

    /**
     * Classifies by exception type where that is conclusive, otherwise by keywords in the message.
     */
    public static ErrorType classify(Throwable error) {
        if (error instanceof CDPTimeoutException || error instanceof NavigationTimedOutException) return TIMEOUT;
        if (error instanceof NavigationFailedException failed && failed.errorText() != null
            && failed.errorText().startsWith("net::")) return NETWORK;
        if (error instanceof AttachException || error instanceof NotAttachedException
            || error instanceof CDPClosedException) return DEBUGGER;
        if (error instanceof JsonProcessingException) return PARSE;
        return classify(error.getMessage());
    }

    static ErrorType classify(String message) {
        if (message == null) return UNKNOWN;
        message = message.toLowerCase(Locale.ROOT);
        if (message.contains("timeout") || message.contains("timed out")) return TIMEOUT;
        if (message.contains("net::") || message.contains("network")) return NETWORK;
        if (message.contains("captcha") || message.contains("blocked") || message.contains("403")) return BLOCKED;
        if (message.contains("parse") || message.contains("json")) return PARSE;
        if (message.contains("debugger") || message.contains("attach")) return DEBUGGER;
        return UNKNOWN;
    }

    public String userMessage(String source) {
        return switch (this) {
            case TIMEOUT -> source + " took too long to respond";
            case NETWORK -> "Could not connect to " + source;
            case BLOCKED -> source + " is blocking automated access";
            case PARSE -> "Failed to read " + source + " data";
            case DEBUGGER -> "Browser automation failed, try restarting the browser";
            case UNKNOWN -> source + " lookup failed";
        };
    }
}
