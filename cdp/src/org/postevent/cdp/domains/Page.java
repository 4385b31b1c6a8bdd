package org.postevent.cdp.domains;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.postevent.cdp.protocol.Subscription;
import org.postevent.cdp.protocol.Unwrap;

import java.util.Objects;
import java.util.function.Consumer;

public interface Page {
    Navigate navigate(String url);

    void enable();

    @Unwrap("identifier")
    ScriptIdentifier addScriptToEvaluateOnNewDocument(String source);

    void removeScriptToEvaluateOnNewDocument(ScriptIdentifier identifier);

    Subscription onLoadEventFired(Consumer<LoadEventFired> handler);

    /**
     * @param errorText set when the navigation failed outright, e.g. {@code net::ERR_NAME_NOT_RESOLVED}
     */
    record Navigate(String frameId, String loaderId, String errorText) {
    }

    record ScriptIdentifier(@JsonValue String value) {
        @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
        public ScriptIdentifier {
            Objects.requireNonNull(value);
        }
    }

    record LoadEventFired(double timestamp) {
    }

    record DomContentEventFired(double timestamp) {
    }
}
