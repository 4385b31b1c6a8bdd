package org.postevent.cdp;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.postevent.cdp.domains.Page;
import org.postevent.cdp.protocol.CDPBase;

/**
 * Which page event marks a navigation as finished.
 */
public enum WaitUntil {
    @JsonProperty("load")
    LOAD(Page.LoadEventFired.class),
    @JsonProperty("domcontentloaded")
    DOM_CONTENT_LOADED(Page.DomContentEventFired.class);

    private final String eventName;

    WaitUntil(Class<?> eventClass) {
        this.eventName = CDPBase.eventName(eventClass);
    }

    public String eventName() {
        return eventName;
    }
}
