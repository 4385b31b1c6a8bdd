package org.postevent.cdp;

import org.junit.jupiter.api.Test;
import org.postevent.cdp.protocol.RPC;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class NavigateOptionsTest {

    @Test
    public void testDefaults() {
        assertEquals(Duration.ofSeconds(30), NavigateOptions.DEFAULTS.timeout());
        assertEquals(WaitUntil.LOAD, NavigateOptions.DEFAULTS.waitUntil());
        assertEquals(Duration.ofMillis(500), NavigateOptions.DEFAULTS.settle());
        assertEquals(Duration.ofSeconds(10), WaitOptions.DEFAULTS.timeout());
        assertEquals(Duration.ofMillis(100), WaitOptions.DEFAULTS.interval());
    }

    @Test
    public void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> NavigateOptions.DEFAULTS.withTimeout(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> NavigateOptions.DEFAULTS.withSettle(Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> NavigateOptions.DEFAULTS.withWaitUntil(null));
        assertThrows(IllegalArgumentException.class, () -> new WaitOptions(Duration.ofSeconds(1), Duration.ZERO));
    }

    @Test
    public void testWaitUntil() throws Exception {
        assertEquals("Page.loadEventFired", WaitUntil.LOAD.eventName());
        assertEquals("Page.domContentEventFired", WaitUntil.DOM_CONTENT_LOADED.eventName());
        assertEquals(WaitUntil.DOM_CONTENT_LOADED, RPC.JSON.readValue("\"domcontentloaded\"", WaitUntil.class));
        assertEquals("\"load\"", RPC.JSON.writeValueAsString(WaitUntil.LOAD));
    }
}
