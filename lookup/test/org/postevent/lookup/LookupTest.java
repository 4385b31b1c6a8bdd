package org.postevent.lookup;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.postevent.cdp.NavigationTimedOutException;
import org.postevent.cdp.Tab;
import org.postevent.cdp.protocol.AttachException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LookupTest {
    private final List<Tab> tabs = new CopyOnWriteArrayList<>();
    private final TabOpener opener = () -> {
        Tab tab = mock(Tab.class);
        tabs.add(tab);
        return tab;
    };

    @BeforeAll
    public static void warmUpMockito() {
        // the first mock is slow to create, keep that out of the timing below
        mock(Tab.class);
    }

    record SleepyExtractor(String id, String displayName, long millis, Exception failure) implements Extractor {
        @Override
        public Map<String, Object> extract(Tab tab, String query) throws Exception {
            Thread.sleep(millis);
            if (failure != null) throw failure;
            return Map.of("source", id, "query", query);
        }
    }

    @Test
    public void testOneFailingSourceOfThree() throws Exception {
        var timeout = new NavigationTimedOutException("https://ipinfo.io/8.8.8.8", "Page.loadEventFired",
                Duration.ofMillis(30000));
        var extractors = List.<Extractor>of(
                new SleepyExtractor("virustotal", "VirusTotal", 300, null),
                new SleepyExtractor("ipinfo", "IPInfo", 100, timeout),
                new SleepyExtractor("abuseipdb", "AbuseIPDB", 500, null));

        LookupResult result;
        try (var lookup = new Lookup(extractors, opener, 3)) {
            result = lookup.run("8.8.8.8");
        }

        assertEquals(List.of("virustotal", "ipinfo", "abuseipdb"),
                result.sources().stream().map(SourceResult::id).toList());
        assertEquals(2, result.successCount());
        assertEquals(Map.of("source", "virustotal", "query", "8.8.8.8"), result.sources().get(0).data());

        var failure = result.sources().get(1);
        assertFalse(failure.isSuccess());
        assertNull(failure.data());
        assertEquals("Failed to fetch data from IPInfo: Navigation timeout after 30000ms waiting for "
                     + "Page.loadEventFired for https://ipinfo.io/8.8.8.8", failure.error());
        assertEquals(ErrorType.TIMEOUT, failure.errorType());
        assertEquals("IPInfo took too long to respond", failure.userMessage());

        long elapsed = result.elapsed().toMillis();
        assertTrue(elapsed >= 500, "at least the slowest source, took " + elapsed + "ms");
        assertTrue(elapsed < 850, "sources ran concurrently, took " + elapsed + "ms");

        assertEquals(3, tabs.size());
        for (Tab tab : tabs) {
            verify(tab, times(1)).close();
        }
    }

    @Test
    public void testTabOpenFailure() throws Exception {
        var opened = new AtomicInteger();
        TabOpener flakyOpener = () -> {
            if (opened.incrementAndGet() == 2) {
                throw new AttachException("T2", "Failed to attach: No target with given id found [-32602]", null);
            }
            return opener.open();
        };
        var extractors = List.<Extractor>of(
                new SleepyExtractor("a", "A", 10, null),
                new SleepyExtractor("b", "B", 10, null));

        LookupResult result;
        try (var lookup = new Lookup(extractors, flakyOpener, 1)) {
            result = lookup.run("10.0.0.1");
        }

        assertEquals(1, result.successCount());
        var failure = result.failures().get(0);
        assertEquals("b", failure.id());
        assertEquals(ErrorType.DEBUGGER, failure.errorType());
        assertTrue(failure.error().startsWith("Failed to fetch data from B: Failed to attach"), failure.error());
        assertEquals(1, tabs.size());
        verify(tabs.get(0)).close();
    }

    @Test
    public void testExceptionWithoutMessage() throws Exception {
        var extractors = List.<Extractor>of(new SleepyExtractor("a", "A", 0, new IllegalStateException()));
        try (var lookup = new Lookup(extractors, opener, 1)) {
            var failure = lookup.run("1.1.1.1").sources().get(0);
            assertEquals("Failed to fetch data from A: Unknown error", failure.error());
            assertEquals(ErrorType.UNKNOWN, failure.errorType());
            assertEquals("A lookup failed", failure.userMessage());
        }
        verify(tabs.get(0)).close();
    }

    @Test
    public void testInvalidQuery() {
        var extractors = List.<Extractor>of(new SleepyExtractor("a", "A", 0, null));
        try (var lookup = new Lookup(extractors, opener, 1)) {
            assertThrows(IllegalArgumentException.class, () -> lookup.run("example.com"));
            assertThrows(IllegalArgumentException.class, () -> lookup.run(null));
        }
        assertTrue(tabs.isEmpty());
    }

    @Test
    public void testIsValidIpv4() {
        for (String valid : List.of("8.8.8.8", "0.0.0.0", "255.255.255.255", "192.168.001.1", "10.0.0.1")) {
            assertTrue(Lookup.isValidIpv4(valid), valid);
        }
        for (String invalid : List.of("256.1.1.1", "1.2.3", "1.2.3.4.5", "1.2.3.4 ", "a.b.c.d", "::1", "", "1..2.3")) {
            assertFalse(Lookup.isValidIpv4(invalid), invalid);
        }
    }

    @Test
    public void testBySource() {
        var ok = new SleepyExtractor("ok", "Ok", 0, null);
        var bad = new SleepyExtractor("bad", "Bad", 0, null);
        var result = new LookupResult("1.2.3.4", List.of(
                SourceResult.success(ok, Map.of("country", "AU"), Duration.ZERO),
                SourceResult.failure(bad, new RuntimeException("HTTP 403 blocked"), Duration.ZERO)),
                Duration.ZERO);
        var bySource = result.bySource();
        assertEquals(List.of("ok", "bad"), List.copyOf(bySource.keySet()));
        assertEquals(Map.of("country", "AU"), bySource.get("ok"));
        assertEquals(Map.of(
                "error", "Failed to fetch data from Bad: HTTP 403 blocked",
                "errorType", ErrorType.BLOCKED,
                "message", "Bad is blocking automated access"), bySource.get("bad"));
    }
}
