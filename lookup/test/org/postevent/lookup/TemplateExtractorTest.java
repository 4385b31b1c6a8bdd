package org.postevent.lookup;

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.postevent.cdp.NavigateOptions;
import org.postevent.cdp.NavigationFailedException;
import org.postevent.cdp.Tab;
import org.postevent.cdp.WaitOptions;
import org.postevent.lookup.config.FieldConfig;
import org.postevent.lookup.config.SourceConfig;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class TemplateExtractorTest {
    private static final NavigateOptions NAVIGATE = NavigateOptions.DEFAULTS.withTimeout(Duration.ofSeconds(5));
    private static final WaitOptions WAIT = WaitOptions.of(Duration.ofSeconds(2));

    private static SourceConfig source(String waitFor, Duration pause, Map<String, FieldConfig> fields) {
        return new SourceConfig("example", "Example", "https://example.com/ip/{query}?full=1", waitFor, pause, fields);
    }

    @Test
    public void testExtract() throws Exception {
        var fields = new LinkedHashMap<String, FieldConfig>();
        fields.put("title", FieldConfig.of("title"));
        fields.put("asn", new FieldConfig("a.asn", "href", false));
        fields.put("tags", new FieldConfig(".tag", null, true));
        fields.put("missing", FieldConfig.of("#nothing"));
        var extractor = new TemplateExtractor(source("#report", Duration.ofMillis(250), fields), NAVIGATE, WAIT);

        Tab tab = mock(Tab.class);
        when(tab.getText("title")).thenReturn("8.8.8.8 details");
        when(tab.getAttribute("a.asn", "href")).thenReturn("/AS15169");
        when(tab.getTextAll(".tag")).thenReturn(List.of("dns", "anycast"));

        var data = extractor.extract(tab, "8.8.8.8");

        assertEquals(List.of("title", "asn", "tags", "missing"), List.copyOf(data.keySet()));
        assertEquals("8.8.8.8 details", data.get("title"));
        assertEquals("/AS15169", data.get("asn"));
        assertEquals(List.of("dns", "anycast"), data.get("tags"));
        assertNull(data.get("missing"));

        InOrder order = inOrder(tab);
        order.verify(tab).navigateTo("https://example.com/ip/8.8.8.8?full=1", NAVIGATE);
        order.verify(tab).waitForSelector("#report", WAIT);
        order.verify(tab).pause(Duration.ofMillis(250));
        order.verify(tab).getText("title");
        verify(tab, never()).close();
    }

    @Test
    public void testQueryIsUrlEncoded() {
        var extractor = new TemplateExtractor(source(null, null, Map.of()), NAVIGATE, WAIT);
        assertEquals("https://example.com/ip/a+b%26c%3Dd?full=1", extractor.urlFor("a b&c=d"));
    }

    @Test
    public void testOptionalStepsSkipped() throws Exception {
        var extractor = new TemplateExtractor(source(null, null, null), NAVIGATE, WAIT);
        Tab tab = mock(Tab.class);
        assertEquals(Map.of(), extractor.extract(tab, "1.1.1.1"));
        verify(tab, never()).waitForSelector(anyString(), any());
        verify(tab, never()).pause(any());
    }

    @Test
    public void testNavigationFailurePropagates() throws Exception {
        var extractor = new TemplateExtractor(source(null, null, Map.of("t", FieldConfig.of("title"))), NAVIGATE, WAIT);
        Tab tab = mock(Tab.class);
        doThrow(new NavigationFailedException("https://example.com/ip/1.1.1.1?full=1", "net::ERR_NAME_NOT_RESOLVED"))
                .when(tab).navigateTo(anyString(), any());
        assertThrows(NavigationFailedException.class, () -> extractor.extract(tab, "1.1.1.1"));
        verify(tab, never()).getText(anyString());
    }

    @Test
    public void testRejectsTemplateWithoutPlaceholder() {
        var source = new SourceConfig("x", "X", "https://example.com/", null, null, Map.of());
        assertThrows(IllegalArgumentException.class, () -> new TemplateExtractor(source, NAVIGATE, WAIT));
    }

    @Test
    public void testDisplayNameFallsBackToId() {
        var source = new SourceConfig("x", null, "https://example.com/{query}", null, null, Map.of());
        assertEquals("x", new TemplateExtractor(source, NAVIGATE, WAIT).displayName());
    }
}
