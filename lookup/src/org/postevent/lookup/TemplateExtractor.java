package org.postevent.lookup;

import org.postevent.cdp.NavigateOptions;
import org.postevent.cdp.Tab;
import org.postevent.cdp.WaitOptions;
import org.postevent.lookup.config.FieldConfig;
import org.postevent.lookup.config.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An extractor defined entirely by configuration: load a URL built from the query, optionally wait
 * for an element, then read each configured field.
 */
public class TemplateExtractor implements Extractor {
    private static final Logger log = LoggerFactory.getLogger(TemplateExtractor.class);
    private final SourceConfig source;
    private final NavigateOptions navigateOptions;
    private final WaitOptions waitOptions;

    public TemplateExtractor(SourceConfig source, NavigateOptions navigateOptions, WaitOptions waitOptions) {
        this.source = Objects.requireNonNull(source);
        this.navigateOptions = navigateOptions;
        this.waitOptions = waitOptions;
        if (source.id() == null || source.url() == null) {
            throw new IllegalArgumentException("Source needs an id and a url: " + source);
        }
        if (!source.url().contains("{query}")) {
            throw new IllegalArgumentException("Source " + source.id() + " url has no {query} placeholder");
        }
    }

    @Override
    public String id() {
        return source.id();
    }

    @Override
    public String displayName() {
        return source.name() == null ? source.id() : source.name();
    }

    String urlFor(String query) {
        return source.url().replace("{query}", URLEncoder.encode(query, StandardCharsets.UTF_8));
    }

    @Override
    public Map<String, Object> extract(Tab tab, String query) throws Exception {
        String url = urlFor(query);
        tab.navigateTo(url, navigateOptions);
        if (source.waitFor() != null) {
            tab.waitForSelector(source.waitFor(), waitOptions);
        }
        if (source.pause() != null) {
            tab.pause(source.pause());
        }
        var data = new LinkedHashMap<String, Object>();
        if (source.fields() != null) {
            source.fields().forEach((name, field) -> data.put(name, read(tab, field)));
        }
        log.debug("{} extracted {} fields from {}", displayName(), data.size(), url);
        return data;
    }

    private static Object read(Tab tab, FieldConfig field) {
        if (field.attribute() != null) return tab.getAttribute(field.selector(), field.attribute());
        if (field.all()) return tab.getTextAll(field.selector());
        return tab.getText(field.selector());
    }

    @Override
    public String toString() {
        return "TemplateExtractor[" + id() + "]";
    }
}
