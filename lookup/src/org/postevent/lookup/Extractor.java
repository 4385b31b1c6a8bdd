package org.postevent.lookup;

import org.postevent.cdp.Tab;

import java.util.Map;

/**
 * Pulls data about a query out of one web source. Called with a freshly opened tab that the caller
 * closes afterwards; implementations navigate it wherever they need.
 */
public interface Extractor {
    /**
     * Key of this source in lookup results, e.g. {@code ipinfo}.
     */
    String id();

    /**
     * Name shown to users, e.g. {@code IPInfo}.
     */
    String displayName();

    Map<String, Object> extract(Tab tab, String query) throws Exception;
}
