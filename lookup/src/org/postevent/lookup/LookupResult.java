package org.postevent.lookup;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param query   the looked up address
 * @param sources one result per extractor, in the order the extractors were configured
 * @param elapsed wall time of the whole lookup
 */
public record LookupResult(String query, List<SourceResult> sources, Duration elapsed) {

    /**
     * Results keyed by source id: the extracted data for successful sources, otherwise an object
     * holding {@code error}, {@code errorType} and {@code message}.
     */
    public Map<String, Object> bySource() {
        var map = new LinkedHashMap<String, Object>();
        for (var result : sources) {
            if (result.isSuccess()) {
                map.put(result.id(), result.data());
            } else {
                var error = new LinkedHashMap<String, Object>();
                error.put("error", result.error());
                error.put("errorType", result.errorType());
                error.put("message", result.userMessage());
                map.put(result.id(), error);
            }
        }
        return map;
    }

    public long successCount() {
        return sources.stream().filter(SourceResult::isSuccess).count();
    }

    public List<SourceResult> failures() {
        return sources.stream().filter(result -> !result.isSuccess()).toList();
    }
}
