package org.postevent.lookup.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.postevent.lookup.util.DurationDeserializer;

import java.time.Duration;
import java.util.Map;

/**
 * A source read by {@link org.postevent.lookup.TemplateExtractor}.
 *
 * @param id      key of the source in results
 * @param name    name shown to users
 * @param url     page to load, {@code {query}} is replaced with the URL-encoded query
 * @param waitFor selector to wait for after loading, for pages that render client-side
 * @param pause   extra time to give the page after loading
 * @param fields  output field name to where on the page to read it from
 */
public record SourceConfig(
        String id,
        String name,
        String url,
        @Nullable String waitFor,
        @JsonDeserialize(using = DurationDeserializer.class)
        @Nullable Duration pause,
        Map<String, FieldConfig> fields
) {
}
