package org.postevent.lookup.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Where to read one output field. Written either as a bare selector string, for the element's text,
 * or as an object.
 *
 * @param selector  CSS selector of the element
 * @param attribute attribute to read instead of the text
 * @param all       read the text of every matching element as a list
 */
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
public record FieldConfig(String selector, @Nullable String attribute, boolean all) {
    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public FieldConfig(@JsonProperty("selector") String selector,
                       @JsonProperty("attribute") @Nullable String attribute,
                       @JsonProperty("all") boolean all) {
        this.selector = Objects.requireNonNull(selector, "selector");
        this.attribute = attribute;
        this.all = all;
        if (all && attribute != null) {
            throw new IllegalArgumentException("'all' can't be combined with 'attribute' for " + selector);
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static FieldConfig of(String selector) {
        return new FieldConfig(selector, null, false);
    }
}
