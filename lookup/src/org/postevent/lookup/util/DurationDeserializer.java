package org.postevent.lookup.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads a duration written as milliseconds ({@code 500}), with a unit ({@code 500ms}, {@code 30s},
 * {@code 2m}) or in ISO-8601 form ({@code PT30S}).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().trim().toUpperCase(Locale.ROOT);
        try {
            if (text.startsWith("P")) return Duration.parse(text);
            if (text.endsWith("MS")) return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            return Duration.parse("PT" + text);
        } catch (DateTimeParseException | NumberFormatException e) {
            return (Duration) deserializationContext.handleWeirdStringValue(Duration.class, jsonParser.getText(),
                    "expected a duration like 500ms, 30s or PT30S");
        }
    }
}
