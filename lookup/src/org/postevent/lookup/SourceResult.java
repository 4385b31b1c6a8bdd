package org.postevent.lookup;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of one source. Exactly one of {@code data} and {@code error} is set.
 *
 * @param id          the extractor's id
 * @param source      the extractor's display name
 * @param data        extracted fields, on success
 * @param error       "Failed to fetch data from ..." with the reason, on failure
 * @param errorType   classification of the failure
 * @param userMessage short explanation for users, on failure
 * @param elapsed     time spent on this source including opening and closing its tab
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceResult(
        String id,
        String source,
        Map<String, Object> data,
        String error,
        ErrorType errorType,
        String userMessage,
        @JsonIgnore Duration elapsed) {

    public static SourceResult success(Extractor extractor, Map<String, Object> data, Duration elapsed) {
        return new SourceResult(extractor.id(), extractor.displayName(), data, null, null, null, elapsed);
    }

    public static SourceResult failure(Extractor extractor, Throwable cause, Duration elapsed) {
        String reason = cause.getMessage() == null ? "Unknown error" : cause.getMessage();
        ErrorType type = ErrorType.classify(cause);
        return new SourceResult(extractor.id(), extractor.displayName(), null,
                "Failed to fetch data from " + extractor.displayName() + ": " + reason,
                type, type.userMessage(extractor.displayName()), elapsed);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
