package org.postevent.cdp.domains;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.postevent.cdp.protocol.RPC;

import java.io.UncheckedIOException;

public interface Runtime {
    Evaluate evaluate(String expression, boolean returnByValue, boolean awaitPromise);

    void enable();

    record Evaluate(RemoteObject result, ExceptionDetails exceptionDetails) {
    }

    record RemoteObject(String type, String subtype, JsonNode value, String description) {
        /**
         * Converts a by-value result to String, Boolean, Number, List or Map. Returns null for
         * undefined and null.
         */
        public Object toJavaObject() {
            if ("undefined".equals(type) || value == null || value.isNull()) return null;
            try {
                return RPC.JSON.treeToValue(value, Object.class);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    record ExceptionDetails(int exceptionId, String text, int lineNumber, int columnNumber, RemoteObject exception) {
        /**
         * The thrown value's description (usually message and stack), falling back to the summary text.
         */
        public String describe() {
            if (exception != null && exception.description() != null) return exception.description();
            if (exception != null && exception.value() != null && !exception.value().isNull()) {
                return text + " " + exception.value().asText();
            }
            return text;
        }
    }
}
