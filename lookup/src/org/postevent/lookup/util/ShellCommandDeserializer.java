package org.postevent.lookup.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Accepts a command line either as a list or as one string split like a shell would
 * ({@code "ssh 'user@host'"} becomes {@code ["ssh", "user@host"]}). Quotes group, there are no escapes.
 */
public class ShellCommandDeserializer extends JsonDeserializer<List<String>> {
    @Override
    public List<String> deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        JsonNode node = jsonParser.getCodec().readTree(jsonParser);
        if (node.isTextual()) {
            return split(node.asText());
        }
        if (node.isArray()) {
            var tokens = new ArrayList<String>(node.size());
            node.forEach(element -> tokens.add(element.asText()));
            return tokens;
        }
        throw new JsonMappingException(jsonParser, "Expected a command line string or a list of arguments, got: " + node);
    }

    static List<String> split(String commandLine) throws IOException {
        var tokens = new ArrayList<String>();
        var token = new StringBuilder();
        char quote = 0;
        boolean inToken = false;
        for (char c : commandLine.toCharArray()) {
            if (quote != 0) {
                if (c == quote) quote = 0;
                else token.append(c);
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(token.toString());
                    token.setLength(0);
                    inToken = false;
                }
            } else {
                token.append(c);
                inToken = true;
            }
        }
        if (quote != 0) throw new IOException("Unterminated quote in: " + commandLine);
        if (inToken) tokens.add(token.toString());
        return tokens;
    }
}
