package org.postevent.lookup.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the bundled defaults.yaml and overlays a user's configuration file on top of it.
 */
public final class ConfigLoader {
    public static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private ConfigLoader() {
    }

    public static LookupConfig load(@Nullable Path configFile) throws IOException {
        JsonNode tree = defaults();
        if (configFile != null) {
            if (!Files.exists(configFile)) throw new IOException("Config file not found: " + configFile);
            tree = deepMerge(tree, YAML.readTree(configFile.toFile()));
        }
        return YAML.treeToValue(tree, LookupConfig.class);
    }

    static JsonNode defaults() throws IOException {
        try (InputStream stream = ConfigLoader.class.getResourceAsStream("defaults.yaml")) {
            if (stream == null) throw new IOException("defaults.yaml missing from classpath");
            return YAML.readTree(stream);
        }
    }

    /**
     * Objects are merged key by key, anything else (including lists) in {@code override} replaces
     * the base value.
     */
    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (override == null || override.isMissingNode() || override.isNull()) return base;
        if (!base.isObject() || !override.isObject()) {
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }
}
