package org.postevent.lookup.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.postevent.lookup.util.ShellCommandDeserializer;

import java.util.List;

/**
 * @param executable binary to run, or null to look for a well-known Chrome or Chromium
 * @param options    extra command-line options
 * @param shell      command to run the browser through (e.g. "ssh user@host"), or null for a local browser
 */
public record BrowserConfig(
        @Nullable String executable,
        @JsonDeserialize(using = ShellCommandDeserializer.class)
        List<String> options,
        @JsonDeserialize(using = ShellCommandDeserializer.class)
        @Nullable List<String> shell
) {
}
