package org.postevent.lookup.config;

import java.util.List;

/**
 * Root configuration.
 *
 * @param browser    which browser to drive and how to start it
 * @param navigation defaults for every source's page load
 * @param workers    how many sources may run at once
 * @param sources    the sources to query, in the order results are reported
 */
public record LookupConfig(
        BrowserConfig browser,
        NavigationConfig navigation,
        int workers,
        List<SourceConfig> sources
) {
}
