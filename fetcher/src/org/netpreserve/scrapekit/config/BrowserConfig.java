package org.netpreserve.scrapekit.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.scrapekit.util.ShellWordsDeserializer;

import java.util.List;

/**
 * Browser transport settings.
 *
 * @param executable binary to run (e.g. "chromium"), or null to search the usual locations
 * @param options    extra command-line options
 * @param headless   run without a window
 */
public record BrowserConfig(
        String executable,
        @JsonDeserialize(using = ShellWordsDeserializer.class)
        List<String> options,
        boolean headless
) {
    public BrowserConfig {
        options = options == null ? List.of() : List.copyOf(options);
    }
}
