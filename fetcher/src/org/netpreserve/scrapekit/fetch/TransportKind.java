package org.netpreserve.scrapekit.fetch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.netpreserve.scrapekit.ConfigurationException;

import java.util.Locale;

public enum TransportKind {
    /**
     * Plain HTTP requests. Cheap, no JavaScript.
     */
    HTTP,
    /**
     * A headless browser tab per request. Renders JavaScript.
     */
    BROWSER;

    @JsonCreator
    public static TransportKind fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown transport '" + value + "' (expected http or browser)");
        }
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
