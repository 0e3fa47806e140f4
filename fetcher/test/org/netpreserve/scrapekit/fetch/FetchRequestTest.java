package org.netpreserve.scrapekit.fetch;

import org.junit.jupiter.api.Test;
import org.netpreserve.scrapekit.ConfigurationException;

import java.net.URI;
import java.util.LinkedHashMap;

import static org.junit.jupiter.api.Assertions.*;

class FetchRequestTest {
    private static final URI BASE = URI.create("https://example.org/catalog/");

    @Test
    void resolvesAgainstBaseUrl() {
        assertEquals(URI.create("https://example.org/catalog/items"), FetchRequest.of("items").resolve(BASE));
        assertEquals(URI.create("https://example.org/about"), FetchRequest.of("/about").resolve(BASE));
        assertEquals(URI.create("http://other.example/"), FetchRequest.of("http://other.example/").resolve(BASE));
    }

    @Test
    void appendsParamsInOrderBeforeFragment() {
        var params = new LinkedHashMap<String, String>();
        params.put("page", "2");
        params.put("q", "red & blue");
        params.put("empty", null);
        assertEquals(URI.create("https://example.org/search?page=2&q=red+%26+blue&empty=#results"),
                FetchRequest.of("/search#results").withParams(params).resolve(BASE));
        assertEquals(URI.create("https://example.org/search?sort=asc&page=2&q=red+%26+blue&empty="),
                FetchRequest.of("/search?sort=asc").withParams(params).resolve(BASE));
    }

    @Test
    void rejectsUnusableUrls() {
        assertThrows(ConfigurationException.class, () -> FetchRequest.of("relative").resolve(null));
        assertThrows(ConfigurationException.class, () -> FetchRequest.of("mailto:someone@example.org").resolve(BASE));
        assertThrows(ConfigurationException.class, () -> FetchRequest.of("http://bad host/").resolve(BASE));
        assertThrows(ConfigurationException.class, () -> FetchRequest.of("http://under_score/x").resolve(BASE));
        assertThrows(ConfigurationException.class, () -> FetchRequest.of("https:///path").resolve(BASE));
        assertThrows(ConfigurationException.class, () -> FetchRequest.of(" "));
    }
}
