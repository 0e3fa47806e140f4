package org.netpreserve.scrapekit.rate;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class TargetTest {
    @Test
    void normalizesSchemeHostAndDefaultPort() {
        assertEquals(Target.of(URI.create("https://example.org/a")),
                Target.of(URI.create("HTTPS://Example.ORG:443/b?c")));
        assertEquals("https://example.org", Target.of(URI.create("https://example.org:443/")).authority());
        assertEquals("http://localhost:8080", Target.of(URI.create("http://localhost:8080/")).toString());
    }

    @Test
    void schemesAreDistinctTargets() {
        assertNotEquals(Target.of(URI.create("http://example.org/")), Target.of(URI.create("https://example.org/")));
    }

    @Test
    void relativeUrlRejected() {
        assertThrows(IllegalArgumentException.class, () -> Target.of(URI.create("/relative")));
    }
}
