package org.netpreserve.scrapekit.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DurationDeserializerTest {
    @Test
    void parse() {
        assertEquals(Optional.of(Duration.ofMillis(500)), DurationDeserializer.parse("500ms"));
        assertEquals(Optional.of(Duration.ofMillis(1500)), DurationDeserializer.parse("1.5s"));
        assertEquals(Optional.of(Duration.ofMinutes(2)), DurationDeserializer.parse("2m"));
        assertEquals(Optional.of(Duration.ofHours(1)), DurationDeserializer.parse("1H"));
        assertEquals(Optional.of(Duration.ofDays(1)), DurationDeserializer.parse("1d"));
        assertEquals(Optional.of(Duration.ofSeconds(30)), DurationDeserializer.parse("PT30S"));
        assertTrue(DurationDeserializer.parse("soon").isEmpty());
        assertTrue(DurationDeserializer.parse("P-nonsense").isEmpty());
    }

    @Test
    void shellWords() {
        assertEquals(List.of("--a", "b c", "it's"), ShellWordsDeserializer.split("--a 'b c' \"it's\""));
        assertThrows(IllegalArgumentException.class, () -> ShellWordsDeserializer.split("'open"));
    }
}
