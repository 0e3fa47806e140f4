package org.netpreserve.scrapekit.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads a duration given as a number of milliseconds or a string like {@code 500ms}, {@code 1.5s}, {@code 2m},
 * {@code 1h} or ISO-8601 {@code PT30S}.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    private static final Pattern DURATION_PATTERN =
            Pattern.compile("(?i)\\s*(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h|d)\\s*");

    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext context) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText();
        return parse(text).orElseThrow(() -> new InvalidFormatException(jsonParser,
                "Invalid duration: " + text, text, Duration.class));
    }

    public static Optional<Duration> parse(String text) {
        if (text.trim().toUpperCase(Locale.ROOT).startsWith("P")) {
            try {
                return Optional.of(Duration.parse(text.trim().toUpperCase(Locale.ROOT)));
            } catch (RuntimeException e) {
                return Optional.empty();
            }
        }
        var matcher = DURATION_PATTERN.matcher(text);
        if (!matcher.matches()) return Optional.empty();
        double value = Double.parseDouble(matcher.group(1));
        double millisPerUnit = switch (matcher.group(2).toLowerCase(Locale.ROOT)) {
            case "ms" -> 1;
            case "s" -> 1000;
            case "m" -> 60_000;
            case "h" -> 3_600_000;
            default -> 86_400_000;
        };
        return Optional.of(Duration.ofMillis(Math.round(value * millisPerUnit)));
    }
}
