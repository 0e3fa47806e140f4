package org.netpreserve.scrapekit.util;

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
 * Reads browser command-line options given either as a list or as one string split on whitespace with
 * single and double quotes grouping words, e.g. {@code --lang=en "--user-agent=My Agent"}.
 */
public class ShellWordsDeserializer extends JsonDeserializer<List<String>> {
    @Override
    public List<String> deserialize(JsonParser jsonParser, DeserializationContext context) throws IOException, JacksonException {
        JsonNode node = jsonParser.getCodec().readTree(jsonParser);
        if (node.isArray()) {
            List<String> words = new ArrayList<>();
            node.forEach(element -> words.add(element.asText()));
            return words;
        }
        if (node.isTextual()) {
            try {
                return split(node.asText());
            } catch (IllegalArgumentException e) {
                throw new JsonMappingException(jsonParser, e.getMessage(), e);
            }
        }
        throw new JsonMappingException(jsonParser, "Expected a string or list of strings but got " + node.getNodeType());
    }

    public static List<String> split(String line) {
        List<String> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        boolean inWord = false;
        char quote = 0;
        for (char c : line.toCharArray()) {
            if (quote != 0) {
                if (c == quote) quote = 0;
                else word.append(c);
            } else if (c == '"' || c == '\'') {
                quote = c;
                inWord = true;
            } else if (Character.isWhitespace(c)) {
                if (inWord) {
                    words.add(word.toString());
                    word.setLength(0);
                    inWord = false;
                }
            } else {
                word.append(c);
                inWord = true;
            }
        }
        if (quote != 0) throw new IllegalArgumentException("Unterminated quote in: " + line);
        if (inWord) words.add(word.toString());
        return words;
    }
}
