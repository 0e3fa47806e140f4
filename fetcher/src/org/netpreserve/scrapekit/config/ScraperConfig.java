package org.netpreserve.scrapekit.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scrapekit.ConfigurationException;
import org.netpreserve.scrapekit.fetch.TransportKind;
import org.netpreserve.scrapekit.util.DurationDeserializer;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Top level configuration. Loaded from the bundled {@code defaults.yaml} with an optional user file merged over
 * it.
 *
 * @param baseUrl           base for resolving relative request URLs
 * @param transport         {@code http} or {@code browser}
 * @param timeout           default per-request timeout
 * @param rateLimit         pacing and concurrency
 * @param proxy             outbound proxy
 * @param headers           extra request headers sent with every request
 * @param userAgent         fixed User-Agent, ignored when {@code userAgentRotation} is on
 * @param userAgentRotation pick a User-Agent from the built-in list for each session
 * @param browser           browser transport settings
 * @param login             login sequence, or null when the site needs no session
 * @param workers           worker threads used when fetching many URLs
 */
public record ScraperConfig(
        URI baseUrl,
        TransportKind transport,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        RateLimitConfig rateLimit,
        ProxyConfig proxy,
        Map<String, String> headers,
        String userAgent,
        boolean userAgentRotation,
        BrowserConfig browser,
        LoginConfig login,
        int workers
) {
    public ScraperConfig {
        if (transport == null) transport = TransportKind.HTTP;
        if (timeout == null) timeout = Duration.ofSeconds(30);
        if (rateLimit == null) rateLimit = RateLimitConfig.of(null, null, 0);
        if (proxy == null) proxy = ProxyConfig.DISABLED;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (browser == null) browser = new BrowserConfig(null, null, true);
        if (workers <= 0) workers = rateLimit.concurrency();
    }

    public static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * Bundled defaults only.
     */
    public static ScraperConfig defaults() {
        return load(null);
    }

    /**
     * Loads the bundled defaults and merges the given file over them.
     *
     * @throws ConfigurationException if a file can't be read or holds invalid values
     */
    public static ScraperConfig load(@Nullable Path configFile) {
        var mapper = yamlMapper();
        try (InputStream defaults = ScraperConfig.class.getResourceAsStream("defaults.yaml")) {
            if (defaults == null) throw new ConfigurationException("Missing bundled defaults.yaml");
            JsonNode tree = mapper.readTree(defaults);
            if (configFile != null) {
                if (!Files.exists(configFile)) {
                    throw new ConfigurationException("Config file not found: " + configFile);
                }
                JsonNode override = mapper.readTree(configFile.toFile());
                if (override != null && !override.isMissingNode()) tree = deepMerge(tree, override);
            }
            return mapper.treeToValue(tree, ScraperConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration" +
                                             (configFile == null ? "" : " in " + configFile) + ": " + e.getMessage(), e);
        }
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // scalars and lists are replaced wholesale
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode baseValue = merged.get(entry.getKey());
            merged.set(entry.getKey(), baseValue == null ? entry.getValue() : deepMerge(baseValue, entry.getValue()));
        });
        return merged;
    }

    public ScraperConfig withBaseUrl(URI baseUrl) {
        return new ScraperConfig(baseUrl, transport, timeout, rateLimit, proxy, headers, userAgent,
                userAgentRotation, browser, login, workers);
    }

    public ScraperConfig withTransport(TransportKind transport) {
        return new ScraperConfig(baseUrl, transport, timeout, rateLimit, proxy, headers, userAgent,
                userAgentRotation, browser, login, workers);
    }

    public ScraperConfig withTimeout(Duration timeout) {
        return new ScraperConfig(baseUrl, transport, timeout, rateLimit, proxy, headers, userAgent,
                userAgentRotation, browser, login, workers);
    }

    public ScraperConfig withRateLimit(RateLimitConfig rateLimit) {
        return new ScraperConfig(baseUrl, transport, timeout, rateLimit, proxy, headers, userAgent,
                userAgentRotation, browser, login, workers);
    }

    public ScraperConfig withProxy(ProxyConfig proxy) {
        return new ScraperConfig(baseUrl, transport, timeout, rateLimit, proxy, headers, userAgent,
                userAgentRotation, browser, login, workers);
    }

    public ScraperConfig withHeaders(Map<String, String> headers) {
        return new ScraperConfig(baseUrl, transport, timeout, rateLimit, proxy, headers, userAgent,
                userAgentRotation, browser, login, workers);
    }

    public ScraperConfig withUserAgent(String userAgent, boolean userAgentRotation) {
        return new ScraperConfig(baseUrl, transport, timeout, rateLimit, proxy, headers, userAgent,
                userAgentRotation, browser, login, workers);
    }

    public ScraperConfig withLogin(LoginConfig login) {
        return new ScraperConfig(baseUrl, transport, timeout, rateLimit, proxy, headers, userAgent,
                userAgentRotation, browser, login, workers);
    }
}
