package org.netpreserve.scrapekit.fetch;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scrapekit.ConfigurationException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * A page to fetch.
 *
 * @param url           absolute URL, or a path resolved against the engine's base URL
 * @param params        query parameters appended in iteration order
 * @param transportHint transport this request needs, or null for whichever the engine uses
 * @param timeout       overall time limit, or null for the engine's default
 */
public record FetchRequest(String url, Map<String, String> params, @Nullable TransportKind transportHint,
                           @Nullable Duration timeout) {
    public FetchRequest {
        if (url == null || url.isBlank()) throw new ConfigurationException("Request URL must not be empty");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static FetchRequest of(String url) {
        return new FetchRequest(url, null, null, null);
    }

    public FetchRequest withParams(Map<String, String> params) {
        return new FetchRequest(url, params, transportHint, timeout);
    }

    public FetchRequest withTimeout(Duration timeout) {
        return new FetchRequest(url, params, transportHint, timeout);
    }

    public FetchRequest withTransportHint(TransportKind transportHint) {
        return new FetchRequest(url, params, transportHint, timeout);
    }

    /**
     * Builds the absolute URL to request.
     *
     * @throws ConfigurationException if the URL is relative and there's no base URL, or it isn't http(s)
     */
    public URI resolve(@Nullable URI baseUrl) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid URL: " + url, e);
        }
        if (!uri.isAbsolute()) {
            if (baseUrl == null) throw new ConfigurationException("Relative URL " + url + " but no baseUrl configured");
            uri = baseUrl.resolve(uri);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new ConfigurationException("Unsupported URL scheme: " + uri);
        }
        // URI leaves the host null for names it can't parse as a server authority, e.g. with underscores
        if (uri.getHost() == null) throw new ConfigurationException("Invalid URL, no usable host: " + uri);
        if (params.isEmpty()) return uri;

        var query = new StringJoiner("&");
        params.forEach((name, value) -> query.add(URLEncoder.encode(name, StandardCharsets.UTF_8) + "=" +
                                                  URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8)));
        String s = uri.toString();
        int hash = s.indexOf('#');
        String fragment = hash < 0 ? "" : s.substring(hash);
        if (hash >= 0) s = s.substring(0, hash);
        String separator = uri.getRawQuery() == null ? "?" : s.endsWith("&") || s.endsWith("?") ? "" : "&";
        return URI.create(s + separator + query + fragment);
    }
}
