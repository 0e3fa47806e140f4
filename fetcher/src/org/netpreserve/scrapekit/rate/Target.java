package org.netpreserve.scrapekit.rate;

import java.net.URI;
import java.util.Locale;

/**
 * A network authority that requests are paced against, e.g. {@code https://example.org} or
 * {@code http://localhost:8080}. Scheme and host are lower-cased and default ports dropped so equivalent URLs
 * map to the same target.
 */
public record Target(String scheme, String host, int port) {
    public Target {
        scheme = scheme.toLowerCase(Locale.ROOT);
        host = host.toLowerCase(Locale.ROOT);
        if (port == defaultPort(scheme)) port = -1;
    }

    public static Target of(URI url) {
        if (url.getScheme() == null || url.getHost() == null) {
            throw new IllegalArgumentException("Not an absolute URL: " + url);
        }
        return new Target(url.getScheme(), url.getHost(), url.getPort());
    }

    private static int defaultPort(String scheme) {
        return switch (scheme) {
            case "http" -> 80;
            case "https" -> 443;
            default -> -1;
        };
    }

    public String authority() {
        return port == -1 ? scheme + "://" + host : scheme + "://" + host + ":" + port;
    }

    @Override
    public String toString() {
        return authority();
    }
}
