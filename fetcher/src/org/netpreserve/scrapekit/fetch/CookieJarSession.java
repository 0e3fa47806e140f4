package org.netpreserve.scrapekit.fetch;

import java.net.CookieStore;
import java.util.List;

/**
 * Session held in the HTTP client's cookie store.
 */
public record CookieJarSession(CookieStore cookieStore) implements SessionHandle {
    @Override
    public TransportKind transport() {
        return TransportKind.HTTP;
    }

    @Override
    public List<SessionCookie> cookies() {
        return cookieStore.getCookies().stream()
                .filter(cookie -> !cookie.hasExpired())
                .map(HttpTransport::toSessionCookie)
                .toList();
    }
}
