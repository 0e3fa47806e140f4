package org.netpreserve.scrapekit.fetch;

import java.util.List;
import java.util.function.Supplier;

/**
 * Session held by an isolated browser context.
 */
public record BrowserContextSession(String browserContextId, Supplier<List<SessionCookie>> cookieSource)
        implements SessionHandle {
    @Override
    public TransportKind transport() {
        return TransportKind.BROWSER;
    }

    @Override
    public List<SessionCookie> cookies() {
        return cookieSource.get();
    }
}
