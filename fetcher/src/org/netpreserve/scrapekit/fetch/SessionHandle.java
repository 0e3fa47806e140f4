package org.netpreserve.scrapekit.fetch;

import java.util.List;

/**
 * The state that makes requests count as logged in. Owned by a single {@link FetchEngine} and gone once the
 * engine closes.
 */
public sealed interface SessionHandle permits CookieJarSession, BrowserContextSession {
    TransportKind transport();

    /**
     * Snapshot of the session's current cookies.
     */
    List<SessionCookie> cookies();

    default boolean isEmpty() {
        return cookies().isEmpty();
    }
}
