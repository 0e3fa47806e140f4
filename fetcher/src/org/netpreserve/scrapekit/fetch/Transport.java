package org.netpreserve.scrapekit.fetch;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * How an engine actually talks to sites. Pacing, result building and failure reporting live in
 * {@link FetchEngine}; a transport only moves bytes and keeps session state.
 */
public interface Transport {
    TransportKind kind();

    /**
     * Allocates the underlying client or browser and loads previously captured cookies into it.
     */
    void open(List<SessionCookie> restoredCookies) throws IOException;

    Exchange retrieve(URI url, Duration timeout) throws FetchException, InterruptedException;

    Exchange submit(FormSubmission submission, Duration timeout) throws FetchException, InterruptedException;

    SessionHandle session();

    /**
     * Forgets all session state (cookies) without closing the transport.
     */
    void clearSession();

    /**
     * Releases everything. Exchanges still in flight fail with {@link FetchCancelledException}.
     */
    void close();

    /**
     * What came back from one retrieval.
     *
     * @param finalUrl   URL after redirects
     * @param statusCode HTTP status, 0 if unknown
     * @param content    body text or rendered DOM
     * @param newCookies cookies set or changed during the exchange
     */
    record Exchange(URI finalUrl, int statusCode, String content, List<SessionCookie> newCookies) {
    }
}
