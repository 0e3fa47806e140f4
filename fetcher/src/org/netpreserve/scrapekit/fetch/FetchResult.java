package org.netpreserve.scrapekit.fetch;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * A successfully retrieved page.
 *
 * @param requestedUrl URL that was asked for
 * @param finalUrl     URL after redirects
 * @param statusCode   HTTP status, or 0 if the transport couldn't tell
 * @param content      response body, or the rendered DOM for the browser transport
 * @param status       classification of the outcome
 * @param newCookies   cookies set or changed by this fetch
 * @param elapsed      time spent in the transport, excluding pacing
 */
public record FetchResult(URI requestedUrl, URI finalUrl, int statusCode, String content, FetchStatus status,
                          List<SessionCookie> newCookies, Duration elapsed) {
    public FetchResult {
        newCookies = List.copyOf(newCookies);
    }

    public boolean isSuccess() {
        return status == FetchStatus.SUCCESS;
    }
}
