package org.netpreserve.scrapekit.fetch;

import java.net.URI;

/**
 * The server answered with a non-2xx status. The body is kept since error pages are sometimes useful.
 */
public class HttpStatusException extends FetchException {
    private final int statusCode;
    private final String body;

    public HttpStatusException(URI url, int statusCode, String body) {
        super(url, FetchStatus.fromHttpStatus(statusCode), "HTTP " + statusCode);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }
}
