package org.netpreserve.scrapekit.fetch;

import org.netpreserve.scrapekit.ScraperException;

import java.net.URI;

/**
 * A fetch that didn't produce a usable response.
 */
public abstract class FetchException extends ScraperException {
    private final URI url;
    private final FetchStatus status;

    protected FetchException(URI url, FetchStatus status, String message) {
        super(message + " (" + url + ")");
        this.url = url;
        this.status = status;
    }

    protected FetchException(URI url, FetchStatus status, String message, Throwable cause) {
        super(message + " (" + url + ")", cause);
        this.url = url;
        this.status = status;
    }

    public URI url() {
        return url;
    }

    public FetchStatus status() {
        return status;
    }
}
