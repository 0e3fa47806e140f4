package org.netpreserve.scrapekit.fetch;

import java.net.URI;

/**
 * Connection, DNS or TLS failure, or the browser failing to load the page.
 */
public class NetworkException extends FetchException {
    public NetworkException(URI url, String message) {
        super(url, FetchStatus.NETWORK_ERROR, message);
    }

    public NetworkException(URI url, String message, Throwable cause) {
        super(url, FetchStatus.NETWORK_ERROR, message, cause);
    }
}
