package org.netpreserve.scrapekit.fetch;

import java.net.URI;
import java.time.Duration;

public class FetchTimeoutException extends FetchException {
    public FetchTimeoutException(URI url, Duration timeout) {
        super(url, FetchStatus.TIMEOUT, "Timed out after " + timeout.toMillis() + " ms");
    }

    public FetchTimeoutException(URI url, String message, Throwable cause) {
        super(url, FetchStatus.TIMEOUT, message, cause);
    }
}
