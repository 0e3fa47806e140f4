package org.netpreserve.scrapekit.fetch;

import java.net.URI;

/**
 * The fetch was abandoned because the engine closed, the scheduler was cancelled or the thread was interrupted.
 */
public class FetchCancelledException extends FetchException {
    public FetchCancelledException(URI url, String message) {
        super(url, FetchStatus.CANCELLED, message);
    }

    public FetchCancelledException(URI url, String message, Throwable cause) {
        super(url, FetchStatus.CANCELLED, message, cause);
    }
}
