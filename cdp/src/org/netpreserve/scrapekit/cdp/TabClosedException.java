package org.netpreserve.scrapekit.cdp;

import java.net.URI;

/**
 * The tab or its browser was closed while a caller was waiting on it.
 */
public class TabClosedException extends NavigationException {
    public TabClosedException(URI url) {
        super(url, "Tab closed");
    }
}
