package org.netpreserve.scrapekit.cdp;

import java.net.URI;

public class NavigationException extends Exception {
    protected final URI url;

    public NavigationException(URI url, String message) {
        super(message + " for " + url);
        this.url = url;
    }

    public NavigationException(URI url, String message, Throwable cause) {
        super(message + " for " + url, cause);
        this.url = url;
    }

    public URI url() {
        return url;
    }
}
