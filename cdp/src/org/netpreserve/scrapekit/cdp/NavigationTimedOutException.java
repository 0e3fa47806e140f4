package org.netpreserve.scrapekit.cdp;

import java.net.URI;

public class NavigationTimedOutException extends NavigationException {
    public NavigationTimedOutException(URI url, String message) {
        super(url, message);
    }
}
