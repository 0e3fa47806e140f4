package org.netpreserve.scrapekit.cdp;

import java.net.URI;

/**
 * The browser reported a network level error such as {@code net::ERR_NAME_NOT_RESOLVED}.
 */
public class NavigationFailedException extends NavigationException {
    private final String errorText;

    public NavigationFailedException(URI url, String errorText) {
        super(url, errorText);
        this.errorText = errorText;
    }

    public String errorText() {
        return errorText;
    }
}
