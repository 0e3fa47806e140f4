package org.netpreserve.scrapekit.auth;

import org.netpreserve.scrapekit.ScraperException;

/**
 * A login session couldn't be established.
 */
public class AuthenticationException extends ScraperException {
    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
