package org.netpreserve.scrapekit;

/**
 * Root of the checked exceptions raised while fetching pages or establishing a login session.
 */
public abstract class ScraperException extends Exception {
    protected ScraperException(String message) {
        super(message);
    }

    protected ScraperException(String message, Throwable cause) {
        super(message, cause);
    }
}
