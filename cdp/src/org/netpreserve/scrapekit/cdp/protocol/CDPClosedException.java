package org.netpreserve.scrapekit.cdp.protocol;

/**
 * The connection to the browser went away before a reply arrived.
 */
public class CDPClosedException extends CDPException {
    public CDPClosedException() {
        super(0, "Connection to browser closed");
        actuallyFillInStackTrace();
    }
}
