package org.netpreserve.scrapekit.cdp.protocol;

/**
 * The calling thread was interrupted while waiting for a reply. The thread's interrupt flag is set again
 * before this is thrown.
 */
public class CDPInterruptedException extends CDPException {
    public CDPInterruptedException(String method) {
        super(0, "Interrupted waiting for " + method);
        actuallyFillInStackTrace();
    }
}
