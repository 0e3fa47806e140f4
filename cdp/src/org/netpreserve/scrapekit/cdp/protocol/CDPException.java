package org.netpreserve.scrapekit.cdp.protocol;

/**
 * Error reported by the browser in reply to a command.
 */
public class CDPException extends RuntimeException {
    private final int code;

    public CDPException(int code, String message) {
        super(message + " [" + code + "]");
        this.code = code;
    }

    // Created on the CDP thread, so the stack trace is filled in by the caller that rethrows it.
    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }

    public void actuallyFillInStackTrace() {
        super.fillInStackTrace();
    }

    public int code() {
        return code;
    }
}
