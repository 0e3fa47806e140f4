package org.netpreserve.scrapekit.auth;

public enum LoginVerdict {
    SUCCESS,
    FAILURE,
    /**
     * The page gave no clear sign either way.
     */
    UNDECIDED
}
