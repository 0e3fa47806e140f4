package org.netpreserve.scrapekit.auth;

import java.io.IOException;

/**
 * Asks the user for credentials.
 */
public interface CredentialPrompt {
    /**
     * Whether there's anyone to ask.
     */
    boolean available();

    Credentials ask(String key) throws IOException;
}
