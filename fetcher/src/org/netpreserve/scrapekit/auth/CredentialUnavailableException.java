package org.netpreserve.scrapekit.auth;

/**
 * No stored credentials were found for a key and the user couldn't be asked.
 */
public class CredentialUnavailableException extends AuthenticationException {
    private final String key;

    public CredentialUnavailableException(String key) {
        super("No credentials available for '" + key + "'");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
