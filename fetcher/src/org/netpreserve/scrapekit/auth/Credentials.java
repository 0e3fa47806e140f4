package org.netpreserve.scrapekit.auth;

/**
 * A username and secret.
 *
 * @param save whether the user asked for the credentials to be remembered
 */
public record Credentials(String username, String secret, boolean save) {
    public Credentials(String username, String secret) {
        this(username, secret, false);
    }

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", secret=****]";
    }
}
