package org.netpreserve.scrapekit.auth;

import java.io.IOException;
import java.util.Optional;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Keeps credential blobs in the user's {@link Preferences} tree under {@code /org/netpreserve/scrapekit/credentials}.
 */
public class PreferencesSecretStore implements SecretStore {
    static final String NODE = "org/netpreserve/scrapekit/credentials";

    private final Preferences node;

    public PreferencesSecretStore() {
        this(Preferences.userRoot().node(NODE));
    }

    public PreferencesSecretStore(Preferences node) {
        this.node = node;
    }

    @Override
    public Optional<String> get(String key) throws IOException {
        try {
            return Optional.ofNullable(node.get(key, null));
        } catch (IllegalStateException e) {
            throw new IOException("Preferences node removed", e);
        }
    }

    @Override
    public void put(String key, String blob) throws IOException {
        if (blob.length() > Preferences.MAX_VALUE_LENGTH) {
            throw new IOException("Credential blob too large for preferences storage");
        }
        node.put(key, blob);
        flush();
    }

    @Override
    public void delete(String key) throws IOException {
        node.remove(key);
        flush();
    }

    private void flush() throws IOException {
        try {
            node.flush();
        } catch (BackingStoreException e) {
            throw new IOException("Unable to write preferences: " + e.getMessage(), e);
        }
    }
}
