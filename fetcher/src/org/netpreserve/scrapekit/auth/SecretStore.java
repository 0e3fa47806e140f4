package org.netpreserve.scrapekit.auth;

import java.io.IOException;
import java.util.Optional;

/**
 * Platform storage for encrypted credential blobs, keyed by credential key.
 */
public interface SecretStore {
    Optional<String> get(String key) throws IOException;

    void put(String key, String blob) throws IOException;

    void delete(String key) throws IOException;
}
