package org.netpreserve.scrapekit.auth;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds secrets for the life of the process only.
 */
public class InMemorySecretStore implements SecretStore {
    private final Map<String, String> secrets = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(secrets.get(key));
    }

    @Override
    public void put(String key, String blob) {
        secrets.put(key, blob);
    }

    @Override
    public void delete(String key) {
        secrets.remove(key);
    }
}
