package org.netpreserve.scrapekit.auth;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scrapekit.config.LoginConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Finds the credentials for a key. Looks in order at credentials already resolved during this run, the secret
 * store (only when secure storage is on), the credentials file and finally asks the user. The first hit is
 * cached for the rest of the run.
 * <p>
 * Entries that can't be read or decrypted are logged and skipped.
 */
public class CredentialStore {
    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    private final SecretStore secretStore;
    private final CredentialsFile file;
    private final CredentialCipher cipher;
    private final @Nullable CredentialPrompt prompt;
    private final boolean secureStorage;
    private final Map<String, Credentials> cache = new ConcurrentHashMap<>();

    /**
     * @param prompt        how to ask the user, null to never ask
     * @param secureStorage consult and save to the secret store rather than the file
     */
    public CredentialStore(SecretStore secretStore, CredentialsFile file, CredentialCipher cipher,
                           @Nullable CredentialPrompt prompt, boolean secureStorage) {
        this.secretStore = secretStore;
        this.file = file;
        this.cipher = cipher;
        this.prompt = prompt;
        this.secureStorage = secureStorage;
    }

    /**
     * A store using the platform preferences and the configured credentials file.
     *
     * @param interactive whether the user may be prompted on the console
     */
    public static CredentialStore forLogin(LoginConfig login, boolean interactive) {
        return new CredentialStore(new PreferencesSecretStore(), new CredentialsFile(login.credentialsFileOrDefault()),
                new CredentialCipher(), interactive ? new ConsolePrompt() : null, login.secureStorage());
    }

    /**
     * @throws CredentialUnavailableException if no source has credentials and the user can't be asked
     * @throws AuthenticationException        if prompting the user failed
     */
    public Credentials resolve(String key) throws AuthenticationException {
        Credentials cached = cache.get(key);
        if (cached != null) return cached;

        Optional<Credentials> found = secureStorage ? fromSecretStore(key) : Optional.empty();
        if (found.isEmpty()) found = fromFile(key);
        if (found.isPresent()) {
            cache.put(key, found.get());
            return found.get();
        }

        if (prompt == null || !prompt.available()) throw new CredentialUnavailableException(key);
        log.info("No stored credentials for {}, prompting", key);
        Credentials entered;
        try {
            entered = prompt.ask(key);
        } catch (IOException e) {
            throw new AuthenticationException("Unable to read credentials for '" + key + "': " + e.getMessage(), e);
        }
        if (entered.save()) persist(key, entered, secureStorage);
        cache.put(key, entered);
        return entered;
    }

    private Optional<Credentials> fromSecretStore(String key) {
        try {
            Optional<String> blob = secretStore.get(key);
            if (blob.isEmpty()) return Optional.empty();
            return Optional.of(cipher.open(key, blob.get()));
        } catch (IOException | GeneralSecurityException e) {
            log.atWarn().addKeyValue("key", key).log("Skipping unreadable secret store entry: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Credentials> fromFile(String key) {
        try {
            Optional<JsonNode> entry = file.entry(key);
            if (entry.isEmpty()) return Optional.empty();
            JsonNode node = entry.get();
            if (node.isTextual()) return Optional.of(cipher.open(key, node.asText()));
            if (node.isObject() && node.hasNonNull("username") && node.hasNonNull("password")) {
                log.atWarn().addKeyValue("key", key).addKeyValue("file", file.path())
                        .log("Credentials stored unencrypted");
                return Optional.of(new Credentials(node.get("username").asText(), node.get("password").asText()));
            }
            log.atWarn().addKeyValue("key", key).addKeyValue("file", file.path())
                    .log("Skipping malformed credentials entry");
            return Optional.empty();
        } catch (IOException | GeneralSecurityException e) {
            log.atWarn().addKeyValue("key", key).addKeyValue("file", file.path())
                    .log("Skipping unreadable credentials entry: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Saves credentials encrypted, to the secret store when {@code secure} or else to the credentials file.
     *
     * @return false if saving failed; the failure is logged
     */
    public boolean persist(String key, Credentials credentials, boolean secure) {
        String blob = cipher.seal(key, credentials);
        try {
            if (secure) {
                secretStore.put(key, blob);
            } else {
                file.put(key, blob);
            }
            cache.put(key, credentials);
            log.atInfo().addKeyValue("key", key).addKeyValue("secure", secure).log("Saved credentials");
            return true;
        } catch (IOException e) {
            log.atError().addKeyValue("key", key).addKeyValue("secure", secure)
                    .log("Failed to save credentials: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Forgets the cached credentials for a key so the next resolve looks them up again.
     */
    public void evict(String key) {
        cache.remove(key);
    }
}
