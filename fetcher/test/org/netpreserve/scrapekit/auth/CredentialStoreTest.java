package org.netpreserve.scrapekit.auth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CredentialStoreTest {
    @TempDir
    Path tempDir;

    private final InMemorySecretStore secrets = new InMemorySecretStore();
    private final CredentialCipher cipher = new CredentialCipher("test-machine");
    private CredentialsFile file;

    @BeforeEach
    void setUp() {
        file = new CredentialsFile(tempDir.resolve("credentials.json"));
    }

    private CredentialStore store(CredentialPrompt prompt, boolean secure) {
        return new CredentialStore(secrets, file, cipher, prompt, secure);
    }

    private static CredentialPrompt answering(Credentials credentials, AtomicInteger asked) {
        return new CredentialPrompt() {
            @Override
            public boolean available() {
                return true;
            }

            @Override
            public Credentials ask(String key) {
                asked.incrementAndGet();
                return credentials;
            }
        };
    }

    @Test
    void secureStorageSurvivesANewStore() throws Exception {
        assertTrue(store(null, true).persist("shop", new Credentials("alice", "secret"), true));
        assertTrue(secrets.get("shop").isPresent());
        assertFalse(Files.exists(file.path()));

        var resolved = store(null, true).resolve("shop");
        assertEquals("alice", resolved.username());
        assertEquals("secret", resolved.secret());
    }

    @Test
    void secretStoreIsIgnoredWithoutSecureStorage() {
        store(null, true).persist("shop", new Credentials("alice", "secret"), true);
        var e = assertThrows(CredentialUnavailableException.class, () -> store(null, false).resolve("shop"));
        assertEquals("shop", e.key());
    }

    @Test
    void encryptedFileSurvivesANewStore() throws Exception {
        assertTrue(store(null, false).persist("shop", new Credentials("bob", "hunter2"), false));
        String json = Files.readString(file.path());
        assertFalse(json.contains("hunter2"));

        assertEquals("hunter2", store(null, false).resolve("shop").secret());
    }

    @Test
    void readsPlaintextFileEntries() throws Exception {
        Files.writeString(file.path(), "{\"shop\": {\"username\": \"carol\", \"password\": \"plain\"}}");
        var resolved = store(null, false).resolve("shop");
        assertEquals("carol", resolved.username());
        assertEquals("plain", resolved.secret());
    }

    @Test
    void corruptEntriesAreSkipped() throws Exception {
        Files.writeString(file.path(), "{\"shop\": \"garbage\", \"other\": 42}");
        var asked = new AtomicInteger();
        var store = store(answering(new Credentials("dave", "typed"), asked), false);
        assertEquals("typed", store.resolve("shop").secret());
        assertEquals("typed", store.resolve("other").secret());
        assertEquals(2, asked.get());
    }

    @Test
    void promptedCredentialsAreSavedWhenAsked() throws Exception {
        var asked = new AtomicInteger();
        var store = store(answering(new Credentials("erin", "remember-me", true), asked), false);
        assertEquals("remember-me", store.resolve("shop").secret());
        assertEquals(1, asked.get());
        assertTrue(file.entry("shop").isPresent());

        assertEquals("remember-me", store(null, false).resolve("shop").secret());
    }

    @Test
    void promptedCredentialsAreNotSavedByDefault() throws Exception {
        var store = store(answering(new Credentials("erin", "once"), new AtomicInteger()), false);
        store.resolve("shop");
        assertTrue(file.entry("shop").isEmpty());
        assertThrows(CredentialUnavailableException.class, () -> store(null, false).resolve("shop"));
    }

    @Test
    void resolvedCredentialsAreCachedUntilEvicted() throws Exception {
        var asked = new AtomicInteger();
        var store = store(answering(new Credentials("frank", "pw"), asked), false);
        store.resolve("shop");
        store.resolve("shop");
        assertEquals(1, asked.get());

        store.evict("shop");
        store.resolve("shop");
        assertEquals(2, asked.get());
    }

    @Test
    void unavailablePromptIsNotAsked() {
        var prompt = new CredentialPrompt() {
            @Override
            public boolean available() {
                return false;
            }

            @Override
            public Credentials ask(String key) {
                throw new AssertionError("should not be asked");
            }
        };
        assertThrows(CredentialUnavailableException.class, () -> store(prompt, false).resolve("shop"));
    }

    @Test
    void promptFailureIsAnAuthenticationError() {
        var prompt = new CredentialPrompt() {
            @Override
            public boolean available() {
                return true;
            }

            @Override
            public Credentials ask(String key) throws IOException {
                throw new IOException("stdin closed");
            }
        };
        var e = assertThrows(AuthenticationException.class, () -> store(prompt, false).resolve("shop"));
        assertFalse(e instanceof CredentialUnavailableException);
    }
}
