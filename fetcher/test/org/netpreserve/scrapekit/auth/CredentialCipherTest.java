package org.netpreserve.scrapekit.auth;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

import static org.junit.jupiter.api.Assertions.*;

class CredentialCipherTest {
    private final CredentialCipher cipher = new CredentialCipher("build-host-01");

    @Test
    void sealedCredentialsOpenOnTheSameMachine() throws Exception {
        String blob = cipher.seal("shop", new Credentials("alice", "pa55 word"));
        assertFalse(blob.contains("alice"));
        assertNotEquals(blob, cipher.seal("shop", new Credentials("alice", "pa55 word")), "fresh IV each time");

        var opened = new CredentialCipher("build-host-01").open("shop", blob);
        assertEquals("alice", opened.username());
        assertEquals("pa55 word", opened.secret());
    }

    @Test
    void wrongLabelOrMachineFails() {
        String blob = cipher.seal("shop", new Credentials("alice", "secret"));
        assertThrows(GeneralSecurityException.class, () -> cipher.open("bank", blob));
        assertThrows(GeneralSecurityException.class, () -> new CredentialCipher("other-host").open("shop", blob));
    }

    @Test
    void malformedBlobsFail() {
        assertThrows(GeneralSecurityException.class, () -> cipher.open("shop", "not base64!"));
        assertThrows(GeneralSecurityException.class, () -> cipher.open("shop", "AAAA"));
    }

    @Test
    void saltIsPaddedOrTruncatedToSixteenBytes() {
        assertEquals("host000000000000", new String(CredentialCipher.salt("host"), StandardCharsets.UTF_8));
        assertEquals("a-very-long-mach",
                new String(CredentialCipher.salt("a-very-long-machine-name"), StandardCharsets.UTF_8));
    }
}
