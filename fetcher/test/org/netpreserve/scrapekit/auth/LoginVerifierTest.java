package org.netpreserve.scrapekit.auth;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoginVerifierTest {
    private final LoginVerifier verifier = new LoginVerifier();

    @Test
    void failurePhrasesWin() {
        assertEquals(LoginVerdict.FAILURE, verifier.verify("<p>Invalid credentials</p><a href=/>Account help</a>"));
        assertEquals("invalid credentials", verifier.failurePhraseIn("INVALID CREDENTIALS"));
    }

    @Test
    void successPhrases() {
        assertEquals(LoginVerdict.SUCCESS, verifier.verify("<a href=/logout>Logout</a>"));
        assertEquals(LoginVerdict.SUCCESS, verifier.verify("Your Dashboard"));
    }

    @Test
    void noSignEitherWay() {
        assertEquals(LoginVerdict.UNDECIDED, verifier.verify("<h1>Welcome</h1>"));
        assertEquals(LoginVerdict.UNDECIDED, verifier.verify(null));
    }

    @Test
    void configuredPhrasesReplaceDefaults() {
        var custom = new LoginVerifier(List.of("Wrong Password"), List.of());
        assertEquals(LoginVerdict.FAILURE, custom.verify("wrong password, try again"));
        assertEquals(LoginVerdict.UNDECIDED, custom.verify("login failed"));
        assertEquals(LoginVerdict.SUCCESS, custom.verify("sign out"), "empty list keeps the default success phrases");
    }
}
