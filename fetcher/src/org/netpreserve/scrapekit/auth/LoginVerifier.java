package org.netpreserve.scrapekit.auth;

import java.util.List;
import java.util.Locale;

/**
 * Guesses from the page returned after submitting a login form whether the login worked, by looking for
 * phrases such as "invalid credentials" or "logout". Matching is case-insensitive and failure phrases are
 * checked first.
 */
public class LoginVerifier {
    public static final List<String> DEFAULT_FAILURE_PHRASES = List.of(
            "incorrect password",
            "login failed",
            "invalid credentials",
            "username or password is incorrect",
            "authentication failed");
    public static final List<String> DEFAULT_SUCCESS_PHRASES = List.of(
            "logout",
            "sign out",
            "account",
            "profile",
            "dashboard");

    private final List<String> failurePhrases;
    private final List<String> successPhrases;

    public LoginVerifier() {
        this(DEFAULT_FAILURE_PHRASES, DEFAULT_SUCCESS_PHRASES);
    }

    /**
     * @param failurePhrases phrases meaning the login was rejected, empty for the defaults
     * @param successPhrases phrases meaning the login worked, empty for the defaults
     */
    public LoginVerifier(List<String> failurePhrases, List<String> successPhrases) {
        this.failurePhrases = lowerCase(failurePhrases.isEmpty() ? DEFAULT_FAILURE_PHRASES : failurePhrases);
        this.successPhrases = lowerCase(successPhrases.isEmpty() ? DEFAULT_SUCCESS_PHRASES : successPhrases);
    }

    private static List<String> lowerCase(List<String> phrases) {
        return phrases.stream().map(phrase -> phrase.toLowerCase(Locale.ROOT)).toList();
    }

    public LoginVerdict verify(String content) {
        String text = content == null ? "" : content.toLowerCase(Locale.ROOT);
        for (String phrase : failurePhrases) {
            if (text.contains(phrase)) return LoginVerdict.FAILURE;
        }
        for (String phrase : successPhrases) {
            if (text.contains(phrase)) return LoginVerdict.SUCCESS;
        }
        return LoginVerdict.UNDECIDED;
    }

    /**
     * The phrase that produced a failure verdict, for error messages.
     */
    String failurePhraseIn(String content) {
        String text = content == null ? "" : content.toLowerCase(Locale.ROOT);
        return failurePhrases.stream().filter(text::contains).findFirst().orElse(null);
    }
}
