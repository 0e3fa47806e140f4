package org.netpreserve.scrapekit.auth;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scrapekit.adapter.SiteAdapter;
import org.netpreserve.scrapekit.fetch.FetchEngine;
import org.netpreserve.scrapekit.fetch.FetchException;
import org.netpreserve.scrapekit.fetch.FetchRequest;
import org.netpreserve.scrapekit.fetch.FetchResult;
import org.netpreserve.scrapekit.fetch.FormSubmission;
import org.netpreserve.scrapekit.fetch.SessionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs an engine in to a site by fetching the login page, submitting the form and checking the response.
 * The session ends up in the engine itself, so every later fetch through the same engine is logged in.
 */
public class SessionNegotiator {
    private static final Logger log = LoggerFactory.getLogger(SessionNegotiator.class);

    private final LoginVerifier verifier;
    private final @Nullable SiteAdapter adapter;

    public SessionNegotiator() {
        this(new LoginVerifier(), null);
    }

    /**
     * @param adapter site adapter whose {@link SiteAdapter#verifyLogin} verdict takes precedence, or null
     */
    public SessionNegotiator(LoginVerifier verifier, @Nullable SiteAdapter adapter) {
        this.verifier = verifier;
        this.adapter = adapter;
    }

    /**
     * Resolves the credentials from the store, then logs in. A rejected login evicts them from the store's cache
     * so the next attempt looks them up afresh.
     */
    public SessionHandle login(FetchEngine engine, String loginUrl, FieldMap fields, CredentialStore store,
                               String key) throws AuthenticationException {
        Credentials credentials = store.resolve(key);
        try {
            return login(engine, loginUrl, fields, credentials);
        } catch (AuthenticationException e) {
            store.evict(key);
            throw e;
        }
    }

    /**
     * @return the engine's now logged in session
     * @throws AuthenticationException if a fetch failed, the site rejected the credentials or no session was
     *                                 established
     */
    public SessionHandle login(FetchEngine engine, String loginUrl, FieldMap fields, Credentials credentials)
            throws AuthenticationException {
        FetchResult response;
        try {
            FetchResult page = engine.fetch(FetchRequest.of(loginUrl));
            log.atDebug().addKeyValue("url", page.finalUrl()).log("Fetched login page");
            response = engine.submitForm(new FormSubmission(page.finalUrl(), page.content(), fields, credentials));
        } catch (FetchException e) {
            throw new AuthenticationException("Login failed: " + e.getMessage(), e);
        }

        LoginVerdict verdict = adapter != null ? adapter.verifyLogin(response.content()) : LoginVerdict.UNDECIDED;
        if (verdict == LoginVerdict.UNDECIDED) verdict = verifier.verify(response.content());
        if (verdict == LoginVerdict.FAILURE) {
            String phrase = verifier.failurePhraseIn(response.content());
            throw new AuthenticationException("Login rejected by " + response.finalUrl() +
                                              (phrase != null ? ": page says \"" + phrase + "\"" : ""));
        }
        if (verdict == LoginVerdict.UNDECIDED) {
            log.atWarn().addKeyValue("url", response.finalUrl())
                    .log("No sign of success or failure after login, assuming it worked");
        }

        SessionHandle session;
        int cookies;
        try {
            session = engine.session();
            cookies = session.cookies().size();
        } catch (RuntimeException e) {
            throw new AuthenticationException("Unable to read session after login to " + response.finalUrl() + ": " +
                                              e.getMessage(), e);
        }
        if (cookies == 0) {
            throw new AuthenticationException("Login to " + response.finalUrl() + " did not establish a session");
        }
        log.atInfo().addKeyValue("url", response.finalUrl())
                .addKeyValue("transport", session.transport())
                .addKeyValue("cookies", cookies)
                .log("Logged in");
        return session;
    }
}
