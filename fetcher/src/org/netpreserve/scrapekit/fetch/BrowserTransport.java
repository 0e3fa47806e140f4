package org.netpreserve.scrapekit.fetch;

import org.netpreserve.scrapekit.ConfigurationException;
import org.netpreserve.scrapekit.auth.FieldMap;
import org.netpreserve.scrapekit.cdp.BrowserProcess;
import org.netpreserve.scrapekit.cdp.BrowserTab;
import org.netpreserve.scrapekit.cdp.NavigationException;
import org.netpreserve.scrapekit.cdp.NavigationFailedException;
import org.netpreserve.scrapekit.cdp.NavigationTimedOutException;
import org.netpreserve.scrapekit.cdp.TabClosedException;
import org.netpreserve.scrapekit.cdp.domains.Network;
import org.netpreserve.scrapekit.cdp.protocol.CDPClosedException;
import org.netpreserve.scrapekit.cdp.protocol.CDPException;
import org.netpreserve.scrapekit.cdp.protocol.CDPInterruptedException;
import org.netpreserve.scrapekit.cdp.protocol.CDPTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fetches by loading pages in a headless browser. All tabs share one isolated browser context which holds the
 * session's cookies. Each fetch opens a fresh tab, waits for the page to go network idle, reads the rendered
 * DOM and closes the tab.
 */
public class BrowserTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(BrowserTransport.class);

    private final TransportSettings settings;
    private final Set<BrowserTab> openTabs = ConcurrentHashMap.newKeySet();
    private volatile BrowserProcess browser;
    private volatile String contextId;
    private volatile boolean closed;

    public BrowserTransport(TransportSettings settings) {
        this.settings = settings;
    }

    @Override
    public TransportKind kind() {
        return TransportKind.BROWSER;
    }

    @Override
    public void open(List<SessionCookie> restoredCookies) throws IOException {
        var config = settings.browser();
        browser = BrowserProcess.start(config.executable(), config.options(), config.headless());
        try {
            browser.onDisconnect(this::abortOpenTabs);
            String proxyServer = settings.proxy().enabled() ? settings.proxy().serverUri().toString() : null;
            contextId = browser.createContext(proxyServer);
            Instant now = Instant.now();
            var cookies = restoredCookies.stream()
                    .filter(cookie -> !cookie.isExpired(now))
                    .map(BrowserTransport::toCookieParam)
                    .toList();
            if (!cookies.isEmpty()) browser.setCookies(contextId, cookies);
            log.atInfo().addKeyValue("browser", browser.version().product())
                    .addKeyValue("restoredCookies", cookies.size())
                    .log("Browser transport open");
        } catch (CDPException e) {
            browser.close();
            throw new IOException("Unable to set up browser context: " + e.getMessage(), e);
        }
    }

    @Override
    public Exchange retrieve(URI url, Duration timeout) throws FetchException, InterruptedException {
        var before = cookies(url);
        BrowserTab tab = openTab(url);
        try {
            int status = tab.navigate(url, timeout);
            return finish(url, tab, status, before);
        } catch (NavigationException | CDPException | BrowserTab.JavaScriptException e) {
            throw translate(url, e);
        } finally {
            closeTab(tab);
        }
    }

    @Override
    public Exchange submit(FormSubmission submission, Duration timeout) throws FetchException, InterruptedException {
        URI url = submission.pageUrl();
        FieldMap fields = submission.fields();
        var before = cookies(url);
        BrowserTab tab = openTab(url);
        try {
            tab.navigate(url, timeout);
            if (!tab.fill(fields.username(), submission.credentials().username())) {
                throw new ConfigurationException("Username field " + fields.username() + " not found on " + url);
            }
            if (!tab.fill(fields.password(), submission.credentials().secret())) {
                throw new ConfigurationException("Password field " + fields.password() + " not found on " + url);
            }
            boolean submitted = fields.submit() != null && tab.click(fields.submit(), timeout);
            if (!submitted) {
                log.debug("Submit locator {} didn't match, submitting the password field's form", fields.submit());
                if (!tab.submitFormOf(fields.password(), timeout)) {
                    throw new ConfigurationException("No way to submit the login form on " + url);
                }
            }
            return finish(url, tab, 0, before);
        } catch (NavigationException | CDPException | BrowserTab.JavaScriptException e) {
            throw translate(url, e);
        } finally {
            closeTab(tab);
        }
    }

    private BrowserTab openTab(URI url) throws FetchException, InterruptedException {
        if (closed || browser == null) throw new FetchCancelledException(url, "Transport is closed");
        BrowserTab tab;
        try {
            tab = browser.newTab(contextId);
        } catch (CDPException e) {
            throw translate(url, e);
        }
        openTabs.add(tab);
        try {
            tab.setExtraHeaders(settings.headers());
            tab.setUserAgent(settings.userAgent());
            if (settings.proxy().enabled() && settings.proxy().hasCredentials()) {
                tab.authenticateProxy(settings.proxy().username(), settings.proxy().password());
            }
        } catch (CDPException e) {
            closeTab(tab);
            throw translate(url, e);
        }
        return tab;
    }

    private Exchange finish(URI url, BrowserTab tab, int status, List<SessionCookie> before)
            throws FetchException {
        URI finalUrl = tab.currentUrl();
        String content = tab.content();
        if (status >= 400) throw new HttpStatusException(finalUrl, status, content);
        var after = cookies(url);
        var changed = after.stream().filter(cookie -> !before.contains(cookie)).toList();
        return new Exchange(finalUrl, status, content, changed);
    }

    private FetchException translate(URI url, Exception e) throws InterruptedException {
        if (e instanceof CDPInterruptedException) {
            Thread.interrupted();
            throw new InterruptedException("Interrupted fetching " + url);
        }
        if (closed || e instanceof TabClosedException || e instanceof CDPClosedException) {
            return new FetchCancelledException(url, closed ? "Transport closed during request" : e.getMessage(), e);
        }
        if (e instanceof NavigationTimedOutException || e instanceof CDPTimeoutException) {
            return new FetchTimeoutException(url, e.getMessage(), e);
        }
        if (e instanceof NavigationFailedException failed) {
            return new NetworkException(url, failed.errorText(), e);
        }
        return new NetworkException(url, "Browser error: " + e.getMessage(), e);
    }

    private List<SessionCookie> cookies(URI url) throws FetchException {
        try {
            return cookies();
        } catch (CDPException e) {
            if (closed || e instanceof CDPClosedException) {
                throw new FetchCancelledException(url, "Transport closed during request", e);
            }
            throw new NetworkException(url, "Unable to read browser cookies: " + e.getMessage(), e);
        }
    }

    private List<SessionCookie> cookies() {
        if (browser == null || !browser.isAlive()) return List.of();
        return browser.cookies(contextId).stream().map(BrowserTransport::toSessionCookie).toList();
    }

    static SessionCookie toSessionCookie(Network.Cookie cookie) {
        Instant expires = cookie.session() || cookie.expires() < 0 ? null :
                Instant.ofEpochMilli((long) (cookie.expires() * 1000));
        return new SessionCookie(cookie.name(), cookie.value(), cookie.domain(), cookie.path(), expires,
                cookie.secure(), cookie.httpOnly());
    }

    static Network.CookieParam toCookieParam(SessionCookie cookie) {
        Double expires = cookie.expires() == null ? null : cookie.expires().toEpochMilli() / 1000.0;
        return new Network.CookieParam(cookie.name(), cookie.value(), cookie.domain(), cookie.path(),
                cookie.secure(), cookie.httpOnly(), expires);
    }

    @Override
    public SessionHandle session() {
        if (contextId == null) throw new IllegalStateException("Transport not open");
        return new BrowserContextSession(contextId, this::cookies);
    }

    @Override
    public void clearSession() {
        if (browser != null && browser.isAlive()) browser.clearCookies(contextId);
    }

    private void abortOpenTabs() {
        openTabs.forEach(BrowserTab::abort);
    }

    private void closeTab(BrowserTab tab) {
        openTabs.remove(tab);
        try {
            tab.close();
        } catch (CDPException e) {
            log.debug("Error closing tab: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        closed = true;
        abortOpenTabs();
        var browser = this.browser;
        if (browser == null) return;
        try {
            if (browser.isAlive() && contextId != null) browser.disposeContext(contextId);
        } catch (CDPException e) {
            log.debug("Error disposing browser context: {}", e.getMessage());
        }
        browser.close();
    }
}
