package org.netpreserve.scrapekit.cdp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.intellij.lang.annotations.Language;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scrapekit.cdp.domains.Fetch;
import org.netpreserve.scrapekit.cdp.domains.Network;
import org.netpreserve.scrapekit.cdp.domains.Page;
import org.netpreserve.scrapekit.cdp.domains.Runtime;
import org.netpreserve.scrapekit.cdp.protocol.CDPClosedException;
import org.netpreserve.scrapekit.cdp.protocol.CDPInterruptedException;
import org.netpreserve.scrapekit.cdp.protocol.CDPSession;
import org.netpreserve.scrapekit.cdp.protocol.CDPTimeoutException;
import org.netpreserve.scrapekit.cdp.protocol.RPC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single browser tab. Navigations are considered settled once the main frame's current document reaches
 * the {@code networkIdle} lifecycle state (no network activity for 500 ms).
 */
public class BrowserTab implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BrowserTab.class);
    private static final Duration NAVIGATION_START_GRACE = Duration.ofSeconds(1);
    private static final URI BLANK = URI.create("about:blank");

    private final CDPSession session;
    private final Page page;
    private final Runtime runtime;
    private final Network network;
    private final Fetch fetch;
    private final Page.FrameId mainFrameId;

    // guarded by this
    private final Set<Network.LoaderId> committedLoaders = new HashSet<>();
    private final Set<Network.LoaderId> idleLoaders = new HashSet<>();
    private final Map<Network.LoaderId, Integer> documentStatus = new HashMap<>();
    private Network.LoaderId latestLoader;
    private boolean awaitingCommit;
    private boolean loading;
    private long loadsStarted;
    private boolean closed;

    public BrowserTab(CDPSession session) {
        this.session = session;
        this.page = session.domain(Page.class);
        this.runtime = session.domain(Runtime.class);
        this.network = session.domain(Network.class);
        this.fetch = session.domain(Fetch.class);

        page.onLifecycleEvent(this::handleLifecycleEvent);
        page.onFrameStartedLoading(this::handleFrameStartedLoading);
        page.onFrameStoppedLoading(this::handleFrameStoppedLoading);
        network.onResponseReceived(this::handleResponseReceived);
        page.enable();
        page.setLifecycleEventsEnabled(true);
        network.enable();
        this.mainFrameId = page.getFrameTree().frame().id();
    }

    private synchronized void handleLifecycleEvent(Page.LifecycleEvent event) {
        if (!mainFrameId.equals(event.frameId())) return;
        if ("init".equals(event.name())) {
            latestLoader = event.loaderId();
            committedLoaders.add(event.loaderId());
            awaitingCommit = false;
        } else if ("networkIdle".equals(event.name())) {
            idleLoaders.add(event.loaderId());
        } else {
            return;
        }
        notifyAll();
    }

    private synchronized void handleFrameStartedLoading(Page.FrameStartedLoading event) {
        if (!mainFrameId.equals(event.frameId())) return;
        loadsStarted++;
        loading = true;
        awaitingCommit = true;
        notifyAll();
    }

    private synchronized void handleFrameStoppedLoading(Page.FrameStoppedLoading event) {
        if (!mainFrameId.equals(event.frameId())) return;
        loading = false;
        notifyAll();
    }

    private synchronized void handleResponseReceived(Network.ResponseReceived event) {
        if ("Document".equals(event.type()) && mainFrameId.equals(event.frameId()) && event.loaderId() != null) {
            documentStatus.put(event.loaderId(), event.response().status());
        }
    }

    /**
     * Navigates the tab and waits until the resulting document is network idle.
     *
     * @return the HTTP status of the main document, or 0 when the browser didn't report one
     */
    public int navigate(URI url, Duration timeout) throws NavigationException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        Page.Navigate result;
        try {
            result = page.navigate(url.toString());
        } catch (CDPTimeoutException e) {
            throw new NavigationTimedOutException(url, "Timed out waiting for Page.navigate");
        } catch (CDPInterruptedException e) {
            Thread.interrupted();
            throw new InterruptedException("Interrupted navigating to " + url);
        } catch (CDPClosedException e) {
            throw new TabClosedException(url);
        }
        if (result.errorText() != null) {
            throw new NavigationFailedException(url, result.errorText());
        }
        synchronized (this) {
            // a page that already redirected itself has committed a newer loader, keep that one
            if (result.loaderId() != null && !committedLoaders.contains(result.loaderId())) {
                latestLoader = result.loaderId();
            }
        }
        if (result.loaderId() == null) return currentStatus();
        return awaitSettled(url, deadline);
    }

    /**
     * Runs a script that may trigger a navigation (a click, a form submit) and waits for the page to settle.
     * If no navigation starts within a short grace period the page is treated as settled straight away.
     *
     * @return the script's result
     */
    public JsonNode evaluateAndSettle(@Language("JavaScript") String script, Duration timeout)
            throws NavigationException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        long startedBefore;
        synchronized (this) {
            startedBefore = loadsStarted;
        }
        JsonNode value = evaluate(script);
        URI url = currentUrlOr(BLANK);
        synchronized (this) {
            long graceDeadline = Math.min(deadline, System.nanoTime() + NAVIGATION_START_GRACE.toNanos());
            while (loadsStarted == startedBefore && !closed) {
                long remaining = graceDeadline - System.nanoTime();
                if (remaining <= 0) {
                    log.debug("No navigation started after script on {}", url);
                    return value;
                }
                waitNanos(remaining);
            }
        }
        awaitSettled(url, deadline);
        return value;
    }

    private synchronized int awaitSettled(URI url, long deadline) throws NavigationException, InterruptedException {
        while (!settled()) {
            if (closed) throw new TabClosedException(url);
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new NavigationTimedOutException(url, "Timed out waiting for network idle");
            }
            waitNanos(remaining);
        }
        return currentStatus();
    }

    private synchronized boolean settled() {
        if (awaitingCommit) {
            // started loading but never committed a document, e.g. a 204 response or a download
            return !loading;
        }
        return latestLoader != null && idleLoaders.contains(latestLoader);
    }

    private synchronized int currentStatus() {
        if (latestLoader == null) return 0;
        return documentStatus.getOrDefault(latestLoader, 0);
    }

    private void waitNanos(long nanos) throws InterruptedException {
        wait(nanos / 1_000_000, (int) (nanos % 1_000_000));
    }

    /**
     * Evaluates an expression in the page and returns its JSON value.
     */
    public JsonNode evaluate(@Language("JavaScript") String expression) {
        var result = runtime.evaluate(expression, true, true);
        if (result.exceptionDetails() != null) {
            throw new JavaScriptException(result.exceptionDetails().describe());
        }
        JsonNode value = result.result() == null ? null : result.result().value();
        return value == null ? RPC.JSON.nullNode() : value;
    }

    /**
     * Returns the serialized DOM of the current document.
     */
    public String content() {
        return evaluate("document.documentElement ? document.documentElement.outerHTML : ''").asText();
    }

    public URI currentUrl() {
        return URI.create(evaluate("document.location.href").asText());
    }

    private URI currentUrlOr(URI fallback) {
        try {
            return currentUrl();
        } catch (RuntimeException e) {
            return fallback;
        }
    }

    /**
     * Sets an input's value the way typing would, firing input and change events.
     *
     * @return false if no element matched the selector
     */
    public boolean fill(String selector, String value) {
        return evaluate("""
                ((selector, value) => {
                    const el = document.querySelector(selector);
                    if (!el) return false;
                    el.focus();
                    el.value = value;
                    el.dispatchEvent(new Event('input', {bubbles: true}));
                    el.dispatchEvent(new Event('change', {bubbles: true}));
                    return true;
                })(%s, %s)""".formatted(jsString(selector), jsString(value))).asBoolean();
    }

    /**
     * Clicks the element matching the selector and waits for any navigation it causes to settle.
     *
     * @return false if no element matched the selector
     */
    public boolean click(String selector, Duration timeout) throws NavigationException, InterruptedException {
        return evaluateAndSettle("""
                ((selector) => {
                    const el = document.querySelector(selector);
                    if (!el) return false;
                    el.click();
                    return true;
                })(%s)""".formatted(jsString(selector)), timeout).asBoolean();
    }

    /**
     * Submits the form containing the given field: clicks its first submit button, or failing that submits the
     * form directly.
     *
     * @return false if there was nothing to submit
     */
    public boolean submitFormOf(String fieldSelector, Duration timeout) throws NavigationException, InterruptedException {
        return evaluateAndSettle("""
                ((selector) => {
                    const field = document.querySelector(selector);
                    const form = field ? field.form : document.querySelector('form');
                    const scope = form || document;
                    const button = scope.querySelector('button[type=submit], input[type=submit], button:not([type])');
                    if (button) {
                        button.click();
                        return true;
                    }
                    if (!form) return false;
                    if (form.requestSubmit) form.requestSubmit(); else form.submit();
                    return true;
                })(%s)""".formatted(jsString(fieldSelector)), timeout).asBoolean();
    }

    private static String jsString(String value) {
        try {
            return RPC.JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void setExtraHeaders(Map<String, String> headers) {
        if (!headers.isEmpty()) network.setExtraHTTPHeaders(headers);
    }

    public void setUserAgent(@Nullable String userAgent) {
        if (userAgent != null) network.setUserAgentOverride(userAgent);
    }

    /**
     * Answers proxy authentication challenges with the given credentials. Server challenges get the browser's
     * default handling.
     */
    public void authenticateProxy(String username, String password) {
        fetch.onRequestPaused(event -> fetch.continueRequestAsync(event.requestId())
                .whenComplete((ok, e) -> {
                    if (e != null) log.debug("continueRequest failed: {}", e.getMessage());
                }));
        fetch.onAuthRequired(event -> {
            var response = "Proxy".equals(event.authChallenge().source()) ?
                    Fetch.AuthChallengeResponse.provide(username, password) :
                    new Fetch.AuthChallengeResponse("Default", null, null);
            fetch.continueWithAuthAsync(event.requestId(), response).whenComplete((ok, e) -> {
                if (e != null) log.debug("continueWithAuth failed: {}", e.getMessage());
            });
        });
        fetch.enable(List.of(new Fetch.RequestPattern("*")), true);
    }

    /**
     * Wakes any thread waiting on this tab so it fails with {@link TabClosedException}. Doesn't talk to the
     * browser, so it is safe to call when the browser has already gone away.
     */
    public synchronized void abort() {
        closed = true;
        notifyAll();
    }

    @Override
    public void close() {
        abort();
        session.close();
    }

    public static class JavaScriptException extends RuntimeException {
        public JavaScriptException(String message) {
            super(message);
        }
    }
}
