package org.netpreserve.scrapekit.fetch;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scrapekit.ConfigurationException;
import org.netpreserve.scrapekit.config.ScraperConfig;
import org.netpreserve.scrapekit.rate.RateController;
import org.netpreserve.scrapekit.rate.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Retrieves pages through one {@link Transport}, pacing every request through a shared {@link RateController}
 * and owning the session state the transport accumulates.
 * <p>
 * An engine is opened once (explicitly or by its first fetch) and closed once. Closing cancels fetches still in
 * flight. Cookies captured while open stay available from {@link #capturedCookies()} after close so a later
 * engine can start from the same session.
 */
public class FetchEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FetchEngine.class);

    private enum State {
        NEW, OPEN, CLOSED
    }

    private final @Nullable URI baseUrl;
    private final RateController rateController;
    private final Transport transport;
    private final Duration defaultTimeout;
    private final List<SessionCookie> capturedCookies = new ArrayList<>(); // guarded by itself
    private final Set<Thread> awaitingAdmission = new HashSet<>(); // guarded by itself
    private volatile State state = State.NEW;

    public FetchEngine(ScraperConfig config, RateController rateController) {
        this(config.baseUrl(), rateController, createTransport(config.transport(), TransportSettings.from(config)),
                config.timeout(), List.of());
    }

    FetchEngine(@Nullable URI baseUrl, RateController rateController, Transport transport, Duration defaultTimeout,
                List<SessionCookie> restoredCookies) {
        this.baseUrl = baseUrl;
        this.rateController = rateController;
        this.transport = transport;
        this.defaultTimeout = defaultTimeout;
        restoreCookies(restoredCookies);
    }

    public static Transport createTransport(TransportKind kind, TransportSettings settings) {
        return switch (kind) {
            case HTTP -> new HttpTransport(settings);
            case BROWSER -> new BrowserTransport(settings);
        };
    }

    public TransportKind transportKind() {
        return transport.kind();
    }

    public @Nullable URI baseUrl() {
        return baseUrl;
    }

    /**
     * Cookies to load into the transport when it opens.
     *
     * @throws IllegalStateException if the engine is already open
     */
    public void restoreCookies(List<SessionCookie> cookies) {
        if (state != State.NEW) throw new IllegalStateException("Cookies can only be restored before initialize()");
        synchronized (capturedCookies) {
            cookies.forEach(this::capture);
        }
    }

    /**
     * Opens the transport. Calling it again has no effect.
     *
     * @throws IllegalStateException if the engine has been closed
     */
    public synchronized void initialize() throws IOException {
        if (state == State.OPEN) return;
        if (state == State.CLOSED) throw new IllegalStateException("FetchEngine is closed");
        List<SessionCookie> restored;
        synchronized (capturedCookies) {
            restored = List.copyOf(capturedCookies);
        }
        transport.open(restored);
        state = State.OPEN;
        log.atInfo().addKeyValue("transport", transport.kind())
                .addKeyValue("restoredCookies", restored.size())
                .log("Fetch engine initialized");
    }

    /**
     * Fetches a page. Waits for admission first, so this may block for a while before any request goes out.
     *
     * @throws FetchException               if the page couldn't be retrieved; the target has been reported as
     *                                      failing unless the fetch was cancelled
     * @throws ConfigurationException       if the URL is invalid or needs a transport this engine doesn't have
     */
    public FetchResult fetch(FetchRequest request) throws FetchException {
        URI url = request.resolve(baseUrl);
        if (request.transportHint() != null && request.transportHint() != transport.kind()) {
            throw new ConfigurationException("Request for " + url + " needs the " + request.transportHint() +
                                             " transport but this engine uses " + transport.kind());
        }
        Duration timeout = request.timeout() != null ? request.timeout() : defaultTimeout;
        return perform(url, () -> transport.retrieve(url, timeout));
    }

    /**
     * Fills in and submits a login form through the transport, under the same admission and reporting as
     * {@link #fetch(FetchRequest)}.
     */
    public FetchResult submitForm(FormSubmission submission) throws FetchException {
        return perform(submission.pageUrl(), () -> transport.submit(submission, defaultTimeout));
    }

    private FetchResult perform(URI url, TransportCall call) throws FetchException {
        ensureOpen(url);
        Target target = Target.of(url);
        try (var permit = admit(url, target)) {
            if (state == State.CLOSED) throw new FetchCancelledException(url, "FetchEngine is closed");
            long start = System.nanoTime();
            Transport.Exchange exchange = call.exchange();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            synchronized (capturedCookies) {
                exchange.newCookies().forEach(this::capture);
            }
            rateController.report(target, RateController.Outcome.SUCCESS);
            log.atDebug().addKeyValue("url", url)
                    .addKeyValue("finalUrl", exchange.finalUrl())
                    .addKeyValue("status", exchange.statusCode())
                    .addKeyValue("elapsedMs", elapsed.toMillis())
                    .log("Fetched");
            return new FetchResult(url, exchange.finalUrl(), exchange.statusCode(), exchange.content(),
                    FetchStatus.SUCCESS, exchange.newCookies(), elapsed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchCancelledException(url, "Interrupted", e);
        } catch (FetchException e) {
            if (e.status() != FetchStatus.CANCELLED) {
                rateController.report(target, RateController.Outcome.FAILURE);
            }
            log.atWarn().addKeyValue("url", url)
                    .addKeyValue("status", e.status())
                    .log("Fetch failed: {}", e.getMessage());
            throw e;
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            rateController.report(target, RateController.Outcome.FAILURE);
            log.atWarn().addKeyValue("url", url).setCause(e).log("Fetch failed unexpectedly");
            throw new NetworkException(url, "Unexpected transport error: " + e, e);
        }
    }

    /**
     * Waits for admission in a way {@link #close()} can cut short.
     */
    private RateController.Permit admit(URI url, Target target) throws FetchCancelledException, InterruptedException {
        Thread thread = Thread.currentThread();
        synchronized (awaitingAdmission) {
            if (state == State.CLOSED) throw new FetchCancelledException(url, "FetchEngine is closed");
            awaitingAdmission.add(thread);
        }
        try {
            return rateController.admit(target);
        } catch (InterruptedException e) {
            if (state != State.CLOSED) throw e;
            throw new FetchCancelledException(url, "FetchEngine closed while waiting for admission", e);
        } finally {
            synchronized (awaitingAdmission) {
                awaitingAdmission.remove(thread);
            }
            // a close() racing with a successful admit may still have interrupted us
            if (state == State.CLOSED) Thread.interrupted();
        }
    }

    private void ensureOpen(URI url) throws FetchException {
        if (state == State.OPEN) return;
        if (state == State.CLOSED) throw new FetchCancelledException(url, "FetchEngine is closed");
        try {
            initialize();
        } catch (IllegalStateException e) {
            throw new FetchCancelledException(url, "FetchEngine is closed", e);
        } catch (IOException e) {
            throw new NetworkException(url, "Unable to initialize " + transport.kind() + " transport: " +
                                            e.getMessage(), e);
        }
    }

    // replaces any cookie in the same slot, drops it if the update expired it
    private void capture(SessionCookie cookie) {
        capturedCookies.removeIf(existing -> existing.sameSlot(cookie));
        if (!cookie.isExpired(Instant.now())) capturedCookies.add(cookie);
    }

    /**
     * The live session.
     *
     * @throws IllegalStateException if the engine isn't open
     */
    public SessionHandle session() {
        if (state != State.OPEN) throw new IllegalStateException("FetchEngine is not open");
        return transport.session();
    }

    /**
     * Cookies collected by this engine so far, including any it was started with.
     */
    public List<SessionCookie> capturedCookies() {
        synchronized (capturedCookies) {
            return List.copyOf(capturedCookies);
        }
    }

    /**
     * Drops all session state. Subsequent fetches run logged out.
     */
    public void invalidateSession() {
        synchronized (capturedCookies) {
            capturedCookies.clear();
        }
        if (state == State.OPEN) transport.clearSession();
        log.info("Session invalidated");
    }

    public boolean isClosed() {
        return state == State.CLOSED;
    }

    @Override
    public void close() {
        State previous;
        synchronized (this) {
            previous = state;
            state = State.CLOSED;
        }
        synchronized (awaitingAdmission) {
            awaitingAdmission.forEach(Thread::interrupt);
        }
        if (previous != State.OPEN) return;
        try {
            var cookies = transport.session().cookies();
            synchronized (capturedCookies) {
                cookies.forEach(this::capture);
            }
        } catch (RuntimeException e) {
            log.debug("Unable to snapshot session cookies on close: {}", e.toString());
        }
        transport.close();
        log.atInfo().addKeyValue("transport", transport.kind()).log("Fetch engine closed");
    }

    @FunctionalInterface
    private interface TransportCall {
        Transport.Exchange exchange() throws FetchException, InterruptedException;
    }
}
