package org.netpreserve.scrapekit.fetch;

import org.netpreserve.scrapekit.auth.LoginForm;
import org.netpreserve.scrapekit.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Authenticator;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.HttpCookie;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetches with {@link HttpClient}. Redirects are followed and cookies kept in a {@link CookieManager} that
 * serves as the session.
 */
public class HttpTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);
    // headers HttpClient refuses to let callers set
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host",
            "upgrade");

    private final TransportSettings settings;
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile HttpClient client;
    private volatile CookieManager cookieManager;
    private volatile ExecutorService executor;
    private volatile boolean closed;

    public HttpTransport(TransportSettings settings) {
        this.settings = settings;
    }

    @Override
    public TransportKind kind() {
        return TransportKind.HTTP;
    }

    @Override
    public void open(List<SessionCookie> restoredCookies) {
        cookieManager = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        Instant now = Instant.now();
        for (SessionCookie cookie : restoredCookies) {
            if (cookie.isExpired(now)) continue;
            cookieManager.getCookieStore().add(null, toHttpCookie(cookie, now));
        }
        executor = Executors.newCachedThreadPool(new NamedThreadFactory("http-transport"));
        var builder = HttpClient.newBuilder()
                .cookieHandler(cookieManager)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(settings.connectTimeout())
                .executor(executor);
        var proxy = settings.proxy();
        if (proxy.enabled()) {
            builder.proxy(ProxySelector.of(proxy.address()));
            if (proxy.hasCredentials()) {
                builder.authenticator(new ProxyAuthenticator(proxy.username(), proxy.password()));
            }
            log.info("Using proxy {}", proxy.server());
        }
        client = builder.build();
        log.debug("HTTP transport open with {} restored cookies", restoredCookies.size());
    }

    @Override
    public Exchange retrieve(URI url, Duration timeout) throws FetchException, InterruptedException {
        HttpRequest request = requestBuilder(url, timeout).GET().build();
        return exchange(url, request, timeout);
    }

    @Override
    public Exchange submit(FormSubmission submission, Duration timeout) throws FetchException, InterruptedException {
        LoginForm form = LoginForm.from(submission);
        log.debug("Submitting {}", form);
        String encoded = urlEncode(form.fields());
        HttpRequest.Builder builder;
        URI target = form.action();
        if (form.method().equals("GET")) {
            String separator = target.getRawQuery() == null ? "?" : "&";
            target = URI.create(target + separator + encoded);
            builder = requestBuilder(target, timeout).GET();
        } else {
            builder = requestBuilder(target, timeout)
                    .header("Content-Type", "application/x-www-form-urlencoded")
                    .POST(HttpRequest.BodyPublishers.ofString(encoded));
        }
        builder.header("Referer", submission.pageUrl().toString());
        form.headers().forEach(builder::header);
        return exchange(target, builder.build(), timeout);
    }

    private HttpRequest.Builder requestBuilder(URI url, Duration timeout) throws FetchCancelledException {
        if (closed || client == null) throw new FetchCancelledException(url, "Transport is closed");
        var builder = HttpRequest.newBuilder(url).timeout(timeout);
        settings.headers().forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) builder.header(name, value);
        });
        if (settings.userAgent() != null) builder.setHeader("User-Agent", settings.userAgent());
        return builder;
    }

    private Exchange exchange(URI url, HttpRequest request, Duration timeout) throws FetchException, InterruptedException {
        HttpClient client = this.client;
        if (client == null) throw new FetchCancelledException(url, "Transport is closed");
        CompletableFuture<HttpResponse<String>> future =
                client.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        inFlight.add(future);
        if (closed) future.cancel(true);
        try {
            // HttpRequest.timeout only bounds the wait for response headers, this bounds the body too
            HttpResponse<String> response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new HttpStatusException(response.uri(), status, response.body());
            }
            return new Exchange(response.uri(), status, response.body(), cookiesSetBy(response));
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FetchTimeoutException(url, timeout);
        } catch (CancellationException e) {
            throw new FetchCancelledException(url, "Transport closed during request", e);
        } catch (ExecutionException e) {
            throw translate(url, e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } finally {
            inFlight.remove(future);
        }
    }

    private FetchException translate(URI url, Throwable cause) {
        if (closed) return new FetchCancelledException(url, "Transport closed during request", cause);
        if (cause instanceof HttpTimeoutException) {
            return new FetchTimeoutException(url, cause.getMessage(), cause);
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (cause instanceof IOException) return new NetworkException(url, message, cause);
        return new NetworkException(url, "Request failed: " + message, cause);
    }

    private static List<SessionCookie> cookiesSetBy(HttpResponse<?> response) {
        var cookies = new ArrayList<SessionCookie>();
        for (HttpResponse<?> r = response; r != null; r = r.previousResponse().orElse(null)) {
            for (String header : r.headers().allValues("set-cookie")) {
                try {
                    for (HttpCookie cookie : HttpCookie.parse(header)) {
                        if (cookie.getDomain() == null) cookie.setDomain(r.uri().getHost());
                        cookies.add(toSessionCookie(cookie));
                    }
                } catch (IllegalArgumentException e) {
                    log.debug("Ignoring malformed Set-Cookie from {}: {}", r.uri(), e.getMessage());
                }
            }
        }
        return cookies;
    }

    private static String urlEncode(Map<String, String> fields) {
        var joiner = new StringJoiner("&");
        fields.forEach((name, value) -> joiner.add(URLEncoder.encode(name, StandardCharsets.UTF_8) + "=" +
                                                   URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return joiner.toString();
    }

    static SessionCookie toSessionCookie(HttpCookie cookie) {
        Instant expires = cookie.getMaxAge() < 0 ? null : Instant.now().plusSeconds(cookie.getMaxAge());
        return new SessionCookie(cookie.getName(), cookie.getValue(), cookie.getDomain(), cookie.getPath(),
                expires, cookie.getSecure(), cookie.isHttpOnly());
    }

    private static HttpCookie toHttpCookie(SessionCookie cookie, Instant now) {
        var httpCookie = new HttpCookie(cookie.name(), cookie.value());
        httpCookie.setDomain(cookie.domain());
        httpCookie.setPath(cookie.path());
        httpCookie.setSecure(cookie.secure());
        httpCookie.setHttpOnly(cookie.httpOnly());
        httpCookie.setVersion(0);
        if (cookie.expires() != null) {
            httpCookie.setMaxAge(Math.max(0, Duration.between(now, cookie.expires()).toSeconds()));
        }
        return httpCookie;
    }

    @Override
    public SessionHandle session() {
        if (cookieManager == null) throw new IllegalStateException("Transport not open");
        return new CookieJarSession(cookieManager.getCookieStore());
    }

    @Override
    public void clearSession() {
        if (cookieManager != null) cookieManager.getCookieStore().removeAll();
    }

    @Override
    public void close() {
        closed = true;
        for (var future : inFlight) {
            future.cancel(true);
        }
        if (executor != null) executor.shutdownNow();
        client = null;
    }

    private static class ProxyAuthenticator extends Authenticator {
        private final String username;
        private final char[] password;

        ProxyAuthenticator(String username, String password) {
            this.username = username;
            this.password = password == null ? new char[0] : password.toCharArray();
        }

        @Override
        protected PasswordAuthentication getPasswordAuthentication() {
            if (getRequestorType() != RequestorType.PROXY) return null;
            return new PasswordAuthentication(username, password);
        }
    }
}
