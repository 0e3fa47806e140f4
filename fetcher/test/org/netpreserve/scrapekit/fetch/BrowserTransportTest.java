package org.netpreserve.scrapekit.fetch;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.netpreserve.scrapekit.TestServer;
import org.netpreserve.scrapekit.auth.Credentials;
import org.netpreserve.scrapekit.auth.FieldMap;
import org.netpreserve.scrapekit.auth.SessionNegotiator;
import org.netpreserve.scrapekit.cdp.BrowserProcess;
import org.netpreserve.scrapekit.config.BrowserConfig;
import org.netpreserve.scrapekit.config.ProxyConfig;
import org.netpreserve.scrapekit.config.RateLimitConfig;
import org.netpreserve.scrapekit.rate.RateController;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.scrapekit.TestServer.body;
import static org.netpreserve.scrapekit.TestServer.redirect;
import static org.netpreserve.scrapekit.TestServer.respond;

@EnabledIf("browserAvailable")
class BrowserTransportTest {
    private static TestServer server;

    static boolean browserAvailable() {
        return BrowserProcess.findExecutable().isPresent();
    }

    @BeforeAll
    static void startServer() throws IOException {
        server = new TestServer()
                .route("/start", exchange -> redirect(exchange, 302, "/page"))
                .route("/page", exchange -> {
                    exchange.getResponseHeaders().add("Set-Cookie", "visited=yes; Path=/");
                    respond(exchange, 200, "<html><body><p id=msg>Arrived</p>" +
                                           "<script>document.getElementById('msg').textContent += ' by script'</script>" +
                                           "</body></html>");
                })
                .route("/whoami", exchange -> {
                    String cookie = exchange.getRequestHeaders().getFirst("Cookie");
                    respond(exchange, 200, "<html><body>" + (cookie == null ? "anonymous" : cookie) + "</body></html>");
                })
                .route("/signin", exchange -> respond(exchange, 200, """
                        <html><body><form action="/session" method="post">
                        <input id="user" name="login"><input id="pass" name="pw" type="password">
                        <button id="go" type="submit">Log in</button>
                        </form></body></html>"""))
                .route("/session", exchange -> {
                    if (body(exchange).contains("pw=secret")) {
                        exchange.getResponseHeaders().add("Set-Cookie", "sid=browser; Path=/");
                        redirect(exchange, 303, "/home");
                    } else {
                        respond(exchange, 200, "<html><body>Invalid credentials</body></html>");
                    }
                })
                .route("/home", exchange -> respond(exchange, 200, "<html><body><a href=/x>Logout</a></body></html>"))
                .route("/missing", exchange -> respond(exchange, 404, "<html><body>Not here</body></html>"));
    }

    @AfterAll
    static void stopServer() {
        server.close();
    }

    private static FetchEngine engine(List<SessionCookie> restored) {
        var settings = new TransportSettings(Map.of(), "ScrapekitTest/1.0", ProxyConfig.DISABLED,
                Duration.ofSeconds(10), new BrowserConfig(null, List.of("--no-sandbox"), true));
        return new FetchEngine(server.baseUrl(), new RateController(RateLimitConfig.of(Duration.ZERO, Duration.ZERO, 2)),
                new BrowserTransport(settings), Duration.ofSeconds(10), restored);
    }

    @Test
    void rendersPageAfterRedirect() throws Exception {
        try (var engine = engine(List.of())) {
            var result = engine.fetch(FetchRequest.of("/start"));
            assertEquals(server.url("/page"), result.finalUrl());
            assertEquals(200, result.statusCode());
            assertTrue(result.content().contains("Arrived by script"), result.content());
            assertTrue(result.newCookies().stream().anyMatch(cookie -> cookie.name().equals("visited")));
            assertEquals(TransportKind.BROWSER, engine.session().transport());
        }
    }

    @Test
    void errorStatusRaises() {
        try (var engine = engine(List.of())) {
            var e = assertThrows(HttpStatusException.class, () -> engine.fetch(FetchRequest.of("/missing")));
            assertEquals(404, e.statusCode());
        }
    }

    @Test
    void restoredCookiesAreSent() throws Exception {
        var cookie = new SessionCookie("sid", "restored", "127.0.0.1", "/", null, false, false);
        try (var engine = engine(List.of(cookie))) {
            assertTrue(engine.fetch(FetchRequest.of("/whoami")).content().contains("sid=restored"));
        }
    }

    @Test
    void logsInByFillingTheForm() throws Exception {
        try (var engine = engine(List.of())) {
            var session = new SessionNegotiator().login(engine, "/signin",
                    new FieldMap("#user", "#pass", "#go", null), new Credentials("alice", "secret"));
            assertTrue(session.cookies().stream().anyMatch(cookie -> cookie.name().equals("sid")));
            assertTrue(engine.fetch(FetchRequest.of("/whoami")).content().contains("sid=browser"));
        }
    }
}
