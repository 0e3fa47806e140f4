package org.netpreserve.scrapekit.fetch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.scrapekit.config.RateLimitConfig;
import org.netpreserve.scrapekit.rate.RateController;
import org.netpreserve.scrapekit.rate.Target;

import java.io.IOException;
import java.net.CookieManager;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FetchEngineFailureTest {
    private static final URI BASE = URI.create("https://example.org/");

    private final Transport transport = mock(Transport.class);
    private final RateController rateController =
            new RateController(RateLimitConfig.of(Duration.ZERO, Duration.ZERO, 2));
    private FetchEngine engine;

    @BeforeEach
    void setUp() {
        when(transport.kind()).thenReturn(TransportKind.HTTP);
        when(transport.session()).thenReturn(new CookieJarSession(new CookieManager().getCookieStore()));
        engine = new FetchEngine(BASE, rateController, transport, Duration.ofSeconds(1), List.of());
    }

    @AfterEach
    void tearDown() {
        engine.close();
        Thread.interrupted();
    }

    private int errors() {
        return rateController.snapshot(Target.of(BASE)).consecutiveErrors();
    }

    @Test
    void openFailureIsNetworkError() throws Exception {
        doThrow(new IOException("no browser")).when(transport).open(any());
        var e = assertThrows(NetworkException.class, () -> engine.fetch(FetchRequest.of("/a")));
        assertTrue(e.getMessage().contains("no browser"));
        verify(transport, never()).retrieve(any(), any());

        doNothing().when(transport).open(any());
        when(transport.retrieve(any(), any())).thenReturn(new Transport.Exchange(BASE.resolve("/a"), 200, "ok", List.of()));
        assertEquals("ok", engine.fetch(FetchRequest.of("/a")).content(), "a failed open can be retried");
    }

    @Test
    void unexpectedTransportErrorIsReportedAsNetworkError() throws Exception {
        when(transport.retrieve(any(), any())).thenThrow(new IllegalStateException("boom"));
        var e = assertThrows(NetworkException.class, () -> engine.fetch(FetchRequest.of("/a")));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(1, errors());
        assertEquals(2, rateController.availableSlots());
    }

    @Test
    void interruptionIsCancellationNotFailure() throws Exception {
        when(transport.retrieve(any(), any())).thenThrow(new InterruptedException());
        var e = assertThrows(FetchCancelledException.class, () -> engine.fetch(FetchRequest.of("/a")));
        assertEquals(FetchStatus.CANCELLED, e.status());
        assertTrue(Thread.interrupted(), "interrupt flag restored");
        assertEquals(0, errors());
        assertEquals(2, rateController.availableSlots());
    }

    @Test
    void cookiesAreMergedBySlot() throws Exception {
        var first = new SessionCookie("sid", "one", "example.org", "/", null, true, true);
        var replaced = new SessionCookie("sid", "two", ".example.org", "/", null, true, true);
        var other = new SessionCookie("pref", "dark", "example.org", "/", null, false, false);
        var expired = new SessionCookie("pref", "gone", "example.org", "/", Instant.EPOCH, false, false);
        when(transport.retrieve(any(), any()))
                .thenReturn(new Transport.Exchange(BASE, 200, "", List.of(first, other)))
                .thenReturn(new Transport.Exchange(BASE, 200, "", List.of(replaced, expired)));

        engine.fetch(FetchRequest.of("/"));
        engine.fetch(FetchRequest.of("/"));

        assertEquals(List.of(replaced), engine.capturedCookies());
    }

    @Test
    void closeClosesTransportOnce() throws Exception {
        engine.initialize();
        engine.close();
        engine.close();
        verify(transport, times(1)).close();
    }
}
