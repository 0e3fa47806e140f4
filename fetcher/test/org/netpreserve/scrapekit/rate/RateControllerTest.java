package org.netpreserve.scrapekit.rate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.netpreserve.scrapekit.config.RateLimitConfig;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.netpreserve.scrapekit.rate.RateController.Outcome.FAILURE;
import static org.netpreserve.scrapekit.rate.RateController.Outcome.SUCCESS;

class RateControllerTest {
    private static final Target EXAMPLE = Target.of(URI.create("https://example.org/page"));
    private static final Target OTHER = Target.of(URI.create("https://other.example/"));

    private ManualClock clock;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
    }

    // nextDouble() of 0.5 makes every randomisation factor land in the middle of its range: 1.0 for backoff, 0 jitter
    private static Random midpointRandom() {
        return new Random() {
            @Override
            public double nextDouble() {
                return 0.5;
            }
        };
    }

    private RateController controller(RateLimitConfig config) {
        return new RateController(config, clock, clock.sleeper(), midpointRandom());
    }

    @Test
    void sequentialRequestsToSameTargetAreSpacedByBaseDelay() throws Exception {
        var rateController = controller(RateLimitConfig.of(Duration.ofSeconds(1), Duration.ZERO, 5));

        Instant firstStart;
        try (var permit = rateController.admit(EXAMPLE)) {
            firstStart = clock.instant();
        }
        Instant secondStart;
        try (var permit = rateController.admit(EXAMPLE)) {
            secondStart = clock.instant();
        }

        assertTrue(Duration.between(firstStart, secondStart).compareTo(Duration.ofSeconds(1)) >= 0);
        assertEquals(Duration.ofSeconds(1), clock.lastSleep());
    }

    @Test
    void elapsedTimeCountsTowardsTheDelay() throws Exception {
        var rateController = controller(RateLimitConfig.of(Duration.ofSeconds(1), Duration.ZERO, 5));
        rateController.admit(EXAMPLE).close();
        clock.advance(Duration.ofMillis(700));
        rateController.admit(EXAMPLE).close();
        assertEquals(Duration.ofMillis(300), clock.lastSleep());

        clock.advance(Duration.ofSeconds(5));
        rateController.admit(EXAMPLE).close();
        assertEquals(1, clock.sleeps.size(), "no sleep once the delay has passed");
    }

    @Test
    void differentTargetsDoNotWaitForEachOther() throws Exception {
        var rateController = controller(RateLimitConfig.of(Duration.ofSeconds(1), Duration.ZERO, 5));
        rateController.admit(EXAMPLE).close();
        rateController.admit(OTHER).close();
        assertTrue(clock.sleeps.isEmpty());
    }

    @Test
    void backoffAfterThreeFailuresAndResetOnSuccess() throws Exception {
        var rateController = controller(RateLimitConfig.of(Duration.ofSeconds(1), Duration.ZERO, 5));
        for (int i = 0; i < 3; i++) {
            rateController.admit(EXAMPLE).close();
            rateController.report(EXAMPLE, FAILURE);
        }
        assertEquals(3, rateController.snapshot(EXAMPLE).consecutiveErrors());
        assertEquals(Duration.ofSeconds(2), rateController.snapshot(EXAMPLE).delay());

        rateController.admit(EXAMPLE).close();
        assertEquals(Duration.ofSeconds(2), clock.lastSleep());

        rateController.report(EXAMPLE, SUCCESS);
        var state = rateController.snapshot(EXAMPLE);
        assertEquals(0, state.consecutiveErrors());
        assertFalse(state.isBackingOff());

        rateController.admit(EXAMPLE).close();
        assertEquals(Duration.ofSeconds(1), clock.lastSleep());
    }

    @Test
    void delayNeverDecreasesWhileFailing() {
        var rateController = controller(RateLimitConfig.of(Duration.ofSeconds(1), Duration.ZERO, 5));
        Duration previous = Duration.ZERO;
        for (int i = 1; i <= 15; i++) {
            rateController.report(EXAMPLE, FAILURE);
            Duration delay = rateController.snapshot(EXAMPLE).delay();
            assertTrue(delay.compareTo(previous) >= 0, "delay decreased at failure " + i);
            if (i < 10) assertTrue(delay.compareTo(Duration.ofMinutes(5)) <= 0, "backoff exceeded max");
            previous = delay;
        }
    }

    @Test
    void tenFailuresForceCooldown() throws Exception {
        var rateController = controller(RateLimitConfig.of(Duration.ofSeconds(1), Duration.ZERO, 5));
        for (int i = 0; i < 10; i++) {
            rateController.report(EXAMPLE, FAILURE);
        }
        assertTrue(rateController.snapshot(EXAMPLE).delay().compareTo(Duration.ofHours(1)) >= 0);

        rateController.admit(EXAMPLE).close();
        assertTrue(clock.lastSleep().compareTo(Duration.ofSeconds(3600)) >= 0);
    }

    @Test
    void cooldownRunsFromTheFailureNotTheRequestStart() throws Exception {
        var rateController = controller(RateLimitConfig.of(Duration.ofSeconds(1), Duration.ZERO, 5));
        for (int i = 0; i < 10; i++) {
            rateController.admit(EXAMPLE).close();
            clock.advance(Duration.ofSeconds(30));
            rateController.report(EXAMPLE, FAILURE);
        }

        rateController.admit(EXAMPLE).close();
        assertEquals(Duration.ofHours(1), clock.lastSleep());
    }

    @Test
    void backoffRunsFromTheFailure() throws Exception {
        var rateController = controller(RateLimitConfig.of(Duration.ofSeconds(1), Duration.ZERO, 5));
        for (int i = 0; i < 3; i++) {
            rateController.admit(EXAMPLE).close();
            clock.advance(Duration.ofSeconds(1));
            rateController.report(EXAMPLE, FAILURE);
        }

        // third failure: 1s * 2^(3-2) * 1.0
        rateController.admit(EXAMPLE).close();
        assertEquals(Duration.ofSeconds(2), clock.lastSleep());
    }

    @Test
    void perTargetDelayOverridesBaseDelay() {
        var config = RateLimitConfig.of(Duration.ofSeconds(1), Duration.ZERO, 5)
                .withPerTargetDelays(Map.of(
                        "http://localhost:8080", Duration.ofSeconds(5),
                        "example.org", Duration.ofSeconds(2)));
        var rateController = controller(config);

        assertEquals(Duration.ofSeconds(5),
                rateController.snapshot(Target.of(URI.create("http://LOCALHOST:8080/x"))).baseDelay());
        assertEquals(Duration.ofSeconds(2), rateController.snapshot(EXAMPLE).baseDelay());
        assertEquals(Duration.ofSeconds(1), rateController.snapshot(OTHER).baseDelay());
    }

    @Test
    void concurrencyIsCapped() throws Exception {
        var rateController = controller(RateLimitConfig.of(Duration.ZERO, Duration.ZERO, 2));
        var first = rateController.admit(EXAMPLE);
        var second = rateController.admit(OTHER);
        assertEquals(0, rateController.availableSlots());

        var started = new CountDownLatch(1);
        var third = CompletableFuture.supplyAsync(() -> {
            started.countDown();
            try {
                return rateController.admit(Target.of(URI.create("http://third.example/")));
            } catch (InterruptedException e) {
                throw new RuntimeException(e);
            }
        });
        started.await();
        assertThrows(TimeoutException.class, () -> third.get(200, TimeUnit.MILLISECONDS));

        first.close();
        third.get(5, TimeUnit.SECONDS).close();
        second.close();
        assertEquals(2, rateController.availableSlots());
    }

    @Test
    void permitReleasesOnlyOnce() throws Exception {
        var rateController = controller(RateLimitConfig.of(Duration.ZERO, Duration.ZERO, 2));
        var permit = rateController.admit(EXAMPLE);
        permit.close();
        permit.close();
        assertEquals(2, rateController.availableSlots());
        assertEquals(EXAMPLE, permit.target());
    }

    @Test
    void interruptedPacingSleepReleasesSlot() throws Exception {
        Sleeper interrupting = duration -> {
            throw new InterruptedException("test");
        };
        var rateController = new RateController(RateLimitConfig.of(Duration.ofSeconds(1), Duration.ZERO, 3),
                clock, interrupting, midpointRandom());
        rateController.admit(EXAMPLE).close();

        assertThrows(InterruptedException.class, () -> rateController.admit(EXAMPLE));
        assertEquals(3, rateController.availableSlots());
    }

    @Test
    void interruptedWhileWaitingForSlotHoldsNothing() throws Exception {
        var rateController = controller(RateLimitConfig.of(Duration.ZERO, Duration.ZERO, 1));
        var held = rateController.admit(EXAMPLE);
        var result = new CompletableFuture<Throwable>();
        var thread = new Thread(() -> {
            try {
                rateController.admit(OTHER).close();
                result.complete(null);
            } catch (Throwable t) {
                result.complete(t);
            }
        });
        thread.start();
        thread.interrupt();
        assertInstanceOf(InterruptedException.class, result.get(5, TimeUnit.SECONDS));
        held.close();
        assertEquals(1, rateController.availableSlots());
    }

    @Test
    void failureWithoutAdmissionStillStartsSpacing() {
        var rateController = controller(RateLimitConfig.of(Duration.ofSeconds(1), Duration.ZERO, 1));
        rateController.report(EXAMPLE, FAILURE);
        assertEquals(clock.instant(), rateController.snapshot(EXAMPLE).lastRequestStart());
    }

    @Test
    void leastRecentlyUsedTargetsAreForgotten() throws Exception {
        var rateController = controller(RateLimitConfig.of(Duration.ZERO, Duration.ZERO, 5).withMaxTargets(2));
        rateController.report(EXAMPLE, FAILURE);
        rateController.admit(OTHER).close();
        rateController.admit(Target.of(URI.create("http://third.example/"))).close();

        assertEquals(2, rateController.trackedTargets());
        assertEquals(0, rateController.snapshot(EXAMPLE).consecutiveErrors(), "evicted target starts afresh");
    }

    @Test
    void jitterStaysWithinBounds() throws Exception {
        var rateController = new RateController(
                RateLimitConfig.of(Duration.ofSeconds(1), Duration.ofMillis(200), 1), clock, clock.sleeper(),
                new Random(42));
        for (int i = 0; i < 20; i++) {
            rateController.admit(EXAMPLE).close();
        }
        for (Duration sleep : clock.sleeps) {
            assertTrue(sleep.compareTo(Duration.ofMillis(800)) >= 0 && sleep.compareTo(Duration.ofMillis(1200)) <= 0,
                    "sleep out of range: " + sleep);
        }
    }
}
