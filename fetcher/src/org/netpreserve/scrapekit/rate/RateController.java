package org.netpreserve.scrapekit.rate;

import org.netpreserve.scrapekit.config.RateLimitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admits fetches under a global concurrency limit while spacing out requests to the same target.
 * <p>
 * Spacing is reserved at admission: a caller computes how long it has to wait, records its own future start
 * time as the target's last request start and then sleeps outside the target's lock. Concurrent callers for
 * the same target therefore queue up one delay apart rather than all waking together.
 * <p>
 * Repeated failures raise a target's delay exponentially (with 20% randomisation) up to {@code maxBackoff},
 * and after {@code cooldownThreshold} failures in a row the target gets the long cool-down delay. A success
 * drops it back to the base delay.
 */
public class RateController {
    private static final Logger log = LoggerFactory.getLogger(RateController.class);

    public enum Outcome {
        SUCCESS, FAILURE
    }

    private final RateLimitConfig config;
    private final Semaphore slots;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Random random;
    private final Map<Target, Pacing> targets;

    public RateController(RateLimitConfig config) {
        this(config, Clock.systemUTC(), Sleeper.SYSTEM, new Random());
    }

    public RateController(RateLimitConfig config, Clock clock, Sleeper sleeper, Random random) {
        this.config = config;
        this.slots = new Semaphore(config.concurrency(), true);
        this.clock = clock;
        this.sleeper = sleeper;
        this.random = random;
        int maxTargets = config.maxTargets();
        this.targets = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Target, Pacing> eldest) {
                return size() > maxTargets;
            }
        });
    }

    /**
     * Waits for a free slot and for the target's spacing to elapse.
     *
     * @return a permit that must be closed when the fetch finishes, however it finishes
     * @throws InterruptedException if interrupted while waiting; no slot is held afterwards
     */
    public Permit admit(Target target) throws InterruptedException {
        slots.acquire();
        var permit = new Permit(target);
        try {
            Duration wait = pacing(target).reserve(clock.instant(), jitter());
            if (!wait.isZero()) {
                log.atDebug().addKeyValue("target", target).addKeyValue("waitMs", wait.toMillis())
                        .log("Pacing request");
                sleeper.sleep(wait);
            }
            return permit;
        } catch (InterruptedException | RuntimeException e) {
            permit.close();
            throw e;
        }
    }

    /**
     * Records how a fetch to the target went, adjusting its delay.
     */
    public void report(Target target, Outcome outcome) {
        var pacing = pacing(target);
        if (outcome == Outcome.SUCCESS) {
            pacing.recordSuccess();
        } else {
            pacing.recordFailure(clock.instant(), random.nextDouble(0.8, 1.2));
        }
    }

    public TargetState snapshot(Target target) {
        return pacing(target).snapshot();
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public int concurrency() {
        return config.concurrency();
    }

    int trackedTargets() {
        return targets.size();
    }

    private Pacing pacing(Target target) {
        return targets.computeIfAbsent(target, t -> new Pacing(t, baseDelayFor(t)));
    }

    private Duration baseDelayFor(Target target) {
        var overrides = config.perTargetDelays();
        Duration delay = overrides.get(target.authority());
        if (delay == null) delay = overrides.get(target.host());
        return delay != null ? delay : config.baseDelay();
    }

    private Duration jitter() {
        long jitterNanos = config.jitter().toNanos();
        if (jitterNanos == 0) return Duration.ZERO;
        return Duration.ofNanos((long) (random.nextDouble(-1.0, 1.0) * jitterNanos));
    }

    /**
     * A held admission slot. Closing releases it; closing again does nothing.
     */
    public class Permit implements AutoCloseable {
        private final Target target;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(Target target) {
            this.target = target;
        }

        public Target target() {
            return target;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                slots.release();
            }
        }
    }

    private class Pacing {
        private final Target target;
        private final Duration baseDelay;
        private Duration delay;
        private int consecutiveErrors;
        private Instant lastRequestStart;

        Pacing(Target target, Duration baseDelay) {
            this.target = target;
            this.baseDelay = baseDelay;
            this.delay = baseDelay;
        }

        synchronized Duration reserve(Instant now, Duration jitter) {
            Duration required = Duration.ZERO;
            if (lastRequestStart != null) {
                Duration elapsed = Duration.between(lastRequestStart, now);
                required = delay.plus(jitter).minus(elapsed);
                if (required.isNegative()) required = Duration.ZERO;
            }
            lastRequestStart = now.plus(required);
            return required;
        }

        synchronized void recordSuccess() {
            if (consecutiveErrors > 0) {
                log.atInfo().addKeyValue("target", target).addKeyValue("errors", consecutiveErrors)
                        .log("Target recovered, resetting delay");
            }
            consecutiveErrors = 0;
            delay = baseDelay;
        }

        synchronized void recordFailure(Instant now, double randomFactor) {
            consecutiveErrors++;
            // a failure is evidence of a request even if none went through admit()
            if (lastRequestStart == null) lastRequestStart = now;
            if (consecutiveErrors >= config.cooldownThreshold()) {
                delay = max(delay, config.cooldown());
                restartPenaltyAt(now);
                log.atError().addKeyValue("target", target).addKeyValue("errors", consecutiveErrors)
                        .addKeyValue("delayMs", delay.toMillis())
                        .log("Too many consecutive failures, cooling down");
            } else if (consecutiveErrors >= config.backoffThreshold()) {
                double factor = Math.pow(2, consecutiveErrors - 2) * randomFactor;
                long backoffMillis = (long) Math.min(config.maxBackoff().toMillis(), baseDelay.toMillis() * factor);
                delay = max(delay, Duration.ofMillis(backoffMillis));
                restartPenaltyAt(now);
                log.atWarn().addKeyValue("target", target).addKeyValue("errors", consecutiveErrors)
                        .addKeyValue("delayMs", delay.toMillis())
                        .log("Backing off after repeated failures");
            }
        }

        // the raised delay runs from the failure, not from the start of the request that failed
        private void restartPenaltyAt(Instant now) {
            if (lastRequestStart.isBefore(now)) lastRequestStart = now;
        }

        synchronized TargetState snapshot() {
            return new TargetState(target, baseDelay, delay, consecutiveErrors, lastRequestStart);
        }
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
