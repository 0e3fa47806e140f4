package org.netpreserve.scrapekit.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.scrapekit.util.DurationDeserializer;

import java.time.Duration;
import java.util.Map;

/**
 * Request pacing and concurrency.
 *
 * @param baseDelay          minimum spacing between request starts to the same target
 * @param jitter             random amount added to or subtracted from the spacing
 * @param concurrency        maximum fetches in flight across all targets
 * @param perTargetDelays    base delay overrides keyed by authority ({@code https://host:8443}) or bare host
 * @param maxBackoff         upper bound of the exponential backoff after repeated failures
 * @param cooldown           delay applied once a target reaches {@code cooldownThreshold} consecutive failures
 * @param backoffThreshold   consecutive failures before backoff starts
 * @param cooldownThreshold  consecutive failures before the cool-down applies
 * @param maxTargets         number of targets remembered before the least recently used is forgotten
 */
public record RateLimitConfig(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration baseDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration jitter,
        int concurrency,
        @JsonDeserialize(contentUsing = DurationDeserializer.class)
        Map<String, Duration> perTargetDelays,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxBackoff,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration cooldown,
        int backoffThreshold,
        int cooldownThreshold,
        int maxTargets
) {
    public RateLimitConfig {
        if (baseDelay == null) baseDelay = Duration.ofSeconds(1);
        if (jitter == null) jitter = Duration.ZERO;
        if (concurrency <= 0) concurrency = 5;
        perTargetDelays = perTargetDelays == null ? Map.of() : Map.copyOf(perTargetDelays);
        if (maxBackoff == null) maxBackoff = Duration.ofMinutes(5);
        if (cooldown == null) cooldown = Duration.ofHours(1);
        if (backoffThreshold <= 0) backoffThreshold = 3;
        if (cooldownThreshold <= 0) cooldownThreshold = 10;
        if (maxTargets <= 0) maxTargets = 10_000;
        if (baseDelay.isNegative() || jitter.isNegative()) {
            throw new IllegalArgumentException("baseDelay and jitter must not be negative");
        }
    }

    public static RateLimitConfig of(Duration baseDelay, Duration jitter, int concurrency) {
        return new RateLimitConfig(baseDelay, jitter, concurrency, null, null, null, 0, 0, 0);
    }

    public RateLimitConfig withPerTargetDelays(Map<String, Duration> perTargetDelays) {
        return new RateLimitConfig(baseDelay, jitter, concurrency, perTargetDelays, maxBackoff, cooldown,
                backoffThreshold, cooldownThreshold, maxTargets);
    }

    public RateLimitConfig withMaxTargets(int maxTargets) {
        return new RateLimitConfig(baseDelay, jitter, concurrency, perTargetDelays, maxBackoff, cooldown,
                backoffThreshold, cooldownThreshold, maxTargets);
    }
}
