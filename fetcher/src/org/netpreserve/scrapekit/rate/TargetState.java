package org.netpreserve.scrapekit.rate;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * Point in time view of a target's pacing state.
 *
 * @param target            the target
 * @param baseDelay         configured spacing for this target
 * @param delay             current spacing, raised above the base by backoff
 * @param consecutiveErrors failures reported since the last success
 * @param lastRequestStart  start time reserved by the most recent admission, null if none yet
 */
public record TargetState(Target target, Duration baseDelay, Duration delay, int consecutiveErrors,
                          @Nullable Instant lastRequestStart) {
    public boolean isBackingOff() {
        return delay.compareTo(baseDelay) > 0;
    }
}
