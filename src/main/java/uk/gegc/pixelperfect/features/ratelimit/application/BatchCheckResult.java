package uk.gegc.pixelperfect.features.ratelimit.application;

import java.time.Instant;

/**
 * @param currentCount jobs counted in the window, including this one when allowed
 * @param resetAt      when the oldest counted job leaves the window
 */
public record BatchCheckResult(
        boolean allowed,
        int currentCount,
        int limit,
        Instant resetAt
) {

    public int remaining() {
        return Math.max(0, limit - currentCount);
    }
}
