package com.chatcorpus.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Point-in-time copy of a {@link RateLimiter}'s state, for logging and tests.
 */
@Data
@AllArgsConstructor
public class RateLimiterState {

    /** Epoch millis of the last recorded call, {@code null} before the first. */
    private final Long lastCallTimeMs;

    private final int consecutiveFailures;
    private final boolean circuitOpen;
    private final Long circuitOpenedAtMs;
}
