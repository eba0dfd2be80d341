package com.chatcorpus.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Paces calls to an enrichment provider and trips a circuit breaker after a streak of
 * failures.
 *
 * <p>{@link #shouldRateLimit()} returns how many <b>milliseconds</b> the caller must wait
 * before the next call; {@code 0} means proceed immediately.  The caller sleeps, then
 * calls {@link #recordCall()} just before issuing the request.</p>
 *
 * <h3>Circuit breaker</h3>
 * <pre>
 *   CLOSED --(consecutive failures &gt;= threshold)--&gt; OPEN
 *   OPEN   --(cool-down elapsed, checked in isCircuitOpen)--&gt; CLOSED, counter reset
 * </pre>
 * <p>While open, callers skip the provider entirely and do not call
 * {@link #recordCall()}, so no pacing budget is used.</p>
 *
 * <p><b>Not thread-safe.</b> One instance belongs to one sequential enrichment run;
 * concurrent callers would need external synchronisation.</p>
 */
@Slf4j
public class RateLimiter {

    public static final long DEFAULT_DELAY_MS = 1_000;
    public static final int DEFAULT_CIRCUIT_BREAKER_THRESHOLD = 5;
    public static final long DEFAULT_CIRCUIT_BREAKER_RESET_MS = 60_000;

    private final long delayMs;
    private final int circuitBreakerThreshold;
    private final long circuitBreakerResetMs;
    private final Clock clock;

    private Long lastCallTimeMs;
    private int consecutiveFailures;
    private boolean circuitOpen;
    private Long circuitOpenedAtMs;

    public RateLimiter() {
        this(DEFAULT_DELAY_MS, DEFAULT_CIRCUIT_BREAKER_THRESHOLD, DEFAULT_CIRCUIT_BREAKER_RESET_MS,
                Clock.systemUTC());
    }

    /**
     * @param delayMs                 minimum spacing between calls; {@code 0} = no pacing
     * @param circuitBreakerThreshold consecutive failures that open the circuit (at least 1)
     * @param circuitBreakerResetMs   how long the circuit stays open
     * @param clock                   time source
     */
    public RateLimiter(long delayMs, int circuitBreakerThreshold, long circuitBreakerResetMs, Clock clock) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("rateLimitDelay must be non-negative");
        }
        if (circuitBreakerThreshold < 1) {
            throw new IllegalArgumentException("circuitBreakerThreshold must be >= 1");
        }
        if (circuitBreakerResetMs < 0) {
            throw new IllegalArgumentException("circuitBreakerResetMs must be non-negative");
        }
        this.delayMs = delayMs;
        this.circuitBreakerThreshold = circuitBreakerThreshold;
        this.circuitBreakerResetMs = circuitBreakerResetMs;
        this.clock = clock;
    }

    // ── Pacing ───────────────────────────────────────────────────────────

    /**
     * Milliseconds to wait before the next call; {@code 0} for the first call or once
     * the configured delay has passed since the last recorded call.
     */
    public long shouldRateLimit() {
        if (lastCallTimeMs == null) {
            return 0;
        }
        long sinceLastCall = clock.millis() - lastCallTimeMs;
        return sinceLastCall < delayMs ? delayMs - sinceLastCall : 0;
    }

    public void recordCall() {
        lastCallTimeMs = clock.millis();
    }

    // ── Circuit breaker ──────────────────────────────────────────────────

    public void recordSuccess() {
        consecutiveFailures = 0;
        circuitOpen = false;
        circuitOpenedAtMs = null;
    }

    public void recordFailure() {
        consecutiveFailures++;
        if (!circuitOpen && consecutiveFailures >= circuitBreakerThreshold) {
            circuitOpen = true;
            circuitOpenedAtMs = clock.millis();
            log.warn("Circuit breaker opened after {} consecutive failures; pausing calls for {} ms",
                    consecutiveFailures, circuitBreakerResetMs);
        }
    }

    /**
     * Whether calls must currently be skipped. Closes the circuit (and resets the
     * failure counter) once the cool-down has elapsed.
     */
    public boolean isCircuitOpen() {
        if (!circuitOpen) {
            return false;
        }
        long sinceOpened = clock.millis() - circuitOpenedAtMs;
        if (sinceOpened >= circuitBreakerResetMs) {
            log.info("Circuit breaker cool-down elapsed after {} ms; closing", sinceOpened);
            closeCircuit();
            return false;
        }
        return true;
    }

    public RateLimiterState getState() {
        return new RateLimiterState(lastCallTimeMs, consecutiveFailures, circuitOpen, circuitOpenedAtMs);
    }

    /** Back to the initial state, including the pacing timestamp. */
    public void reset() {
        lastCallTimeMs = null;
        closeCircuit();
    }

    private void closeCircuit() {
        consecutiveFailures = 0;
        circuitOpen = false;
        circuitOpenedAtMs = null;
    }
}
