package com.chatcorpus.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chatcorpus.testing.MutableClock;
import org.junit.jupiter.api.Test;

class RateLimiterTest {

    private final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
    private final RateLimiter limiter = new RateLimiter(1_000, 5, 60_000, clock);

    @Test
    void firstCallIsNotDelayed() {
        assertEquals(0, limiter.shouldRateLimit());
    }

    @Test
    void delayShrinksAsTimePasses() {
        limiter.recordCall();
        assertEquals(1_000, limiter.shouldRateLimit());

        clock.advanceMillis(400);
        assertEquals(600, limiter.shouldRateLimit());

        clock.advanceMillis(600);
        assertEquals(0, limiter.shouldRateLimit());
    }

    @Test
    void circuitOpensOnTheFifthConsecutiveFailure() {
        for (int i = 0; i < 4; i++) {
            limiter.recordFailure();
        }
        assertFalse(limiter.isCircuitOpen());
        assertEquals(4, limiter.getState().getConsecutiveFailures());

        limiter.recordFailure();
        assertTrue(limiter.isCircuitOpen());
    }

    @Test
    void circuitClosesAfterCoolDown() {
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure();
        }

        clock.advanceMillis(59_999);
        assertTrue(limiter.isCircuitOpen());

        clock.advanceMillis(1);
        assertFalse(limiter.isCircuitOpen());
        assertEquals(0, limiter.getState().getConsecutiveFailures());
        assertNull(limiter.getState().getCircuitOpenedAtMs());
    }

    @Test
    void successResetsTheFailureCount() {
        for (int i = 0; i < 4; i++) {
            limiter.recordFailure();
        }
        limiter.recordSuccess();
        for (int i = 0; i < 4; i++) {
            limiter.recordFailure();
        }

        assertFalse(limiter.isCircuitOpen());
    }

    @Test
    void failuresWhileOpenDoNotRestartTheCoolDown() {
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure();
        }
        long openedAt = limiter.getState().getCircuitOpenedAtMs();

        clock.advanceMillis(30_000);
        limiter.recordFailure();

        assertEquals(openedAt, limiter.getState().getCircuitOpenedAtMs());
    }

    @Test
    void resetForgetsEverything() {
        limiter.recordCall();
        for (int i = 0; i < 5; i++) {
            limiter.recordFailure();
        }

        limiter.reset();

        assertEquals(new RateLimiterState(null, 0, false, null), limiter.getState());
        assertEquals(0, limiter.shouldRateLimit());
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, 0, 0, clock));
    }
}
