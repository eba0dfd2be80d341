package com.chatcorpus.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.chatcorpus.testing.MutableClock;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    private final MutableClock clock = MutableClock.startingAt("2015-10-21T07:28:00Z");
    private final RetryPolicy policy = new RetryPolicy(3, new Random(42), clock);

    @Test
    void onlyRateLimitAndServerErrorsAreRetried() {
        assertTrue(RetryPolicy.isRetryableStatus(429));
        assertTrue(RetryPolicy.isRetryableStatus(500));
        assertTrue(RetryPolicy.isRetryableStatus(503));
        assertFalse(RetryPolicy.isRetryableStatus(400));
        assertFalse(RetryPolicy.isRetryableStatus(404));

        assertFalse(policy.decide(401, "5", 1).isRetry());
    }

    @Test
    void retryAfterSecondsTakesPrecedence() {
        RetryPolicy.Decision decision = policy.decide(429, "7", 1);

        assertTrue(decision.isRetry());
        assertEquals(7_000, decision.getDelayMs());
    }

    @Test
    void retryAfterHttpDateIsRelativeToNow() {
        assertEquals(30_000L, policy.parseRetryAfter("Wed, 21 Oct 2015 07:28:30 GMT"));
        assertEquals(0L, policy.parseRetryAfter("Wed, 21 Oct 2015 07:00:00 GMT"));
        assertNull(policy.parseRetryAfter("soon"));
        assertNull(policy.parseRetryAfter(null));
    }

    @Test
    void backoffDoublesWithinJitterBounds() {
        for (int attempt = 1; attempt <= 4; attempt++) {
            long base = (long) Math.pow(2, attempt) * 1_000;
            for (int i = 0; i < 100; i++) {
                long delay = policy.backoffMs(attempt);
                assertTrue(delay >= base * 0.75 && delay <= base * 1.25,
                        "attempt " + attempt + " delay " + delay);
            }
        }
    }

    @Test
    void budgetCountsRetriesAfterTheFirstAttempt() {
        assertTrue(policy.canRetry(1));
        assertTrue(policy.canRetry(3));
        assertFalse(policy.canRetry(4));
        assertFalse(new RetryPolicy(0).canRetry(1));
    }
}
