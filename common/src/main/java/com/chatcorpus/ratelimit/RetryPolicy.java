package com.chatcorpus.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Decides whether, and after how long, a single provider HTTP call is retried.
 *
 * <ul>
 *   <li>Only {@code 429} and {@code 5xx} responses are retried.</li>
 *   <li>A {@code Retry-After} header (delta-seconds or HTTP date) takes precedence.</li>
 *   <li>Otherwise the delay is {@code 2^attempt} seconds with &plusmn;25% jitter.</li>
 *   <li>At most {@code maxRetries} retries follow the first attempt.</li>
 * </ul>
 */
public class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 3;

    private static final double JITTER_FRACTION = 0.25;
    private static final Pattern DELTA_SECONDS = Pattern.compile("\\d{1,9}");

    private final int maxRetries;
    private final Random random;
    private final Clock clock;

    public RetryPolicy(int maxRetries) {
        this(maxRetries, new Random(), Clock.systemUTC());
    }

    public RetryPolicy(int maxRetries, Random random, Clock clock) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative");
        }
        this.maxRetries = maxRetries;
        this.random = random;
        this.clock = clock;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Whether retry number {@code attempt} (1-based) is still within budget.
     */
    public boolean canRetry(int attempt) {
        return attempt <= maxRetries;
    }

    public static boolean isRetryableStatus(int status) {
        return status == 429 || (status >= 500 && status < 600);
    }

    /**
     * @param status     HTTP status of the failed attempt
     * @param retryAfter raw {@code Retry-After} header value, may be {@code null}
     * @param attempt    the retry about to be made (1-based), drives the backoff exponent
     */
    public Decision decide(int status, String retryAfter, int attempt) {
        if (!isRetryableStatus(status)) {
            return Decision.noRetry();
        }
        Long headerDelay = parseRetryAfter(retryAfter);
        if (headerDelay != null) {
            return new Decision(true, headerDelay);
        }
        return new Decision(true, backoffMs(attempt));
    }

    long backoffMs(int attempt) {
        double base = Math.pow(2, attempt) * 1_000;
        double jitter = (random.nextDouble() - 0.5) * 2 * base * JITTER_FRACTION;
        return Math.max(0, Math.round(base + jitter));
    }

    /**
     * Milliseconds encoded in a {@code Retry-After} value, or {@code null} when absent or
     * unparseable. Dates in the past yield {@code 0}.
     */
    Long parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (DELTA_SECONDS.matcher(trimmed).matches()) {
            return Long.parseLong(trimmed) * 1_000;
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            return Math.max(0, at.toInstant().toEpochMilli() - clock.millis());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Outcome of {@link #decide}.
     */
    @Data
    @AllArgsConstructor
    public static class Decision {
        private final boolean retry;
        private final long delayMs;

        static Decision noRetry() {
            return new Decision(false, 0);
        }
    }
}
