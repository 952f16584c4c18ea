package io.twitterapi.sdk.ratelimit;

import java.time.Instant;

/**
 * Rate-limit snapshot reported by the last response of an endpoint.
 *
 * @param limit     maximum number of requests allowed in the current window
 * @param remaining requests left in the current window
 * @param reset     epoch second at which the window resets
 * @param day       optional 24-hour user quota, {@code null} when the response did not report one
 */
public record RateLimit(int limit, int remaining, long reset, DayLimit day) {

    public RateLimit(int limit, int remaining, long reset) {
        this(limit, remaining, reset, null);
    }

    public Instant resetTime() {
        return Instant.ofEpochSecond(reset);
    }

    public boolean isExceeded() {
        return remaining <= 0;
    }

    /**
     * 24-hour per-user quota, sent by a few v2 write endpoints.
     */
    public record DayLimit(int limit, int remaining, long reset) {
    }
}
