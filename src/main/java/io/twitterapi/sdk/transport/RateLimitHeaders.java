package io.twitterapi.sdk.transport;

import io.twitterapi.sdk.ratelimit.RateLimit;

import java.net.http.HttpHeaders;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reads {@code x-rate-limit-*} and {@code x-user-limit-24hour-*} response headers.
 */
public final class RateLimitHeaders {

    static final String LIMIT = "x-rate-limit-limit";
    static final String REMAINING = "x-rate-limit-remaining";
    static final String RESET = "x-rate-limit-reset";
    static final String DAY_LIMIT = "x-user-limit-24hour-limit";
    static final String DAY_REMAINING = "x-user-limit-24hour-remaining";
    static final String DAY_RESET = "x-user-limit-24hour-reset";

    private RateLimitHeaders() {
    }

    /**
     * @return the snapshot, or empty when limit, remaining and reset are not all present and numeric
     */
    public static Optional<RateLimit> parse(HttpHeaders headers) {
        OptionalLong limit = number(headers, LIMIT);
        OptionalLong remaining = number(headers, REMAINING);
        OptionalLong reset = number(headers, RESET);
        if (limit.isEmpty() || remaining.isEmpty() || reset.isEmpty()) {
            return Optional.empty();
        }

        RateLimit.DayLimit day = null;
        OptionalLong dayLimit = number(headers, DAY_LIMIT);
        OptionalLong dayRemaining = number(headers, DAY_REMAINING);
        OptionalLong dayReset = number(headers, DAY_RESET);
        if (dayLimit.isPresent() && dayRemaining.isPresent() && dayReset.isPresent()) {
            day = new RateLimit.DayLimit((int) dayLimit.getAsLong(), (int) dayRemaining.getAsLong(), dayReset.getAsLong());
        }

        return Optional.of(new RateLimit((int) limit.getAsLong(), (int) remaining.getAsLong(), reset.getAsLong(), day));
    }

    private static OptionalLong number(HttpHeaders headers, String name) {
        Optional<String> value = headers.firstValue(name);
        if (value.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value.get().trim()));
        } catch (NumberFormatException ex) {
            return OptionalLong.empty();
        }
    }
}
