package io.twitterapi.sdk;

import io.twitterapi.sdk.ratelimit.RateLimit;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decoded response of a one-shot request.
 *
 * @param statusCode HTTP status
 * @param data       decoded payload
 * @param headers    response headers
 * @param rateLimit  rate-limit snapshot carried by the response, if any
 */
public record ApiResponse<T>(int statusCode, T data, Map<String, List<String>> headers, Optional<RateLimit> rateLimit) {

    public ApiResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        rateLimit = rateLimit == null ? Optional.empty() : rateLimit;
    }
}
