package io.twitterapi.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.twitterapi.sdk.internal.HeaderMaps;
import io.twitterapi.sdk.ratelimit.RateLimit;
import io.twitterapi.sdk.ratelimit.RateLimitListener;
import io.twitterapi.sdk.request.EncodedBody;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Everything a stream needs to (re)issue its request. Carries no timeout: the connection is meant to stay open.
 */
public record StreamRequest(
    URI url,
    String method,
    Map<String, String> headers,
    Optional<EncodedBody> body,
    boolean compression,
    String rateLimitKey,
    RateLimitListener rateLimitListener,
    Predicate<JsonNode> payloadIsError
) {

    public StreamRequest {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(method, "method");
        headers = HeaderMaps.immutableCopy(headers);
        body = body == null ? Optional.empty() : body;
        payloadIsError = payloadIsError == null ? payload -> false : payloadIsError;
    }

    public void reportRateLimit(RateLimit snapshot) {
        if (rateLimitListener != null && rateLimitKey != null) {
            rateLimitListener.onRateLimit(rateLimitKey, snapshot);
        }
    }
}
