package io.twitterapi.sdk.transport;

import io.twitterapi.sdk.internal.HeaderMaps;
import io.twitterapi.sdk.ratelimit.RateLimit;
import io.twitterapi.sdk.ratelimit.RateLimitListener;
import io.twitterapi.sdk.request.EncodedBody;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What a {@link RequestExecutor} receives for a one-shot call.
 *
 * @param url               absolute URL with query
 * @param method            uppercased HTTP method
 * @param headers           request headers
 * @param timeout           request timeout, {@code null} for the executor default
 * @param body              encoded body, if any
 * @param compression       whether a compressed response may be requested
 * @param rateLimitKey      endpoint key the snapshot is recorded under
 * @param rateLimitListener receives the snapshot once the response is read; {@code null} disables capture
 */
public record ExecutionRequest(
    URI url,
    String method,
    Map<String, String> headers,
    Duration timeout,
    Optional<EncodedBody> body,
    boolean compression,
    String rateLimitKey,
    RateLimitListener rateLimitListener
) {

    public ExecutionRequest {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(method, "method");
        headers = HeaderMaps.immutableCopy(headers);
        body = body == null ? Optional.empty() : body;
    }

    /**
     * Forwards a snapshot to the listener, if capture is enabled.
     */
    public void reportRateLimit(RateLimit snapshot) {
        if (rateLimitListener != null && rateLimitKey != null) {
            rateLimitListener.onRateLimit(rateLimitKey, snapshot);
        }
    }
}
