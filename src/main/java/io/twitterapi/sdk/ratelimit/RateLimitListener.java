package io.twitterapi.sdk.ratelimit;

/**
 * Side channel invoked by executors once a response carrying rate-limit headers has been read.
 */
@FunctionalInterface
public interface RateLimitListener {

    /**
     * @param endpointKey origin + path of the endpoint, without query string
     * @param snapshot    rate-limit state reported by the response
     */
    void onRateLimit(String endpointKey, RateLimit snapshot);
}
