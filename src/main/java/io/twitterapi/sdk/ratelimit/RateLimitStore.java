package io.twitterapi.sdk.ratelimit;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local record of the last rate-limit snapshot seen for each endpoint.
 *
 * <p>
 * Writes are last-write-wins and entries are never evicted; the map grows with the number of distinct endpoints called.
 * Safe for concurrent use.
 * </p>
 */
public final class RateLimitStore implements RateLimitListener {

    private final Map<String, RateLimit> limits = new ConcurrentHashMap<>();

    public void save(String endpointKey, RateLimit snapshot) {
        Objects.requireNonNull(endpointKey, "endpointKey");
        Objects.requireNonNull(snapshot, "snapshot");
        limits.put(endpointKey, snapshot);
    }

    public Optional<RateLimit> get(String endpointKey) {
        if (endpointKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(limits.get(endpointKey));
    }

    public Map<String, RateLimit> snapshot() {
        return Map.copyOf(limits);
    }

    @Override
    public void onRateLimit(String endpointKey, RateLimit snapshot) {
        save(endpointKey, snapshot);
    }
}
