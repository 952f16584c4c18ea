package io.twitterapi.sdk.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitStoreTest {

    @Test
    void keepsLastSnapshotPerEndpoint() {
        RateLimitStore store = new RateLimitStore();
        store.save("https://api.twitter.com/2/tweets", new RateLimit(300, 299, 1_700_000_000L));
        store.onRateLimit("https://api.twitter.com/2/tweets", new RateLimit(300, 12, 1_700_000_900L));
        store.save("https://api.twitter.com/2/users", new RateLimit(75, 74, 1_700_000_000L));

        RateLimit tweets = store.get("https://api.twitter.com/2/tweets").orElseThrow();
        assertEquals(12, tweets.remaining());
        assertEquals(Instant.ofEpochSecond(1_700_000_900L), tweets.resetTime());
        assertEquals(2, store.snapshot().size());
    }

    @Test
    void unknownEndpointIsEmpty() {
        RateLimitStore store = new RateLimitStore();

        assertTrue(store.get("https://api.twitter.com/2/nothing").isEmpty());
        assertTrue(store.get(null).isEmpty());
        assertThrows(NullPointerException.class, () -> store.save(null, new RateLimit(1, 1, 1)));
    }

    @Test
    void exhaustedWindowIsExceeded() {
        RateLimit limit = new RateLimit(15, 0, 1L, new RateLimit.DayLimit(50, 49, 2L));

        assertTrue(limit.isExceeded());
        assertEquals(49, limit.day().remaining());
    }
}
