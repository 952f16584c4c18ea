package io.twitterapi.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives stream events. All methods default to no-ops.
 */
public interface StreamListener {

    default void onConnected() {
    }

    default void onData(JsonNode payload) {
    }

    /**
     * A payload the stream's error predicate recognised as an in-band error.
     */
    default void onDataError(JsonNode payload) {
    }

    default void onConnectionError(Throwable error) {
    }

    default void onClose() {
    }
}
