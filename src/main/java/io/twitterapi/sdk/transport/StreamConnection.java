package io.twitterapi.sdk.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a long-lived streaming response.
 */
public interface StreamConnection extends AutoCloseable {

    StreamRequest request();

    StreamConnection addListener(StreamListener listener);

    /**
     * Issues the request. The future completes once response headers arrived with a success status, and fails with the
     * connection or API error otherwise.
     */
    CompletableFuture<StreamConnection> connect();

    boolean isConnected();

    @Override
    void close();
}
