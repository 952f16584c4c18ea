package io.twitterapi.sdk.transport;

/**
 * Creates unconnected {@link StreamConnection}s.
 */
@FunctionalInterface
public interface StreamConnector {

    StreamConnection create(StreamRequest request);
}
