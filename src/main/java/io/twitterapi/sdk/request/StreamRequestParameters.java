package io.twitterapi.sdk.request;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Parameters of a streaming request: the request itself plus connection behaviour.
 */
public final class StreamRequestParameters {

    private static final Predicate<JsonNode> NEVER_ERROR = payload -> false;

    private final RequestParameters request;
    private final boolean autoConnect;
    private final Predicate<JsonNode> payloadIsError;

    private StreamRequestParameters(Builder builder) {
        this.request = Objects.requireNonNull(builder.request, "request");
        this.autoConnect = builder.autoConnect;
        this.payloadIsError = builder.payloadIsError == null ? NEVER_ERROR : builder.payloadIsError;
    }

    public static Builder builder(RequestParameters request) {
        return new Builder().request(request);
    }

    public RequestParameters getRequest() {
        return request;
    }

    public boolean isAutoConnect() {
        return autoConnect;
    }

    public Predicate<JsonNode> getPayloadIsError() {
        return payloadIsError;
    }

    public static final class Builder {
        private RequestParameters request;
        private boolean autoConnect = true;
        private Predicate<JsonNode> payloadIsError;

        private Builder() {
        }

        public Builder request(RequestParameters request) {
            this.request = request;
            return this;
        }

        /**
         * When {@code false} the stream is handed back unconnected and the caller connects it later.
         */
        public Builder autoConnect(boolean autoConnect) {
            this.autoConnect = autoConnect;
            return this;
        }

        /**
         * Recognises payloads that report an error in-band instead of carrying data.
         */
        public Builder payloadIsError(Predicate<JsonNode> payloadIsError) {
            this.payloadIsError = payloadIsError;
            return this;
        }

        public StreamRequestParameters build() {
            return new StreamRequestParameters(this);
        }
    }
}
