package io.twitterapi.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import io.twitterapi.sdk.auth.AuthStrategySelector;
import io.twitterapi.sdk.auth.CredentialSet;
import io.twitterapi.sdk.ratelimit.RateLimit;
import io.twitterapi.sdk.ratelimit.RateLimitStore;
import io.twitterapi.sdk.request.RequestDescriptor;
import io.twitterapi.sdk.request.RequestDescriptorBuilder;
import io.twitterapi.sdk.request.RequestParameters;
import io.twitterapi.sdk.request.StreamRequestParameters;
import io.twitterapi.sdk.transport.ExecutionRequest;
import io.twitterapi.sdk.transport.StreamConnection;
import io.twitterapi.sdk.transport.StreamRequest;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Request core owned by every API surface: builds descriptors and dispatches them to the configured executor or stream
 * connector, recording rate-limit snapshots on the way back.
 *
 * <p>
 * Instances are immutable and thread-safe. The only shared mutable state is the {@link RateLimitStore}, which a
 * {@link #withCredentials(CredentialSet) credential rotation} keeps sharing.
 * </p>
 */
public final class RequestMaker {

    private static final Logger LOGGER = Logger.getLogger(RequestMaker.class.getName());

    private final Config config;
    private final CredentialSet credentials;
    private final RequestDescriptorBuilder descriptorBuilder;
    private final RateLimitStore rateLimits;

    public RequestMaker(Config config, CredentialSet credentials) {
        this(config, credentials, new RateLimitStore());
    }

    public RequestMaker(Config config, CredentialSet credentials, RateLimitStore rateLimits) {
        this.config = Objects.requireNonNull(config, "config");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.rateLimits = Objects.requireNonNull(rateLimits, "rateLimits");
        this.descriptorBuilder = new RequestDescriptorBuilder(new AuthStrategySelector(credentials), config.getUserAgent());
    }

    public Config config() {
        return config;
    }

    public CredentialSet credentials() {
        return credentials;
    }

    public RateLimitStore rateLimits() {
        return rateLimits;
    }

    /**
     * Same configuration and rate-limit store, different credentials.
     */
    public RequestMaker withCredentials(CredentialSet newCredentials) {
        return new RequestMaker(config, newCredentials, rateLimits);
    }

    public RequestDescriptor describe(RequestParameters request) throws TwitterApiException {
        return descriptorBuilder.build(request);
    }

    /**
     * Builds the request and hands it to the executor.
     *
     * @return future completing with the decoded response, or exceptionally with the executor's error
     * @throws TwitterApiException when the request cannot be built (malformed URL, unencodable body, signing failure)
     */
    public CompletableFuture<ApiResponse<JsonNode>> send(RequestParameters request) throws TwitterApiException {
        RequestDescriptor descriptor = describe(request);
        Duration timeout = request.getTimeout().orElse(config.getHttpTimeout());

        ExecutionRequest execution = new ExecutionRequest(
            descriptor.url(),
            descriptor.method(),
            descriptor.headers(),
            timeout,
            descriptor.body(),
            compression(request),
            descriptor.rawUrl(),
            request.isEnableRateLimitSave() ? rateLimits : null
        );

        LOGGER.fine(() -> "[twitter-api] sending " + descriptor.method() + " " + descriptor.url());
        return config.getRequestExecutor().execute(execution);
    }

    /**
     * Builds the request and opens a stream on it. With auto-connect (the default) the future completes once connected;
     * otherwise it is returned already completed with the unconnected handle and no I/O has happened.
     *
     * @throws TwitterApiException when the request cannot be built
     */
    public CompletableFuture<StreamConnection> sendStream(StreamRequestParameters request) throws TwitterApiException {
        StreamConnection stream = prepareStream(request);
        if (!request.isAutoConnect()) {
            return CompletableFuture.completedFuture(stream);
        }
        return stream.connect();
    }

    /**
     * Builds the request and returns an unconnected stream handle, whatever the auto-connect setting.
     */
    public StreamConnection prepareStream(StreamRequestParameters request) throws TwitterApiException {
        RequestParameters params = request.getRequest();
        RequestDescriptor descriptor = describe(params);

        StreamRequest streamRequest = new StreamRequest(
            descriptor.url(),
            descriptor.method(),
            descriptor.headers(),
            descriptor.body(),
            compression(params),
            descriptor.rawUrl(),
            params.isEnableRateLimitSave() ? rateLimits : null,
            request.getPayloadIsError()
        );

        LOGGER.fine(() -> "[twitter-api] preparing stream " + descriptor.method() + " " + descriptor.url());
        return config.getStreamConnector().create(streamRequest);
    }

    /**
     * Last snapshot recorded for an endpoint, keyed by origin and path ({@code https://} is assumed when absent).
     */
    public Optional<RateLimit> getLastRateLimit(String endpoint) {
        if (endpoint == null) {
            return Optional.empty();
        }
        String key = endpoint.startsWith("http") ? endpoint : "https://" + endpoint;
        int query = key.indexOf('?');
        return rateLimits.get(query < 0 ? key : key.substring(0, query));
    }

    private boolean compression(RequestParameters request) {
        return !(request.isDisableCompression() || config.isDisableCompression());
    }
}
