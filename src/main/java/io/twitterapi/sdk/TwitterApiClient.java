package io.twitterapi.sdk;

import io.twitterapi.sdk.auth.AuthStrategy;
import io.twitterapi.sdk.auth.AuthStrategySelector;
import io.twitterapi.sdk.auth.BearerTokenExchange;
import io.twitterapi.sdk.auth.CredentialSet;
import io.twitterapi.sdk.ratelimit.RateLimit;
import io.twitterapi.sdk.ratelimit.RateLimitStore;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * <p>
 * Entry point of the library. A client owns one {@link RequestMaker} and exposes the v1.1 and v2 APIs as
 * {@link ApiSurface}s delegating to it.
 * </p>
 *
 * <pre>{@code
 * TwitterApiClient client = new TwitterApiClient(CredentialSet.bearer(token));
 * ApiResponse<JsonNode> me = client.v2().get("users/me", Map.of()).join();
 * }</pre>
 *
 * <p>
 * Clients are immutable. {@link #withCredentials(CredentialSet)} and {@link #appLogin()} return new clients sharing the
 * configuration and the rate-limit store.
 * </p>
 */
public final class TwitterApiClient {

    private final RequestMaker requestMaker;
    private final ApiSurface v1;
    private final ApiSurface v2;

    public TwitterApiClient(CredentialSet credentials) {
        this(credentials, Config.defaults());
    }

    public TwitterApiClient(CredentialSet credentials, Config config) {
        this(new RequestMaker(config, credentials));
    }

    private TwitterApiClient(RequestMaker requestMaker) {
        this.requestMaker = Objects.requireNonNull(requestMaker, "requestMaker");
        this.v1 = new ApiSurface(requestMaker.config().getV1Url(), requestMaker);
        this.v2 = new ApiSurface(requestMaker.config().getV2Url(), requestMaker);
    }

    public ApiSurface v1() {
        return v1;
    }

    public ApiSurface v2() {
        return v2;
    }

    public RequestMaker requests() {
        return requestMaker;
    }

    public AuthStrategy authStrategy() {
        return AuthStrategySelector.selectStrategy(requestMaker.credentials());
    }

    public RateLimitStore rateLimits() {
        return requestMaker.rateLimits();
    }

    public Optional<RateLimit> getLastRateLimit(String endpoint) {
        return requestMaker.getLastRateLimit(endpoint);
    }

    public TwitterApiClient withCredentials(CredentialSet credentials) {
        return new TwitterApiClient(requestMaker.withCredentials(credentials));
    }

    /**
     * Exchanges the basic token, or the consumer key/secret, for an app-only bearer token.
     *
     * @return future completing with a client authenticated by the bearer token only
     * @throws TwitterApiException when neither a basic token nor a consumer key/secret is configured, or the request
     *                             cannot be built
     */
    public CompletableFuture<TwitterApiClient> appLogin() throws TwitterApiException {
        CredentialSet basic = BearerTokenExchange.basicCredentialsFor(requestMaker.credentials());
        BearerTokenExchange exchange = new BearerTokenExchange(
            requestMaker.withCredentials(basic), requestMaker.config().getTokenUrl());
        return exchange.exchange()
            .thenApply(token -> withCredentials(requestMaker.credentials().withBearerToken(token)));
    }
}
