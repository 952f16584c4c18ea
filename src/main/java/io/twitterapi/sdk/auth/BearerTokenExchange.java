package io.twitterapi.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.twitterapi.sdk.ApiResponse;
import io.twitterapi.sdk.RequestMaker;
import io.twitterapi.sdk.TwitterApiException;
import io.twitterapi.sdk.request.BodyMode;
import io.twitterapi.sdk.request.RequestParameters;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

/**
 * OAuth 2.0 client-credentials exchange turning app credentials into an app-only bearer token.
 *
 * <p>
 * The request is sent through a {@link RequestMaker} whose credentials select Basic authentication (a basic token or
 * a client id/secret pair).
 * </p>
 */
public final class BearerTokenExchange {

    private static final Logger LOGGER = Logger.getLogger(BearerTokenExchange.class.getName());

    private final RequestMaker basicMaker;
    private final String tokenUrl;

    public BearerTokenExchange(RequestMaker basicMaker, String tokenUrl) {
        this.basicMaker = Objects.requireNonNull(basicMaker, "basicMaker");
        this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl");
        AuthStrategy strategy = AuthStrategySelector.selectStrategy(basicMaker.credentials());
        if (strategy != AuthStrategy.BASIC && strategy != AuthStrategy.CLIENT_CREDENTIALS) {
            throw new IllegalArgumentException("bearer token exchange needs basic credentials, got " + strategy);
        }
    }

    /**
     * Credentials for the exchange: the configured basic token, or one built from the consumer key/secret pair.
     *
     * @throws TwitterApiException when neither is configured
     */
    public static CredentialSet basicCredentialsFor(CredentialSet credentials) throws TwitterApiException {
        if (credentials.getBasicToken().isPresent()) {
            return CredentialSet.basic(credentials.getBasicToken().get());
        }
        if (credentials.getConsumerKey().isEmpty() || credentials.getConsumerSecret().isEmpty()) {
            throw new TwitterApiException("app-only login requires consumer key and consumer secret");
        }
        return CredentialSet.basic(ClientCredentials.basicToken(
            credentials.getConsumerKey().get(), credentials.getConsumerSecret().get()));
    }

    /**
     * @return future completing with the access token
     * @throws TwitterApiException when the token request cannot be built
     */
    public CompletableFuture<String> exchange() throws TwitterApiException {
        RequestParameters request = RequestParameters.builder("POST", tokenUrl)
            .body(Map.of("grant_type", "client_credentials"))
            .forceBodyMode(BodyMode.URL)
            .build();

        LOGGER.info(() -> "[twitter-api] requesting app-only bearer token from " + tokenUrl);
        return basicMaker.send(request).thenApply(BearerTokenExchange::readToken);
    }

    private static String readToken(ApiResponse<JsonNode> response) {
        JsonNode body = response.data();
        String tokenType = body.path("token_type").asText("");
        String accessToken = body.path("access_token").asText("");
        if (!"bearer".equals(tokenType.toLowerCase(Locale.ROOT))) {
            throw new CompletionException(new TwitterApiException("token response has unexpected token_type: " + tokenType));
        }
        if (accessToken.isBlank()) {
            throw new CompletionException(new TwitterApiException("token response missing access_token"));
        }
        return accessToken;
    }
}
