package io.twitterapi.sdk.auth;

import io.twitterapi.sdk.TwitterApiException;
import io.twitterapi.sdk.internal.HeaderMaps;
import io.twitterapi.sdk.request.ParamCodec;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Picks exactly one authentication scheme for a {@link CredentialSet} and writes the matching {@code Authorization}
 * header.
 *
 * <p>
 * Priority, first match wins:
 * </p>
 * <ol>
 *   <li>bearer token: {@code Bearer <token>};</li>
 *   <li>basic token: {@code Basic <token>}, used to exchange app credentials for a bearer token;</li>
 *   <li>OAuth 2.0 client id and secret: {@code Basic base64(id:secret)};</li>
 *   <li>OAuth 1.0a signer and consumer secret: an {@code OAuth ...} header signed over method, URL and signature data;</li>
 *   <li>nothing: headers pass through untouched.</li>
 * </ol>
 */
public final class AuthStrategySelector {

    public static final String AUTHORIZATION = "Authorization";

    private final CredentialSet credentials;

    public AuthStrategySelector(CredentialSet credentials) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    public static AuthStrategy selectStrategy(CredentialSet credentials) {
        if (credentials.getBearerToken().isPresent()) {
            return AuthStrategy.BEARER;
        }
        if (credentials.getBasicToken().isPresent()) {
            return AuthStrategy.BASIC;
        }
        if (credentials.getClientId().isPresent() && credentials.getClientSecret().isPresent()) {
            return AuthStrategy.CLIENT_CREDENTIALS;
        }
        if (credentials.getOAuth1Signer().isPresent() && credentials.getConsumerSecret().isPresent()) {
            return AuthStrategy.OAUTH1;
        }
        return AuthStrategy.NONE;
    }

    public AuthStrategy strategy() {
        return selectStrategy(credentials);
    }

    public CredentialSet credentials() {
        return credentials;
    }

    /**
     * Returns a copy of {@code headers} carrying the authentication header of the selected scheme.
     *
     * @param bodyInSignature whether the OAuth 1.0a signature covers the body; only url-encoded bodies of body-carrying
     *                        methods qualify
     * @throws TwitterApiException when the OAuth 1.0a signature cannot be computed
     */
    public Map<String, String> writeAuthHeaders(
        Map<String, String> headers,
        String method,
        URI url,
        Map<String, String> query,
        Map<String, Object> body,
        boolean bodyInSignature
    ) throws TwitterApiException {
        Map<String, String> result = HeaderMaps.mutableCopy(headers);

        switch (strategy()) {
            case BEARER:
                result.put(AUTHORIZATION, "Bearer " + credentials.getBearerToken().orElseThrow());
                break;
            case BASIC:
                result.put(AUTHORIZATION, "Basic " + credentials.getBasicToken().orElseThrow());
                break;
            case CLIENT_CREDENTIALS:
                result.put(AUTHORIZATION, "Basic " + ClientCredentials.basicToken(
                    credentials.getClientId().orElseThrow(), credentials.getClientSecret().orElseThrow()));
                break;
            case OAUTH1:
                Map<String, String> data = bodyInSignature ? ParamCodec.mergeForSignature(query, body) : query;
                OAuth1Authorization authorization = credentials.getOAuth1Signer().orElseThrow()
                    .authorize(method, url.toString(), data, credentials.getAccessTokens().orElse(null));
                result.put(AUTHORIZATION, authorization.toHeader());
                break;
            default:
                break;
        }
        return result;
    }
}
