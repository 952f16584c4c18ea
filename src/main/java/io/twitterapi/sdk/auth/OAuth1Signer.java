package io.twitterapi.sdk.auth;

import io.twitterapi.sdk.TwitterApiException;

import java.util.Map;

/**
 * Computes OAuth 1.0a authorizations for a request. Implementations are bound to a consumer key/secret pair.
 */
public interface OAuth1Signer {

    /**
     * @param method      uppercased HTTP method
     * @param url         absolute URL; any query string is ignored, query values belong in {@code data}
     * @param data        query (and, for url-encoded bodies, body) parameters covered by the signature
     * @param accessToken user access token, or {@code null} for a two-legged request
     */
    OAuth1Authorization authorize(String method, String url, Map<String, String> data, OAuth1Tokens accessToken)
        throws TwitterApiException;
}
