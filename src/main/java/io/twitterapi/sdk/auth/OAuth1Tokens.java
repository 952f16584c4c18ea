package io.twitterapi.sdk.auth;

import java.util.Objects;

/**
 * OAuth 1.0a key/secret pair (consumer or access token).
 */
public record OAuth1Tokens(String key, String secret) {

    public OAuth1Tokens {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(secret, "secret");
    }

    @Override
    public String toString() {
        return "OAuth1Tokens[key=" + key + ", secret=***]";
    }
}
