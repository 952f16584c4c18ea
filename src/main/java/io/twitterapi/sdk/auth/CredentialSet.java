package io.twitterapi.sdk.auth;

import java.util.Optional;

/**
 * Immutable set of credentials held by a client.
 *
 * <p>
 * Any subset may be supplied, but only some combinations select an authentication scheme, see
 * {@link AuthStrategySelector}. Rotating a credential (for example swapping in a freshly exchanged bearer token) creates
 * a new instance; in-flight requests keep reading the set they started with.
 * </p>
 *
 * <p>
 * When any OAuth 1.0a field is given, both consumer key and consumer secret are required and {@link Builder#build()}
 * fails otherwise. An {@link OAuth1Signer} bound to the consumer pair is created at that point unless one was supplied.
 * </p>
 */
public final class CredentialSet {

    private static final CredentialSet EMPTY = builder().build();

    private final String bearerToken;
    private final String basicToken;
    private final String clientId;
    private final String clientSecret;
    private final String consumerKey;
    private final String consumerSecret;
    private final String accessToken;
    private final String accessSecret;
    private final OAuth1Signer oauth1Signer;

    private CredentialSet(Builder builder) {
        this.bearerToken = trimToNull(builder.bearerToken);
        this.basicToken = trimToNull(builder.basicToken);
        this.clientId = trimToNull(builder.clientId);
        this.clientSecret = trimToNull(builder.clientSecret);
        this.consumerKey = trimToNull(builder.consumerKey);
        this.consumerSecret = trimToNull(builder.consumerSecret);
        this.accessToken = trimToNull(builder.accessToken);
        this.accessSecret = trimToNull(builder.accessSecret);

        boolean wantsOAuth1 = consumerKey != null || consumerSecret != null
            || accessToken != null || accessSecret != null || builder.oauth1Signer != null;
        if (!wantsOAuth1) {
            this.oauth1Signer = null;
        } else {
            if (consumerKey == null || consumerSecret == null) {
                throw new IllegalArgumentException("Invalid consumer tokens: consumer key and consumer secret are required");
            }
            this.oauth1Signer = builder.oauth1Signer != null
                ? builder.oauth1Signer
                : new HmacSha1OAuth1Signer(new OAuth1Tokens(consumerKey, consumerSecret));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CredentialSet none() {
        return EMPTY;
    }

    public static CredentialSet bearer(String bearerToken) {
        return builder().bearerToken(bearerToken).build();
    }

    public static CredentialSet basic(String basicToken) {
        return builder().basicToken(basicToken).build();
    }

    public static CredentialSet clientCredentials(String clientId, String clientSecret) {
        return builder().clientId(clientId).clientSecret(clientSecret).build();
    }

    public static CredentialSet oauth1(String consumerKey, String consumerSecret) {
        return builder().consumerKey(consumerKey).consumerSecret(consumerSecret).build();
    }

    public static CredentialSet oauth1(String consumerKey, String consumerSecret, String accessToken, String accessSecret) {
        return builder()
            .consumerKey(consumerKey)
            .consumerSecret(consumerSecret)
            .accessToken(accessToken)
            .accessSecret(accessSecret)
            .build();
    }

    /**
     * Returns a copy holding only the given bearer token; used after an app-only token exchange.
     */
    public CredentialSet withBearerToken(String token) {
        return builder().bearerToken(token).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .bearerToken(bearerToken)
            .basicToken(basicToken)
            .clientId(clientId)
            .clientSecret(clientSecret)
            .consumerKey(consumerKey)
            .consumerSecret(consumerSecret)
            .accessToken(accessToken)
            .accessSecret(accessSecret)
            .oauth1Signer(oauth1Signer);
    }

    public Optional<String> getBearerToken() {
        return Optional.ofNullable(bearerToken);
    }

    public Optional<String> getBasicToken() {
        return Optional.ofNullable(basicToken);
    }

    public Optional<String> getClientId() {
        return Optional.ofNullable(clientId);
    }

    public Optional<String> getClientSecret() {
        return Optional.ofNullable(clientSecret);
    }

    public Optional<String> getConsumerKey() {
        return Optional.ofNullable(consumerKey);
    }

    public Optional<String> getConsumerSecret() {
        return Optional.ofNullable(consumerSecret);
    }

    public Optional<OAuth1Signer> getOAuth1Signer() {
        return Optional.ofNullable(oauth1Signer);
    }

    /**
     * The OAuth 1.0a user access pair, present only when both token and secret were supplied.
     */
    public Optional<OAuth1Tokens> getAccessTokens() {
        if (accessToken == null || accessSecret == null) {
            return Optional.empty();
        }
        return Optional.of(new OAuth1Tokens(accessToken, accessSecret));
    }

    @Override
    public String toString() {
        return "CredentialSet[strategy=" + AuthStrategySelector.selectStrategy(this) + "]";
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private String bearerToken;
        private String basicToken;
        private String clientId;
        private String clientSecret;
        private String consumerKey;
        private String consumerSecret;
        private String accessToken;
        private String accessSecret;
        private OAuth1Signer oauth1Signer;

        private Builder() {
        }

        public Builder bearerToken(String bearerToken) {
            this.bearerToken = bearerToken;
            return this;
        }

        public Builder basicToken(String basicToken) {
            this.basicToken = basicToken;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder clientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
            return this;
        }

        public Builder consumerKey(String consumerKey) {
            this.consumerKey = consumerKey;
            return this;
        }

        public Builder consumerSecret(String consumerSecret) {
            this.consumerSecret = consumerSecret;
            return this;
        }

        public Builder accessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder accessSecret(String accessSecret) {
            this.accessSecret = accessSecret;
            return this;
        }

        /**
         * Overrides the default HMAC-SHA1 signer. Consumer key and secret are still required.
         */
        public Builder oauth1Signer(OAuth1Signer oauth1Signer) {
            this.oauth1Signer = oauth1Signer;
            return this;
        }

        public CredentialSet build() {
            return new CredentialSet(this);
        }
    }
}
