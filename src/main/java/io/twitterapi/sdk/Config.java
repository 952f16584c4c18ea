package io.twitterapi.sdk;

import io.twitterapi.sdk.request.RequestDescriptorBuilder;
import io.twitterapi.sdk.transport.JdkRequestExecutor;
import io.twitterapi.sdk.transport.JdkStreamConnection;
import io.twitterapi.sdk.transport.RequestExecutor;
import io.twitterapi.sdk.transport.StreamConnector;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable, client-wide settings shared by every request a {@link TwitterApiClient} makes.
 */
public final class Config {

    public static final String DEFAULT_V1_URL = "https://api.twitter.com/1.1";
    public static final String DEFAULT_V2_URL = "https://api.twitter.com/2";
    public static final String DEFAULT_TOKEN_URL = "https://api.twitter.com/oauth2/token";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    private final String v1Url;
    private final String v2Url;
    private final String tokenUrl;
    private final String userAgent;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final boolean disableCompression;
    private final RequestExecutor requestExecutor;
    private final StreamConnector streamConnector;

    private Config(Builder builder) {
        this.v1Url = builder.v1Url;
        this.v2Url = builder.v2Url;
        this.tokenUrl = builder.tokenUrl;
        this.userAgent = builder.userAgent;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.disableCompression = builder.disableCompression;
        this.requestExecutor = builder.requestExecutor;
        this.streamConnector = builder.streamConnector;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Config defaults() {
        return builder().build();
    }

    public Config withDefaults() {
        String resolvedV1 = sanitizeUrl(Optional.ofNullable(v1Url).orElse(DEFAULT_V1_URL));
        String resolvedV2 = sanitizeUrl(Optional.ofNullable(v2Url).orElse(DEFAULT_V2_URL));
        String resolvedTokenUrl = sanitizeUrl(Optional.ofNullable(tokenUrl).orElse(DEFAULT_TOKEN_URL));

        String resolvedUserAgent = Optional.ofNullable(userAgent)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(RequestDescriptorBuilder.DEFAULT_USER_AGENT);

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        }

        RequestExecutor resolvedExecutor = requestExecutor != null ? requestExecutor : new JdkRequestExecutor(resolvedClient);
        StreamConnector resolvedConnector = streamConnector != null ? streamConnector : JdkStreamConnection.connector(resolvedClient);

        return new Builder()
            .v1Url(resolvedV1)
            .v2Url(resolvedV2)
            .tokenUrl(resolvedTokenUrl)
            .userAgent(resolvedUserAgent)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .disableCompression(disableCompression)
            .requestExecutor(resolvedExecutor)
            .streamConnector(resolvedConnector)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getV1Url() {
        return v1Url;
    }

    public String getV2Url() {
        return v2Url;
    }

    public String getTokenUrl() {
        return tokenUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public boolean isDisableCompression() {
        return disableCompression;
    }

    public RequestExecutor getRequestExecutor() {
        return requestExecutor;
    }

    public StreamConnector getStreamConnector() {
        return streamConnector;
    }

    public static final class Builder {
        private String v1Url;
        private String v2Url;
        private String tokenUrl;
        private String userAgent;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private boolean disableCompression;
        private RequestExecutor requestExecutor;
        private StreamConnector streamConnector;

        public Builder v1Url(String v1Url) {
            this.v1Url = v1Url;
            return this;
        }

        public Builder v2Url(String v2Url) {
            this.v2Url = v2Url;
            return this;
        }

        public Builder tokenUrl(String tokenUrl) {
            this.tokenUrl = tokenUrl;
            return this;
        }

        /**
         * Value of the {@code x-user-agent} header sent when a call does not set its own.
         */
        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder disableCompression(boolean disableCompression) {
            this.disableCompression = disableCompression;
            return this;
        }

        /**
         * Replaces the default {@link JdkRequestExecutor}.
         */
        public Builder requestExecutor(RequestExecutor requestExecutor) {
            this.requestExecutor = requestExecutor;
            return this;
        }

        /**
         * Replaces the default {@link JdkStreamConnection} factory.
         */
        public Builder streamConnector(StreamConnector streamConnector) {
            this.streamConnector = streamConnector;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
