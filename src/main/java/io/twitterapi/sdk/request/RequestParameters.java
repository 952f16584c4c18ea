package io.twitterapi.sdk.request;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Abstract description of one API call. Built fresh for each call and never mutated afterwards.
 */
public final class RequestParameters {

    private final String url;
    private final String method;
    private final Map<String, Object> query;
    private final RequestBody body;
    private final Map<String, String> headers;
    private final BodyMode forceBodyMode;
    private final boolean enableAuth;
    private final Map<String, Object> params;
    private final Duration timeout;
    private final boolean disableCompression;
    private final boolean enableRateLimitSave;

    private RequestParameters(Builder builder) {
        this.url = Objects.requireNonNull(builder.url, "url");
        this.method = Objects.requireNonNull(builder.method, "method");
        this.query = copy(builder.query);
        this.body = builder.body == null ? RequestBody.empty() : builder.body;
        this.headers = builder.headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.forceBodyMode = builder.forceBodyMode;
        this.enableAuth = builder.enableAuth;
        this.params = copy(builder.params);
        this.timeout = builder.timeout;
        this.disableCompression = builder.disableCompression;
        this.enableRateLimitSave = builder.enableRateLimitSave;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(String method, String url) {
        return new Builder().method(method).url(url);
    }

    public Builder toBuilder() {
        return new Builder()
            .url(url)
            .method(method)
            .query(query)
            .body(body)
            .headers(headers)
            .forceBodyMode(forceBodyMode)
            .enableAuth(enableAuth)
            .params(params)
            .timeout(timeout)
            .disableCompression(disableCompression)
            .enableRateLimitSave(enableRateLimitSave);
    }

    public String getUrl() {
        return url;
    }

    public String getMethod() {
        return method;
    }

    public Map<String, Object> getQuery() {
        return query;
    }

    public RequestBody getBody() {
        return body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Optional<BodyMode> getForceBodyMode() {
        return Optional.ofNullable(forceBodyMode);
    }

    public boolean isEnableAuth() {
        return enableAuth;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public boolean isDisableCompression() {
        return disableCompression;
    }

    public boolean isEnableRateLimitSave() {
        return enableRateLimitSave;
    }

    // LinkedHashMap keeps null values, which mean "unset" here.
    private static Map<String, Object> copy(Map<String, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static final class Builder {
        private String url;
        private String method = "GET";
        private Map<String, ?> query;
        private RequestBody body;
        private Map<String, String> headers;
        private BodyMode forceBodyMode;
        private boolean enableAuth = true;
        private Map<String, ?> params;
        private Duration timeout;
        private boolean disableCompression;
        private boolean enableRateLimitSave = true;

        private Builder() {
        }

        /**
         * Absolute URL or host-relative URL; {@code https://} is prepended when no scheme is present.
         */
        public Builder url(String url) {
            this.url = url;
            return this;
        }

        /**
         * HTTP method, case-insensitive.
         */
        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder query(Map<String, ?> query) {
            this.query = query;
            return this;
        }

        public Builder body(Map<String, ?> body) {
            this.body = RequestBody.of(body);
            return this;
        }

        public Builder body(RequestBody body) {
            this.body = body;
            return this;
        }

        public Builder rawBody(byte[] body) {
            this.body = RequestBody.raw(body);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder forceBodyMode(BodyMode forceBodyMode) {
            this.forceBodyMode = forceBodyMode;
            return this;
        }

        public Builder enableAuth(boolean enableAuth) {
            this.enableAuth = enableAuth;
            return this;
        }

        /**
         * Values substituted into {@code :name} segments of the URL path.
         */
        public Builder params(Map<String, ?> params) {
            this.params = params;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder disableCompression(boolean disableCompression) {
            this.disableCompression = disableCompression;
            return this;
        }

        public Builder enableRateLimitSave(boolean enableRateLimitSave) {
            this.enableRateLimitSave = enableRateLimitSave;
            return this;
        }

        public RequestParameters build() {
            return new RequestParameters(this);
        }
    }
}
