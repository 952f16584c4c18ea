package io.twitterapi.sdk.auth;

import io.twitterapi.sdk.internal.PercentEncoding;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Result of an OAuth 1.0a signing pass: the {@code oauth_*} protocol parameters, signature included.
 */
public record OAuth1Authorization(Map<String, String> parameters) {

    public OAuth1Authorization {
        parameters = Map.copyOf(parameters);
    }

    public String signature() {
        return parameters.get("oauth_signature");
    }

    /**
     * Renders the {@code Authorization} header value, parameters sorted by name.
     */
    public String toHeader() {
        return "OAuth " + new TreeMap<>(parameters).entrySet().stream()
            .map(entry -> PercentEncoding.encode(entry.getKey()) + "=\"" + PercentEncoding.encode(entry.getValue()) + "\"")
            .collect(Collectors.joining(", "));
    }
}
