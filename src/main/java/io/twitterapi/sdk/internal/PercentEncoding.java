package io.twitterapi.sdk.internal;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * RFC 3986 percent-encoding, as required by OAuth 1.0a signatures and accepted by form bodies.
 */
public final class PercentEncoding {

    private PercentEncoding() {
    }

    public static String encode(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("*", "%2A")
            .replace("%7E", "~");
    }
}
