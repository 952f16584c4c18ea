package io.twitterapi.sdk.auth;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Helpers for HTTP Basic credentials used by the OAuth 2.0 token endpoints.
 */
public final class ClientCredentials {

    private ClientCredentials() {
    }

    /**
     * Base64 of {@code id:secret}, the value following {@code Basic } in the header.
     */
    public static String basicToken(String id, String secret) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(secret, "secret");
        return Base64.getEncoder().encodeToString((id + ":" + secret).getBytes(StandardCharsets.UTF_8));
    }
}
