package io.twitterapi.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.twitterapi.sdk.TwitterApiResponseException;
import io.twitterapi.sdk.ratelimit.RateLimit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding error payloads returned by the v1.1 and v2 APIs.
 *
 * <p>
 * v1.1 answers with {@code {"errors":[{"code":89,"message":"..."}]}}, v2 with
 * {@code {"title":"...","detail":"...","type":"..."}}; both are understood.
 * </p>
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static TwitterApiResponseException decode(int statusCode, byte[] body, RateLimit rateLimit) {
        if (body == null || body.length == 0) {
            return new TwitterApiResponseException(statusCode, null, null, rateLimit);
        }

        try {
            JsonNode node = MAPPER.readTree(body);
            JsonNode errors = node.path("errors");
            if (errors.isArray() && errors.size() > 0) {
                JsonNode first = errors.get(0);
                String code = first.hasNonNull("code") ? first.get("code").asText() : null;
                String message = first.hasNonNull("message") ? first.get("message").asText() : null;
                return new TwitterApiResponseException(statusCode, code, message, rateLimit);
            }
            String code = node.hasNonNull("title") ? node.get("title").asText() : null;
            String message = node.hasNonNull("detail") ? node.get("detail").asText() : null;
            if (message == null && node.hasNonNull("error")) {
                message = node.get("error").asText();
            }
            return new TwitterApiResponseException(statusCode, code, message, rateLimit);
        } catch (IOException ex) {
            String fallback = new String(body, StandardCharsets.UTF_8);
            return new TwitterApiResponseException(statusCode, null, fallback, rateLimit);
        }
    }
}
