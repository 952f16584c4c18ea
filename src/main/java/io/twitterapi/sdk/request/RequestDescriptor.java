package io.twitterapi.sdk.request;

import io.twitterapi.sdk.internal.HeaderMaps;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fully resolved request, ready to hand to an executor or a stream.
 *
 * @param rawUrl   origin and path without query string, before path parameters were substituted; the rate-limit key
 * @param url      absolute URL including the query string
 * @param method   uppercased HTTP method
 * @param headers  final headers, case-insensitive
 * @param body     encoded body, empty when none is sent
 * @param bodyMode encoding the body was (or would have been) written with
 */
public record RequestDescriptor(
    String rawUrl,
    URI url,
    String method,
    Map<String, String> headers,
    Optional<EncodedBody> body,
    BodyMode bodyMode
) {

    public RequestDescriptor {
        Objects.requireNonNull(rawUrl, "rawUrl");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(method, "method");
        headers = HeaderMaps.immutableCopy(headers);
        body = body == null ? Optional.empty() : body;
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }
}
