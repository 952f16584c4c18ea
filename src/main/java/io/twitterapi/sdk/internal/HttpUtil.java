package io.twitterapi.sdk.internal;

import io.twitterapi.sdk.request.EncodedBody;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.zip.GZIPInputStream;

/**
 * Helper methods shared by the JDK-based executor and stream.
 */
public final class HttpUtil {

    public static final String ACCEPT_ENCODING = "Accept-Encoding";

    // java.net.http computes these itself and rejects them when set explicitly.
    private static final Set<String> RESTRICTED_HEADERS = Set.of("content-length", "host", "connection", "expect", "upgrade");

    private HttpUtil() {
    }

    public static HttpRequest buildRequest(
        URI url,
        String method,
        Map<String, String> headers,
        Optional<EncodedBody> body,
        Duration timeout,
        boolean compression
    ) {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(url);

        if (body.isPresent()) {
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body.get().bytes()));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.timeout(timeout);
        }

        boolean acceptEncodingSet = false;
        for (Map.Entry<String, String> header : headers.entrySet()) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            if (RESTRICTED_HEADERS.contains(name)) {
                continue;
            }
            if (name.equals("accept-encoding")) {
                acceptEncodingSet = true;
            }
            builder.header(header.getKey(), header.getValue());
        }

        if (compression && !acceptEncodingSet) {
            builder.header(ACCEPT_ENCODING, "gzip");
        }

        return builder.build();
    }

    public static boolean isGzip(Optional<String> contentEncoding) {
        return contentEncoding.map(value -> value.toLowerCase(Locale.ROOT).contains("gzip")).orElse(false);
    }

    public static InputStream decode(InputStream body, Optional<String> contentEncoding) throws IOException {
        return isGzip(contentEncoding) ? new GZIPInputStream(body) : body;
    }
}
