package io.twitterapi.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.twitterapi.sdk.ApiResponse;
import io.twitterapi.sdk.TwitterApiException;
import io.twitterapi.sdk.internal.ApiErrorDecoder;
import io.twitterapi.sdk.internal.HttpUtil;
import io.twitterapi.sdk.internal.Json;
import io.twitterapi.sdk.ratelimit.RateLimit;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RequestExecutor} backed by {@link HttpClient}.
 */
public final class JdkRequestExecutor implements RequestExecutor {

    private static final Logger LOGGER = Logger.getLogger(JdkRequestExecutor.class.getName());

    private final HttpClient httpClient;

    public JdkRequestExecutor(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public CompletableFuture<ApiResponse<JsonNode>> execute(ExecutionRequest request) {
        HttpRequest httpRequest = HttpUtil.buildRequest(
            request.url(),
            request.method(),
            request.headers(),
            request.body(),
            request.timeout(),
            request.compression()
        );

        long start = System.currentTimeMillis();
        CompletableFuture<ApiResponse<JsonNode>> result = new CompletableFuture<>();
        httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray()).whenComplete((response, error) -> {
            if (error != null) {
                TwitterApiException failure = TwitterApiException.fromTransport(
                    request.method() + " " + request.url() + " request", error);
                LOGGER.log(Level.FINE, failure, () -> String.format(Locale.ROOT,
                    "[twitter-api] %s %s failed after %dms", request.method(), request.url(), System.currentTimeMillis() - start));
                result.completeExceptionally(failure);
                return;
            }
            LOGGER.fine(() -> String.format(Locale.ROOT, "[twitter-api] %s %s -> %d in %dms",
                request.method(), request.url(), response.statusCode(), System.currentTimeMillis() - start));
            try {
                result.complete(handle(request, response));
            } catch (TwitterApiException ex) {
                result.completeExceptionally(ex);
            }
        });
        return result;
    }

    private static ApiResponse<JsonNode> handle(ExecutionRequest request, HttpResponse<byte[]> response)
        throws TwitterApiException {
        Optional<RateLimit> rateLimit = RateLimitHeaders.parse(response.headers());
        rateLimit.ifPresent(request::reportRateLimit);

        byte[] body = decompress(response);
        if (response.statusCode() >= 400) {
            throw ApiErrorDecoder.decode(response.statusCode(), body, rateLimit.orElse(null));
        }

        return new ApiResponse<>(response.statusCode(), parse(body, response), response.headers().map(), rateLimit);
    }

    private static byte[] decompress(HttpResponse<byte[]> response) throws TwitterApiException {
        byte[] body = response.body() == null ? new byte[0] : response.body();
        Optional<String> encoding = response.headers().firstValue("Content-Encoding");
        if (body.length == 0 || !HttpUtil.isGzip(encoding)) {
            return body;
        }
        try (InputStream in = HttpUtil.decode(new ByteArrayInputStream(body), encoding)) {
            return in.readAllBytes();
        } catch (IOException ex) {
            throw new TwitterApiException("decompress response: " + ex.getMessage(), ex);
        }
    }

    private static JsonNode parse(byte[] body, HttpResponse<byte[]> response) throws TwitterApiException {
        if (body.length == 0) {
            return MissingNode.getInstance();
        }
        String contentType = response.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        if (!contentType.isEmpty() && !contentType.contains("json")) {
            return TextNode.valueOf(new String(body, StandardCharsets.UTF_8));
        }
        try {
            return Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw new TwitterApiException("decode response: " + ex.getMessage(), ex);
        }
    }
}
