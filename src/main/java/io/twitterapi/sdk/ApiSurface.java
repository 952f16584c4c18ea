package io.twitterapi.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import io.twitterapi.sdk.request.BodyMode;
import io.twitterapi.sdk.request.RequestParameters;
import io.twitterapi.sdk.request.StreamRequestParameters;
import io.twitterapi.sdk.transport.StreamConnection;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One API version: a URL prefix plus delegation to the shared {@link RequestMaker}. Relative paths are resolved
 * against the prefix; absolute URLs are used as given.
 */
public final class ApiSurface {

    private final String prefix;
    private final RequestMaker requestMaker;

    ApiSurface(String prefix, RequestMaker requestMaker) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.requestMaker = Objects.requireNonNull(requestMaker, "requestMaker");
    }

    public String prefix() {
        return prefix;
    }

    public String resolve(String path) {
        Objects.requireNonNull(path, "path");
        if (path.startsWith("http")) {
            return path;
        }
        return prefix + "/" + (path.startsWith("/") ? path.substring(1) : path);
    }

    /**
     * Pre-filled builder for calls that need more than the shortcuts below.
     */
    public RequestParameters.Builder request(String method, String path) {
        return RequestParameters.builder(method, resolve(path));
    }

    public CompletableFuture<ApiResponse<JsonNode>> send(RequestParameters request) throws TwitterApiException {
        return requestMaker.send(request);
    }

    public CompletableFuture<ApiResponse<JsonNode>> get(String path, Map<String, ?> query) throws TwitterApiException {
        return send(request("GET", path).query(query).build());
    }

    public CompletableFuture<ApiResponse<JsonNode>> delete(String path, Map<String, ?> query) throws TwitterApiException {
        return send(request("DELETE", path).query(query).build());
    }

    public CompletableFuture<ApiResponse<JsonNode>> post(String path, Map<String, ?> body) throws TwitterApiException {
        return send(request("POST", path).body(body).build());
    }

    public CompletableFuture<ApiResponse<JsonNode>> post(String path, Map<String, ?> body, BodyMode bodyMode)
        throws TwitterApiException {
        return send(request("POST", path).body(body).forceBodyMode(bodyMode).build());
    }

    public CompletableFuture<ApiResponse<JsonNode>> put(String path, Map<String, ?> body) throws TwitterApiException {
        return send(request("PUT", path).body(body).build());
    }

    public CompletableFuture<ApiResponse<JsonNode>> patch(String path, Map<String, ?> body) throws TwitterApiException {
        return send(request("PATCH", path).body(body).build());
    }

    /**
     * Opens a GET stream on {@code path}, connected immediately.
     */
    public CompletableFuture<StreamConnection> stream(String path, Map<String, ?> query) throws TwitterApiException {
        return requestMaker.sendStream(StreamRequestParameters.builder(request("GET", path).query(query).build()).build());
    }
}
