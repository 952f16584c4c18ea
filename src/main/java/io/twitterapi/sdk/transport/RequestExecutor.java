package io.twitterapi.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.twitterapi.sdk.ApiResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Performs the network exchange of a one-shot request.
 *
 * <p>
 * Implementations report the rate-limit snapshot of every response that carries one, error responses included, through
 * {@link ExecutionRequest#reportRateLimit}, and complete the future exceptionally with
 * {@link io.twitterapi.sdk.TwitterApiResponseException} for HTTP errors.
 * </p>
 */
public interface RequestExecutor {

    CompletableFuture<ApiResponse<JsonNode>> execute(ExecutionRequest request);
}
