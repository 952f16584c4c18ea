package io.twitterapi.sdk;

import io.twitterapi.sdk.ratelimit.RateLimit;

import java.util.Optional;

/**
 * Raised when the API answers with an HTTP error status. Carries the decoded error code and message together with the
 * rate-limit snapshot reported by that response, if any.
 */
public class TwitterApiResponseException extends TwitterApiException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;
    private final String errorMessage;
    private final transient RateLimit rateLimit;

    public TwitterApiResponseException(int statusCode, String code, String errorMessage) {
        this(statusCode, code, errorMessage, null);
    }

    public TwitterApiResponseException(int statusCode, String code, String errorMessage, RateLimit rateLimit) {
        super(buildMessage(statusCode, code, errorMessage));
        this.statusCode = statusCode;
        this.code = code;
        this.errorMessage = errorMessage;
        this.rateLimit = rateLimit;
    }

    private static String buildMessage(int statusCode, String code, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("Request failed with code ").append(statusCode);
        if (code != null && !code.isBlank()) {
            sb.append(" (").append(code).append(")");
        }
        if (message != null && !message.isBlank()) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Optional<RateLimit> getRateLimit() {
        return Optional.ofNullable(rateLimit);
    }

    /**
     * True when the server rejected the call because the endpoint quota is exhausted.
     */
    public boolean isRateLimitError() {
        return statusCode == 429 || (rateLimit != null && rateLimit.remaining() == 0 && statusCode == 403);
    }
}
