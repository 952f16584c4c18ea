package io.twitterapi.sdk;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base exception of the client. Raised synchronously for requests that cannot be built or signed, and used to complete
 * futures exceptionally for transport failures; HTTP error statuses use {@link TwitterApiResponseException}.
 */
public class TwitterApiException extends Exception {

    private static final long serialVersionUID = 1L;

    public TwitterApiException(String message) {
        super(message);
    }

    public TwitterApiException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wraps a failure reported by an asynchronous transport, unwrapping {@link CompletionException} and
     * {@link ExecutionException} layers. An existing {@code TwitterApiException} is returned as is.
     *
     * @param context short description of the failed operation, prefixed to the message
     */
    public static TwitterApiException fromTransport(String context, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TwitterApiException) {
            return (TwitterApiException) cause;
        }
        return new TwitterApiException(context + ": " + cause.getMessage(), cause);
    }
}
