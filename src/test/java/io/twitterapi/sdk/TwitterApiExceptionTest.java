package io.twitterapi.sdk;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class TwitterApiExceptionTest {

    @Test
    void unwrapsAsyncLayersAroundTransportFailures() {
        ConnectException refused = new ConnectException("Connection refused");

        TwitterApiException error = TwitterApiException.fromTransport("GET https://api.twitter.com/2/tweets request",
            new CompletionException(new ExecutionException(refused)));

        assertSame(refused, error.getCause());
        assertEquals("GET https://api.twitter.com/2/tweets request: Connection refused", error.getMessage());
    }

    @Test
    void keepsExistingClientErrors() {
        TwitterApiResponseException apiError = new TwitterApiResponseException(401, "89", "Invalid or expired token.");

        assertSame(apiError, TwitterApiException.fromTransport("stream connect", new CompletionException(apiError)));
    }

    @Test
    void wrapsPlainFailures() {
        IOException io = new IOException("reset");

        TwitterApiException error = TwitterApiException.fromTransport("stream connect", io);

        assertSame(io, error.getCause());
        assertFalse(error instanceof TwitterApiResponseException);
    }
}
