package io.twitterapi.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;
import io.twitterapi.sdk.TwitterApiException;
import io.twitterapi.sdk.internal.ApiErrorDecoder;
import io.twitterapi.sdk.internal.HttpUtil;
import io.twitterapi.sdk.internal.Json;
import io.twitterapi.sdk.ratelimit.RateLimit;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stream over {@link HttpClient} reading newline-delimited JSON on a daemon thread.
 *
 * <p>
 * There is no reconnection logic: after a close or a connection error the same instance may be connected again, which
 * re-issues the identical request.
 * </p>
 */
public final class JdkStreamConnection implements StreamConnection {

    private static final Logger LOGGER = Logger.getLogger(JdkStreamConnection.class.getName());

    private final HttpClient httpClient;
    private final StreamRequest request;
    private final List<StreamListener> listeners = new CopyOnWriteArrayList<>();

    private final Object stateLock = new Object();
    private volatile boolean connected;
    private InputStream currentBody;
    private Thread reader;

    public JdkStreamConnection(HttpClient httpClient, StreamRequest request) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.request = Objects.requireNonNull(request, "request");
    }

    public static StreamConnector connector(HttpClient httpClient) {
        return request -> new JdkStreamConnection(httpClient, request);
    }

    @Override
    public StreamRequest request() {
        return request;
    }

    @Override
    public StreamConnection addListener(StreamListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public CompletableFuture<StreamConnection> connect() {
        close();

        HttpRequest httpRequest = HttpUtil.buildRequest(
            request.url(),
            request.method(),
            request.headers(),
            request.body(),
            null,
            request.compression()
        );

        LOGGER.fine(() -> "[twitter-api] connecting stream " + request.method() + " " + request.url());
        CompletableFuture<StreamConnection> result = new CompletableFuture<>();
        httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofInputStream()).whenComplete((response, error) -> {
            if (error != null) {
                result.completeExceptionally(TwitterApiException.fromTransport("stream connect", error));
                return;
            }
            try {
                onResponse(response);
                result.complete(this);
            } catch (TwitterApiException ex) {
                result.completeExceptionally(ex);
            }
        });
        return result;
    }

    @Override
    public void close() {
        InputStream body;
        synchronized (stateLock) {
            body = currentBody;
            currentBody = null;
            reader = null;
            connected = false;
        }
        if (body != null) {
            try {
                body.close();
            } catch (IOException ex) {
                LOGGER.log(Level.FINE, "[twitter-api] closing stream body failed", ex);
            }
        }
    }

    private void onResponse(HttpResponse<InputStream> response) throws TwitterApiException {
        Optional<RateLimit> rateLimit = RateLimitHeaders.parse(response.headers());
        rateLimit.ifPresent(request::reportRateLimit);
        Optional<String> encoding = response.headers().firstValue("Content-Encoding");

        if (response.statusCode() >= 400) {
            try (InputStream in = HttpUtil.decode(response.body(), encoding)) {
                throw ApiErrorDecoder.decode(response.statusCode(), in.readAllBytes(), rateLimit.orElse(null));
            } catch (IOException ex) {
                throw new TwitterApiException("read stream error response: " + ex.getMessage(), ex);
            }
        }

        InputStream body;
        try {
            body = HttpUtil.decode(response.body(), encoding);
        } catch (IOException ex) {
            throw new TwitterApiException("open stream body: " + ex.getMessage(), ex);
        }

        Thread thread = new Thread(() -> readLoop(body), "twitter-api-stream");
        thread.setDaemon(true);
        synchronized (stateLock) {
            currentBody = body;
            reader = thread;
            connected = true;
        }
        listeners.forEach(StreamListener::onConnected);
        thread.start();
    }

    private void readLoop(InputStream body) {
        try (BufferedReader lines = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
            String line;
            while ((line = lines.readLine()) != null) {
                if (line.isBlank()) {
                    // keep-alive
                    continue;
                }
                dispatch(line);
            }
        } catch (IOException ex) {
            if (isCurrent()) {
                LOGGER.log(Level.WARNING, "[twitter-api] stream read failed", ex);
                listeners.forEach(listener -> listener.onConnectionError(ex));
            }
        } finally {
            synchronized (stateLock) {
                if (reader == Thread.currentThread()) {
                    connected = false;
                    reader = null;
                    currentBody = null;
                }
            }
            listeners.forEach(StreamListener::onClose);
        }
    }

    private boolean isCurrent() {
        synchronized (stateLock) {
            return reader == Thread.currentThread();
        }
    }

    private void dispatch(String line) {
        JsonNode payload;
        try {
            payload = Json.mapper().readTree(line);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "[twitter-api] skipping undecodable stream payload", ex);
            return;
        }
        if (request.payloadIsError().test(payload)) {
            listeners.forEach(listener -> listener.onDataError(payload));
        } else {
            listeners.forEach(listener -> listener.onData(payload));
        }
    }
}
