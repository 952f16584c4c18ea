package io.twitterapi.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import io.twitterapi.sdk.TwitterApiResponseException;
import io.twitterapi.sdk.ratelimit.RateLimitStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdkStreamConnectionTest {

    private HttpServer server;
    private URI baseUri;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/2/tweets/search/stream", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.getResponseHeaders().add("x-rate-limit-limit", "50");
            exchange.getResponseHeaders().add("x-rate-limit-remaining", "49");
            exchange.getResponseHeaders().add("x-rate-limit-reset", "1700000000");
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write("{\"data\":{\"id\":\"1\"}}\r\n".getBytes(StandardCharsets.UTF_8));
                os.write("\r\n".getBytes(StandardCharsets.UTF_8));
                os.write("{\"errors\":[{\"title\":\"operational-disconnect\"}]}\r\n".getBytes(StandardCharsets.UTF_8));
                os.write("{\"data\":{\"id\":\"2\"}}\r\n".getBytes(StandardCharsets.UTF_8));
                os.flush();
            }
        });
        server.createContext("/2/unauthorized", exchange -> {
            byte[] body = "{\"title\":\"Unauthorized\",\"detail\":\"Unauthorized\"}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(401, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void dispatchesDataAndInBandErrors() throws Exception {
        RateLimitStore store = new RateLimitStore();
        RecordingListener listener = new RecordingListener();
        JdkStreamConnection connection = new JdkStreamConnection(httpClient, new StreamRequest(
            baseUri.resolve("/2/tweets/search/stream"), "GET", Map.of(), Optional.empty(), false,
            "stream-key", store, payload -> payload.has("errors")));
        connection.addListener(listener);

        connection.connect().get(5, TimeUnit.SECONDS);

        assertTrue(listener.closed.await(5, TimeUnit.SECONDS));
        assertEquals(1, listener.connected.get(0));
        assertEquals(List.of("1", "2"), listener.ids);
        assertEquals(1, listener.errors.size());
        assertEquals("operational-disconnect", listener.errors.get(0).path("errors").get(0).path("title").asText());
        assertEquals(49, store.get("stream-key").orElseThrow().remaining());
        assertFalse(connection.isConnected());
    }

    @Test
    void errorStatusFailsConnect() {
        RecordingListener listener = new RecordingListener();
        JdkStreamConnection connection = new JdkStreamConnection(httpClient, new StreamRequest(
            baseUri.resolve("/2/unauthorized"), "GET", Map.of(), Optional.empty(), true, null, null, null));
        connection.addListener(listener);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> connection.connect().get(5, TimeUnit.SECONDS));

        TwitterApiResponseException error = assertInstanceOf(TwitterApiResponseException.class, ex.getCause());
        assertEquals(401, error.getStatusCode());
        assertFalse(connection.isConnected());
        assertTrue(listener.connected.isEmpty());
    }

    private static final class RecordingListener implements StreamListener {
        final List<Integer> connected = new CopyOnWriteArrayList<>();
        final List<String> ids = new CopyOnWriteArrayList<>();
        final List<JsonNode> errors = new CopyOnWriteArrayList<>();
        final CountDownLatch closed = new CountDownLatch(1);

        @Override
        public void onConnected() {
            connected.add(1);
        }

        @Override
        public void onData(JsonNode payload) {
            ids.add(payload.path("data").path("id").asText());
        }

        @Override
        public void onDataError(JsonNode payload) {
            errors.add(payload);
        }

        @Override
        public void onClose() {
            closed.countDown();
        }
    }
}
