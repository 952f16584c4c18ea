package io.twitterapi.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.twitterapi.sdk.auth.CredentialSet;
import io.twitterapi.sdk.ratelimit.RateLimit;
import io.twitterapi.sdk.request.RequestParameters;
import io.twitterapi.sdk.request.StreamRequestParameters;
import io.twitterapi.sdk.transport.ExecutionRequest;
import io.twitterapi.sdk.transport.StreamConnection;
import io.twitterapi.sdk.transport.StreamListener;
import io.twitterapi.sdk.transport.StreamRequest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class RequestMakerTest {

    private final List<ExecutionRequest> executed = new ArrayList<>();
    private final List<FakeStream> streams = new ArrayList<>();

    private Config config(boolean disableCompression) {
        return Config.builder()
            .disableCompression(disableCompression)
            .httpTimeout(Duration.ofSeconds(7))
            .requestExecutor(request -> {
                executed.add(request);
                request.reportRateLimit(new RateLimit(900, 899, 1_700_000_000L));
                return CompletableFuture.completedFuture(
                    new ApiResponse<JsonNode>(200, MissingNode.getInstance(), Map.of(), Optional.empty()));
            })
            .streamConnector(request -> {
                FakeStream stream = new FakeStream(request);
                streams.add(stream);
                return stream;
            })
            .build();
    }

    @Test
    void sendAppliesDefaultsAndRecordsRateLimit() throws Exception {
        RequestMaker maker = new RequestMaker(config(false), CredentialSet.bearer("tok"));

        maker.send(RequestParameters.builder("GET", "api.twitter.com/2/users/:id")
            .params(Map.of("id", "42"))
            .query(Map.of("user.fields", "created_at"))
            .build()).join();

        ExecutionRequest request = executed.get(0);
        assertEquals("https://api.twitter.com/2/users/42?user.fields=created_at", request.url().toString());
        assertEquals(Duration.ofSeconds(7), request.timeout());
        assertTrue(request.compression());
        assertEquals("Bearer tok", request.headers().get("authorization"));
        assertEquals("https://api.twitter.com/2/users/:id", request.rateLimitKey());
        assertEquals(899, maker.getLastRateLimit("api.twitter.com/2/users/:id?ignored=1").orElseThrow().remaining());
    }

    @Test
    void perCallSettingsWin() throws Exception {
        RequestMaker maker = new RequestMaker(config(false), CredentialSet.none());

        maker.send(RequestParameters.builder("GET", "https://api.twitter.com/2/tweets")
            .timeout(Duration.ofSeconds(2))
            .disableCompression(true)
            .enableRateLimitSave(false)
            .build()).join();

        ExecutionRequest request = executed.get(0);
        assertEquals(Duration.ofSeconds(2), request.timeout());
        assertFalse(request.compression());
        assertNull(request.rateLimitListener());
        assertTrue(maker.getLastRateLimit("https://api.twitter.com/2/tweets").isEmpty());
    }

    @Test
    void clientWideCompressionSwitch() throws Exception {
        RequestMaker maker = new RequestMaker(config(true), CredentialSet.none());

        maker.send(RequestParameters.builder("GET", "https://api.twitter.com/2/tweets").build()).join();

        assertFalse(executed.get(0).compression());
    }

    @Test
    void streamWithoutAutoConnectStaysIdle() throws Exception {
        RequestMaker maker = new RequestMaker(config(false), CredentialSet.bearer("tok"));
        StreamRequestParameters params = StreamRequestParameters
            .builder(RequestParameters.builder("GET", "https://api.twitter.com/2/tweets/sample/stream").build())
            .autoConnect(false)
            .build();

        StreamConnection stream = maker.sendStream(params).join();

        assertSame(streams.get(0), stream);
        assertEquals(0, streams.get(0).connects);
        assertEquals("Bearer tok", stream.request().headers().get("Authorization"));
        assertEquals("https://api.twitter.com/2/tweets/sample/stream", stream.request().rateLimitKey());
    }

    @Test
    void streamAutoConnects() throws Exception {
        RequestMaker maker = new RequestMaker(config(false), CredentialSet.none());

        maker.sendStream(StreamRequestParameters
            .builder(RequestParameters.builder("GET", "https://api.twitter.com/2/tweets/sample/stream").build())
            .build()).join();

        assertEquals(1, streams.get(0).connects);
    }

    @Test
    void rotatedCredentialsShareRateLimits() throws Exception {
        RequestMaker maker = new RequestMaker(config(false), CredentialSet.bearer("old"));
        RequestMaker rotated = maker.withCredentials(CredentialSet.bearer("new"));

        rotated.send(RequestParameters.builder("GET", "https://api.twitter.com/2/tweets").build()).join();

        assertEquals("Bearer new", executed.get(0).headers().get("Authorization"));
        assertSame(maker.rateLimits(), rotated.rateLimits());
        assertTrue(maker.getLastRateLimit("https://api.twitter.com/2/tweets").isPresent());
    }

    @Test
    void malformedUrlFailsBeforeDispatch() {
        RequestMaker maker = new RequestMaker(config(false), CredentialSet.none());

        assertThrows(TwitterApiException.class,
            () -> maker.send(RequestParameters.builder("GET", "https://api.twitter.com/bad path").build()));
        assertTrue(executed.isEmpty());
    }

    private static final class FakeStream implements StreamConnection {
        private final StreamRequest request;
        int connects;

        FakeStream(StreamRequest request) {
            this.request = request;
        }

        @Override
        public StreamRequest request() {
            return request;
        }

        @Override
        public StreamConnection addListener(StreamListener listener) {
            return this;
        }

        @Override
        public CompletableFuture<StreamConnection> connect() {
            connects++;
            return CompletableFuture.completedFuture(this);
        }

        @Override
        public boolean isConnected() {
            return connects > 0;
        }

        @Override
        public void close() {
        }
    }
}
