package io.twitterapi.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.twitterapi.sdk.auth.AuthStrategy;
import io.twitterapi.sdk.auth.CredentialSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TwitterApiClientTest {

    private HttpServer server;
    private URI baseUri;
    private volatile String tokenAuthorization;
    private volatile String tokenRequestBody;
    private volatile String lastAuthorization;
    private volatile String tokenResponse;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/oauth2/token", exchange -> {
            tokenAuthorization = exchange.getRequestHeaders().getFirst("Authorization");
            tokenRequestBody = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            writeJson(exchange, 200, tokenResponse);
        });
        server.createContext("/2/users/me", exchange -> {
            lastAuthorization = exchange.getRequestHeaders().getFirst("Authorization");
            exchange.getResponseHeaders().add("x-rate-limit-limit", "75");
            exchange.getResponseHeaders().add("x-rate-limit-remaining", "74");
            exchange.getResponseHeaders().add("x-rate-limit-reset", "1700000000");
            writeJson(exchange, 200, "{\"data\":{\"id\":\"12\",\"username\":\"jack\"}}");
        });
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
        tokenResponse = "{\"token_type\":\"bearer\",\"access_token\":\"AAAA%2FAAA\"}";
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private Config config() {
        return Config.builder()
            .v1Url(baseUri + "/1.1")
            .v2Url(baseUri + "/2")
            .tokenUrl(baseUri + "/oauth2/token")
            .build();
    }

    @Test
    void appLoginExchangesConsumerKeysForBearerToken() throws Exception {
        TwitterApiClient client = new TwitterApiClient(CredentialSet.oauth1("consumer-key", "consumer-secret"), config());
        assertEquals(AuthStrategy.OAUTH1, client.authStrategy());

        TwitterApiClient appClient = client.appLogin().get(5, TimeUnit.SECONDS);

        String expectedBasic = Base64.getEncoder()
            .encodeToString("consumer-key:consumer-secret".getBytes(StandardCharsets.UTF_8));
        assertEquals("Basic " + expectedBasic, tokenAuthorization);
        assertEquals("grant_type=client_credentials", tokenRequestBody);
        assertEquals(AuthStrategy.BEARER, appClient.authStrategy());

        ApiResponse<JsonNode> me = appClient.v2().get("users/me", Map.of()).get(5, TimeUnit.SECONDS);

        assertEquals("jack", me.data().path("data").path("username").asText());
        assertEquals("Bearer AAAA%2FAAA", lastAuthorization);
        assertEquals(74, client.getLastRateLimit(baseUri + "/2/users/me").orElseThrow().remaining());
    }

    @Test
    void appLoginRejectsNonBearerTokens() throws Exception {
        tokenResponse = "{\"token_type\":\"mac\",\"access_token\":\"x\"}";
        TwitterApiClient client = new TwitterApiClient(CredentialSet.oauth1("ck", "cs"), config());

        CompletionException ex = assertThrows(CompletionException.class, () -> client.appLogin().join());

        assertInstanceOf(TwitterApiException.class, ex.getCause());
    }

    @Test
    void appLoginReusesBasicToken() throws Exception {
        TwitterApiClient client = new TwitterApiClient(CredentialSet.basic("cHJlLWVuY29kZWQ="), config());

        TwitterApiClient appClient = client.appLogin().get(5, TimeUnit.SECONDS);

        assertEquals("Basic cHJlLWVuY29kZWQ=", tokenAuthorization);
        assertEquals(AuthStrategy.BEARER, appClient.authStrategy());
    }

    @Test
    void appLoginNeedsConsumerKeys() {
        TwitterApiClient client = new TwitterApiClient(CredentialSet.bearer("tok"), config());

        assertThrows(TwitterApiException.class, client::appLogin);
    }

    @Test
    void surfacesResolvePathsAgainstTheirPrefix() {
        TwitterApiClient client = new TwitterApiClient(CredentialSet.none(), config());

        assertEquals(baseUri + "/1.1/statuses/show.json", client.v1().resolve("statuses/show.json"));
        assertEquals(baseUri + "/2/tweets", client.v2().resolve("/tweets"));
        assertEquals("https://upload.twitter.com/1.1/media/upload.json",
            client.v1().resolve("https://upload.twitter.com/1.1/media/upload.json"));
    }

    @Test
    void rotatedClientKeepsRateLimitStore() {
        TwitterApiClient client = new TwitterApiClient(CredentialSet.none(), config());
        TwitterApiClient rotated = client.withCredentials(CredentialSet.bearer("tok"));

        assertSame(client.rateLimits(), rotated.rateLimits());
        assertEquals(AuthStrategy.BEARER, rotated.authStrategy());
        assertEquals(AuthStrategy.NONE, client.authStrategy());
    }

    private static void writeJson(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
