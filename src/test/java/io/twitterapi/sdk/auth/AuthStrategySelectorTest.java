package io.twitterapi.sdk.auth;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuthStrategySelectorTest {

    private static final URI URL = URI.create("https://api.twitter.com/1.1/statuses/update.json");

    @Test
    void bearerWinsOverEveryOtherCredential() throws Exception {
        CredentialSet credentials = CredentialSet.builder()
            .bearerToken("bearer-token")
            .basicToken("basic-token")
            .clientId("id")
            .clientSecret("secret")
            .consumerKey("ck")
            .consumerSecret("cs")
            .accessToken("at")
            .accessSecret("as")
            .build();

        Map<String, String> headers = write(credentials, Map.of("x-custom", "1"));

        assertEquals(AuthStrategy.BEARER, AuthStrategySelector.selectStrategy(credentials));
        assertEquals("Bearer bearer-token", headers.get("Authorization"));
        assertEquals("1", headers.get("x-custom"));
    }

    @Test
    void basicTokenUsedWithoutBearer() throws Exception {
        CredentialSet credentials = CredentialSet.builder().basicToken("abc==").clientId("id").clientSecret("s").build();

        assertEquals("Basic abc==", write(credentials, Map.of()).get("authorization"));
    }

    @Test
    void clientCredentialsEncodedAsBasic() throws Exception {
        CredentialSet credentials = CredentialSet.clientCredentials("client", "s3cret");

        String header = write(credentials, Map.of()).get("Authorization");

        assertEquals(AuthStrategy.CLIENT_CREDENTIALS, AuthStrategySelector.selectStrategy(credentials));
        String expected = Base64.getEncoder().encodeToString("client:s3cret".getBytes(StandardCharsets.UTF_8));
        assertEquals("Basic " + expected, header);
    }

    @Test
    void clientIdAloneDoesNotSelectClientCredentials() {
        CredentialSet credentials = CredentialSet.builder().clientId("client").build();

        assertEquals(AuthStrategy.NONE, AuthStrategySelector.selectStrategy(credentials));
    }

    @Test
    void oauth1SignsQueryOnlyWhenBodyExcluded() throws Exception {
        RecordingSigner signer = new RecordingSigner();
        CredentialSet credentials = CredentialSet.builder()
            .consumerKey("ck").consumerSecret("cs").accessToken("at").accessSecret("as")
            .oauth1Signer(signer)
            .build();

        Map<String, String> headers = new AuthStrategySelector(credentials).writeAuthHeaders(
            Map.of(), "POST", URL, Map.of("q", "1"), Map.of("status", "hi"), false);

        assertEquals("OAuth oauth_signature=\"recorded\"", headers.get("Authorization"));
        assertEquals(Map.of("q", "1"), signer.data);
        assertEquals("at", signer.accessToken.key());
    }

    @Test
    void oauth1SignsMergedDataWhenBodyIncluded() throws Exception {
        RecordingSigner signer = new RecordingSigner();
        CredentialSet credentials = CredentialSet.builder()
            .consumerKey("ck").consumerSecret("cs")
            .oauth1Signer(signer)
            .build();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("q", "from-body");
        body.put("status", "hi");
        body.put("nested", Map.of("a", 1));
        new AuthStrategySelector(credentials).writeAuthHeaders(Map.of(), "POST", URL, Map.of("q", "1"), body, true);

        assertEquals(Map.of("q", "from-body", "status", "hi"), signer.data);
        assertNull(signer.accessToken, "two-legged without access pair");
    }

    @Test
    void accessTokenWithoutSecretIsTwoLegged() throws Exception {
        RecordingSigner signer = new RecordingSigner();
        CredentialSet credentials = CredentialSet.builder()
            .consumerKey("ck").consumerSecret("cs").accessToken("at")
            .oauth1Signer(signer)
            .build();

        new AuthStrategySelector(credentials).writeAuthHeaders(Map.of(), "GET", URL, Map.of(), Map.of(), false);

        assertNull(signer.accessToken);
    }

    @Test
    void noCredentialsPassHeadersThrough() throws Exception {
        Map<String, String> headers = write(CredentialSet.none(), Map.of("x-user-agent", "ua"));

        assertFalse(headers.containsKey("Authorization"));
        assertEquals(Map.of("x-user-agent", "ua"), Map.copyOf(headers));
    }

    @Test
    void oauth1WithoutConsumerSecretFailsAtConstruction() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> CredentialSet.builder()
            .consumerKey("ck")
            .accessToken("at")
            .accessSecret("as")
            .build());
        assertTrue(ex.getMessage().contains("consumer"));
    }

    @Test
    void rotationProducesNewSetWithoutTouchingOriginal() {
        CredentialSet original = CredentialSet.oauth1("ck", "cs");
        CredentialSet rotated = original.withBearerToken("fresh");

        assertEquals(AuthStrategy.OAUTH1, AuthStrategySelector.selectStrategy(original));
        assertEquals(AuthStrategy.BEARER, AuthStrategySelector.selectStrategy(rotated));
        assertTrue(original.getBearerToken().isEmpty());
    }

    private static Map<String, String> write(CredentialSet credentials, Map<String, String> headers) throws Exception {
        return new AuthStrategySelector(credentials).writeAuthHeaders(headers, "GET", URL, Map.of(), Map.of(), false);
    }

    static final class RecordingSigner implements OAuth1Signer {
        Map<String, String> data;
        OAuth1Tokens accessToken;
        String url;
        String method;

        @Override
        public OAuth1Authorization authorize(String method, String url, Map<String, String> data, OAuth1Tokens accessToken) {
            this.method = method;
            this.url = url;
            this.data = Map.copyOf(data);
            this.accessToken = accessToken;
            return new OAuth1Authorization(Map.of("oauth_signature", "recorded"));
        }
    }
}
