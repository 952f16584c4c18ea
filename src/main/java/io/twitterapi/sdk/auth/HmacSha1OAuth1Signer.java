package io.twitterapi.sdk.auth;

import io.twitterapi.sdk.TwitterApiException;
import io.twitterapi.sdk.internal.PercentEncoding;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * OAuth 1.0a signer using {@code HMAC-SHA1}, the only method accepted by the API.
 */
public final class HmacSha1OAuth1Signer implements OAuth1Signer {

    static final String SIGNATURE_METHOD = "HMAC-SHA1";
    static final String VERSION = "1.0";

    private static final String NONCE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final int NONCE_LENGTH = 32;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final OAuth1Tokens consumer;
    private final Clock clock;
    private final Supplier<String> nonceSupplier;

    public HmacSha1OAuth1Signer(OAuth1Tokens consumer) {
        this(consumer, Clock.systemUTC(), HmacSha1OAuth1Signer::randomNonce);
    }

    /**
     * Allows pinning time and nonce, mostly for reproducible signatures in tests.
     */
    public HmacSha1OAuth1Signer(OAuth1Tokens consumer, Clock clock, Supplier<String> nonceSupplier) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nonceSupplier = Objects.requireNonNull(nonceSupplier, "nonceSupplier");
    }

    public OAuth1Tokens consumer() {
        return consumer;
    }

    @Override
    public OAuth1Authorization authorize(String method, String url, Map<String, String> data, OAuth1Tokens accessToken)
        throws TwitterApiException {
        Map<String, String> oauth = new LinkedHashMap<>();
        oauth.put("oauth_consumer_key", consumer.key());
        oauth.put("oauth_nonce", nonceSupplier.get());
        oauth.put("oauth_signature_method", SIGNATURE_METHOD);
        oauth.put("oauth_timestamp", Long.toString(clock.instant().getEpochSecond()));
        oauth.put("oauth_version", VERSION);
        if (accessToken != null) {
            oauth.put("oauth_token", accessToken.key());
        }

        String baseString = baseString(method, url, oauth, data);
        String signingKey = PercentEncoding.encode(consumer.secret()) + "&"
            + (accessToken == null ? "" : PercentEncoding.encode(accessToken.secret()));

        oauth.put("oauth_signature", hmacSha1(signingKey, baseString));
        return new OAuth1Authorization(oauth);
    }

    static String baseString(String method, String url, Map<String, String> oauth, Map<String, String> data) {
        List<String[]> pairs = new ArrayList<>();
        oauth.forEach((key, value) -> pairs.add(new String[] {PercentEncoding.encode(key), PercentEncoding.encode(value)}));
        if (data != null) {
            data.forEach((key, value) -> pairs.add(new String[] {PercentEncoding.encode(key), PercentEncoding.encode(value)}));
        }
        pairs.sort((a, b) -> a[0].equals(b[0]) ? a[1].compareTo(b[1]) : a[0].compareTo(b[0]));
        String parameterString = pairs.stream()
            .map(pair -> pair[0] + "=" + pair[1])
            .collect(Collectors.joining("&"));

        return method.toUpperCase(Locale.ROOT)
            + "&" + PercentEncoding.encode(stripQuery(url))
            + "&" + PercentEncoding.encode(parameterString);
    }

    private static String stripQuery(String url) {
        int cut = url.length();
        int query = url.indexOf('?');
        int fragment = url.indexOf('#');
        if (query >= 0) {
            cut = query;
        }
        if (fragment >= 0 && fragment < cut) {
            cut = fragment;
        }
        return url.substring(0, cut);
    }

    private static String hmacSha1(String key, String baseString) throws TwitterApiException {
        try {
            Mac mac = Mac.getInstance("HmacSHA1");
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "HmacSHA1"));
            byte[] digest = mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException ex) {
            throw new TwitterApiException("compute oauth signature: " + ex.getMessage(), ex);
        }
    }

    private static String randomNonce() {
        StringBuilder sb = new StringBuilder(NONCE_LENGTH);
        for (int i = 0; i < NONCE_LENGTH; i++) {
            sb.append(NONCE_ALPHABET.charAt(RANDOM.nextInt(NONCE_ALPHABET.length())));
        }
        return sb.toString();
    }
}
