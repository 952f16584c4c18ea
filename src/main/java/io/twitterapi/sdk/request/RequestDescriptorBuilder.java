package io.twitterapi.sdk.request;

import io.twitterapi.sdk.TwitterApiException;
import io.twitterapi.sdk.auth.AuthStrategySelector;
import io.twitterapi.sdk.internal.HeaderMaps;
import io.twitterapi.sdk.internal.PercentEncoding;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns {@link RequestParameters} into a {@link RequestDescriptor}.
 *
 * <p>
 * Order matters: authentication headers are computed from the logical query and body values before the body is
 * encoded, and the body is encoded only after, so encoding may add content headers without affecting what was signed.
 * </p>
 */
public final class RequestDescriptorBuilder {

    public static final String USER_AGENT_HEADER = "x-user-agent";
    public static final String DEFAULT_USER_AGENT = "twitter-api-java";

    static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");

    private static final Pattern PATH_PARAMETER = Pattern.compile(":([A-Za-z_-]+)");

    private final AuthStrategySelector authSelector;
    private final String userAgent;

    public RequestDescriptorBuilder(AuthStrategySelector authSelector) {
        this(authSelector, DEFAULT_USER_AGENT);
    }

    public RequestDescriptorBuilder(AuthStrategySelector authSelector, String userAgent) {
        this.authSelector = Objects.requireNonNull(authSelector, "authSelector");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    }

    public static boolean isBodyMethod(String method) {
        return BODY_METHODS.contains(method.toUpperCase(Locale.ROOT));
    }

    /**
     * @throws TwitterApiException when the URL is malformed, the body cannot be encoded or signing fails; no partial
     *                             descriptor is produced
     */
    public RequestDescriptor build(RequestParameters request) throws TwitterApiException {
        Objects.requireNonNull(request, "request");

        String method = request.getMethod().toUpperCase(Locale.ROOT);
        Map<String, String> headers = HeaderMaps.mutableCopy(request.getHeaders());
        if (!headers.containsKey(USER_AGENT_HEADER)) {
            headers.put(USER_AGENT_HEADER, userAgent);
        }

        URI parsed = parseUrl(withScheme(request.getUrl()));
        String rawUrl = origin(parsed) + path(parsed);

        String resolvedPath = applyPathParameters(path(parsed), request.getParams());

        // Query string already on the URL overrides the query mapping.
        Map<String, String> query = ParamCodec.formatQuery(request.getQuery());
        query.putAll(parseQueryString(parsed.getRawQuery()));
        URI base = parseUrl(origin(parsed) + resolvedPath);

        RequestBody body = ParamCodec.trimUndefined(request.getBody());
        BodyMode bodyMode = request.getForceBodyMode().orElseGet(() -> ParamCodec.detectBodyType(base));
        boolean bodyMethod = BODY_METHODS.contains(method);

        if (request.isEnableAuth()) {
            boolean bodyInSignature = bodyMethod && bodyMode == BodyMode.URL;
            headers = authSelector.writeAuthHeaders(headers, method, base, query, body.fields(), bodyInSignature);
        }

        Optional<EncodedBody> encoded = Optional.empty();
        if (bodyMethod) {
            encoded = ParamCodec.encodeBody(body, headers, bodyMode);
        }

        URI url = query.isEmpty() ? base : parseUrl(base + "?" + ParamCodec.toFormUrlEncoded(query));
        return new RequestDescriptor(rawUrl, url, method, headers, encoded, bodyMode);
    }

    static String withScheme(String url) {
        String trimmed = url.trim();
        if (trimmed.startsWith("http")) {
            return trimmed;
        }
        return "https://" + trimmed;
    }

    static String applyPathParameters(String path, Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return path;
        }
        Matcher matcher = PATH_PARAMETER.matcher(path);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            Object value = params.get(matcher.group(1));
            String replacement = value == null ? matcher.group() : PercentEncoding.encode(String.valueOf(value));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static Map<String, String> parseQueryString(String rawQuery) {
        Map<String, String> values = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return values;
        }
        for (String part : rawQuery.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            String[] pieces = part.split("=", 2);
            String key = URLDecoder.decode(pieces[0], StandardCharsets.UTF_8);
            String value = pieces.length > 1 ? URLDecoder.decode(pieces[1], StandardCharsets.UTF_8) : "";
            values.put(key, value);
        }
        return values;
    }

    private static URI parseUrl(String url) throws TwitterApiException {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                throw new TwitterApiException("invalid request url: " + url);
            }
            return uri;
        } catch (URISyntaxException ex) {
            throw new TwitterApiException("invalid request url: " + ex.getMessage(), ex);
        }
    }

    /**
     * Scheme and authority in canonical form: lowercase host, no user info, no port when it is the scheme default.
     * Rate-limit keys and OAuth 1.0a base strings both depend on it.
     */
    static String origin(URI uri) {
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost();
        if (host == null) {
            return scheme + "://" + uri.getRawAuthority();
        }
        int port = uri.getPort();
        boolean defaultPort = port == -1
            || ("https".equals(scheme) && port == 443)
            || ("http".equals(scheme) && port == 80);
        return scheme + "://" + host.toLowerCase(Locale.ROOT) + (defaultPort ? "" : ":" + port);
    }

    private static String path(URI uri) {
        String path = uri.getRawPath();
        return path == null || path.isEmpty() ? "/" : path;
    }
}
