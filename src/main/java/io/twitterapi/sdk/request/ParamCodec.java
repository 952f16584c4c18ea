package io.twitterapi.sdk.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.twitterapi.sdk.TwitterApiException;
import io.twitterapi.sdk.internal.Json;
import io.twitterapi.sdk.internal.PercentEncoding;

import java.lang.reflect.Array;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Pure helpers normalising query and body parameters and serialising bodies.
 */
public final class ParamCodec {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CONTENT_LENGTH = "Content-Length";

    static final String JSON_CONTENT_TYPE = "application/json;charset=UTF-8";
    static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded;charset=UTF-8";

    private ParamCodec() {
    }

    /**
     * Converts query values to strings. {@code null} values are dropped, collections and arrays are joined with
     * {@code ,} and other values go through {@link String#valueOf(Object)}.
     */
    public static Map<String, String> formatQuery(Map<String, ?> query) {
        Map<String, String> formatted = new LinkedHashMap<>();
        if (query == null) {
            return formatted;
        }
        query.forEach((key, value) -> {
            if (key != null && value != null) {
                formatted.put(key, formatValue(value));
            }
        });
        return formatted;
    }

    /**
     * Union of query and body used as OAuth 1.0a signature data. Body values win on collision; nested structures are
     * not form fields and are left out, as are unset values.
     */
    public static Map<String, String> mergeForSignature(Map<String, String> query, Map<String, ?> body) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (query != null) {
            merged.putAll(query);
        }
        if (body != null) {
            body.forEach((key, value) -> {
                if (value != null && !isStructured(value)) {
                    merged.put(key, String.valueOf(value));
                }
            });
        }
        return merged;
    }

    /**
     * Copy of {@code body} without unset ({@code null}) values. Trimming is idempotent.
     */
    public static Map<String, Object> trimUndefined(Map<String, ?> body) {
        Map<String, Object> trimmed = new LinkedHashMap<>();
        if (body == null) {
            return trimmed;
        }
        body.forEach((key, value) -> {
            if (value != null) {
                trimmed.put(key, value);
            }
        });
        return trimmed;
    }

    /**
     * Raw bodies are returned untouched.
     */
    public static RequestBody trimUndefined(RequestBody body) {
        if (body == null) {
            return RequestBody.empty();
        }
        if (body.isRaw()) {
            return body;
        }
        return RequestBody.of(trimUndefined(body.fields()));
    }

    public static BodyMode detectBodyType(URI url) {
        return BodyTypeRules.detect(url);
    }

    /**
     * Serialises {@code body} and writes {@code Content-Type} (unless already present) and {@code Content-Length} into
     * {@code headers}.
     *
     * @return the encoded body, or empty when there is nothing to send (no fields, or an empty buffer)
     * @throws TwitterApiException when a field mapping is sent in {@link BodyMode#RAW} mode or cannot be serialised
     */
    public static Optional<EncodedBody> encodeBody(RequestBody body, Map<String, String> headers, BodyMode mode)
        throws TwitterApiException {
        byte[] bytes;
        if (body.isRaw()) {
            bytes = body.rawBytes();
        } else if (body.fields().isEmpty()) {
            return Optional.empty();
        } else {
            bytes = encodeFields(body.fields(), headers, mode);
        }

        if (bytes.length == 0) {
            return Optional.empty();
        }
        headers.put(CONTENT_LENGTH, Integer.toString(bytes.length));
        return Optional.of(new EncodedBody(bytes));
    }

    private static byte[] encodeFields(Map<String, Object> fields, Map<String, String> headers, BodyMode mode)
        throws TwitterApiException {
        try {
            switch (mode) {
                case JSON:
                    headers.putIfAbsent(CONTENT_TYPE, JSON_CONTENT_TYPE);
                    return toJson(fields);
                case URL:
                    String form = toFormUrlEncoded(fields);
                    if (form.isEmpty()) {
                        return new byte[0];
                    }
                    headers.putIfAbsent(CONTENT_TYPE, FORM_CONTENT_TYPE);
                    return form.getBytes(StandardCharsets.UTF_8);
                case FORM_DATA:
                    MultipartBody multipart = toMultipart(fields);
                    headers.putIfAbsent(CONTENT_TYPE, multipart.contentType());
                    return multipart.build();
                case RAW:
                default:
                    throw new TwitterApiException("raw body mode requires a byte array body");
            }
        } catch (IllegalArgumentException ex) {
            throw new TwitterApiException("encode " + mode + " body: " + ex.getMessage(), ex);
        }
    }

    /**
     * {@code key=value} pairs joined with {@code &}, RFC 3986 percent-encoded (so {@code *} becomes {@code %2A}).
     */
    public static String toFormUrlEncoded(Map<String, ?> fields) {
        return fields.entrySet().stream()
            .filter(entry -> entry.getValue() != null)
            .map(entry -> PercentEncoding.encode(entry.getKey()) + "=" + PercentEncoding.encode(formatValue(entry.getValue())))
            .collect(Collectors.joining("&"));
    }

    static String formatValue(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
        }
        if (value.getClass().isArray()) {
            List<String> items = new ArrayList<>();
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                items.add(String.valueOf(Array.get(value, i)));
            }
            return String.join(",", items);
        }
        if (value instanceof Map) {
            try {
                return Json.bodyMapper().writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                throw new IllegalArgumentException("unencodable parameter value: " + ex.getOriginalMessage(), ex);
            }
        }
        return String.valueOf(value);
    }

    private static boolean isStructured(Object value) {
        return value instanceof Map || value instanceof Collection || value.getClass().isArray();
    }

    private static byte[] toJson(Map<String, Object> fields) throws TwitterApiException {
        try {
            return Json.bodyMapper().writeValueAsBytes(fields);
        } catch (JsonProcessingException ex) {
            throw new TwitterApiException("encode json body: " + ex.getOriginalMessage(), ex);
        }
    }

    private static MultipartBody toMultipart(Map<String, Object> fields) {
        MultipartBody multipart = new MultipartBody();
        fields.forEach((name, value) -> {
            if (value instanceof byte[]) {
                multipart.addFile(name, name, (byte[]) value);
            } else {
                multipart.addField(name, formatValue(value));
            }
        });
        return multipart;
    }
}
