package io.twitterapi.sdk.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body supplied by a caller: either a field mapping, where {@code null} values mean "unset", or a raw byte buffer.
 */
public final class RequestBody {

    private static final RequestBody EMPTY = new RequestBody(Map.of(), null);

    private final Map<String, Object> fields;
    private final byte[] raw;

    private RequestBody(Map<String, Object> fields, byte[] raw) {
        this.fields = fields;
        this.raw = raw;
    }

    public static RequestBody empty() {
        return EMPTY;
    }

    public static RequestBody of(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return EMPTY;
        }
        return new RequestBody(Collections.unmodifiableMap(new LinkedHashMap<>(fields)), null);
    }

    public static RequestBody raw(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("raw body must not be null");
        }
        return new RequestBody(Map.of(), bytes.clone());
    }

    public boolean isRaw() {
        return raw != null;
    }

    /**
     * Field mapping; empty for raw bodies.
     */
    public Map<String, Object> fields() {
        return fields;
    }

    public byte[] rawBytes() {
        return raw == null ? null : raw.clone();
    }
}
