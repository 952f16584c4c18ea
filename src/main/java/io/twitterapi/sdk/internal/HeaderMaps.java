package io.twitterapi.sdk.internal;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Header maps are case-insensitive on names and iterate in a stable, sorted order.
 */
public final class HeaderMaps {

    private HeaderMaps() {
    }

    public static Map<String, String> mutableCopy(Map<String, String> headers) {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null) {
                    copy.put(name, value);
                }
            });
        }
        return copy;
    }

    public static Map<String, String> immutableCopy(Map<String, String> headers) {
        return Collections.unmodifiableMap(mutableCopy(headers));
    }
}
