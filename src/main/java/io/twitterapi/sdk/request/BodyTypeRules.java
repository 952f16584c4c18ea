package io.twitterapi.sdk.request;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Table mapping known endpoint shapes to the body encoding they expect. Rules are evaluated in order and the first
 * match wins; URLs matching nothing are url-encoded.
 */
public final class BodyTypeRules {

    static final String UPLOAD_HOST = "upload.twitter.com";
    static final String MEDIA_UPLOAD_PATH = "/1.1/media/upload.json";

    static final Set<String> JSON_V1_ENDPOINTS = Set.of(
        "direct_messages/events/new.json",
        "direct_messages/welcome_messages/new.json",
        "direct_messages/welcome_messages/rules/new.json",
        "media/metadata/create.json",
        "collections/entries/curate.json"
    );

    private static final List<Rule> RULES = List.of(
        new Rule("v2 oauth2 endpoints", uri -> path(uri).startsWith("/2/oauth2"), BodyMode.URL),
        new Rule("v2 endpoints", uri -> path(uri).startsWith("/2/") || path(uri).startsWith("/labs/2/"), BodyMode.JSON),
        new Rule("media upload", uri -> UPLOAD_HOST.equals(host(uri)) && MEDIA_UPLOAD_PATH.equals(path(uri)), BodyMode.FORM_DATA),
        new Rule("upload host", uri -> UPLOAD_HOST.equals(host(uri)), BodyMode.JSON),
        new Rule("v1.1 json endpoints", uri -> JSON_V1_ENDPOINTS.contains(v1Endpoint(uri)), BodyMode.JSON)
    );

    private BodyTypeRules() {
    }

    public static List<Rule> rules() {
        return RULES;
    }

    public static BodyMode detect(URI uri) {
        for (Rule rule : RULES) {
            if (rule.matches().test(uri)) {
                return rule.mode();
            }
        }
        return BodyMode.URL;
    }

    private static String path(URI uri) {
        String path = uri.getPath();
        return path == null ? "" : path;
    }

    private static String host(URI uri) {
        String host = uri.getHost();
        return host == null ? "" : host.toLowerCase(Locale.ROOT);
    }

    private static String v1Endpoint(URI uri) {
        String path = path(uri);
        int index = path.indexOf("/1.1/");
        return index < 0 ? "" : path.substring(index + "/1.1/".length());
    }

    /**
     * One row of the table.
     */
    public record Rule(String name, Predicate<URI> matches, BodyMode mode) {
    }
}
