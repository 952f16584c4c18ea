package io.twitterapi.sdk.request;

/**
 * How a request body is put on the wire.
 */
public enum BodyMode {
    /** UTF-8 JSON text. */
    JSON,
    /** {@code application/x-www-form-urlencoded}. */
    URL,
    /** {@code multipart/form-data}. */
    FORM_DATA,
    /** Raw bytes sent unmodified; only valid with a byte-array body. */
    RAW
}
