package io.twitterapi.sdk.request;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Serialised request body, ready to be written to the connection.
 */
public final class EncodedBody {

    private final byte[] bytes;

    public EncodedBody(byte[] bytes) {
        this.bytes = bytes.clone();
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public String asString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof EncodedBody && Arrays.equals(bytes, ((EncodedBody) other).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "EncodedBody[" + bytes.length + " bytes]";
    }
}
