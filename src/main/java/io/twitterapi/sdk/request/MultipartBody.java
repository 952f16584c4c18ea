package io.twitterapi.sdk.request;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * Minimal {@code multipart/form-data} writer (RFC 7578). Byte-array values become file parts, everything else a text
 * part.
 */
public final class MultipartBody {

    private static final String CRLF = "\r\n";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String boundary;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    public MultipartBody() {
        this(randomBoundary());
    }

    public MultipartBody(String boundary) {
        this.boundary = Objects.requireNonNull(boundary, "boundary");
    }

    public String boundary() {
        return boundary;
    }

    public String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public MultipartBody addField(String name, String value) {
        writeAscii("--" + boundary + CRLF);
        writeUtf8("Content-Disposition: form-data; name=\"" + escape(name) + "\"" + CRLF + CRLF);
        writeUtf8(value);
        writeAscii(CRLF);
        return this;
    }

    public MultipartBody addFile(String name, String filename, byte[] content) {
        writeAscii("--" + boundary + CRLF);
        writeUtf8("Content-Disposition: form-data; name=\"" + escape(name) + "\"; filename=\"" + escape(filename) + "\"" + CRLF);
        writeAscii("Content-Type: application/octet-stream" + CRLF + CRLF);
        out.writeBytes(content);
        writeAscii(CRLF);
        return this;
    }

    public byte[] build() {
        ByteArrayOutputStream result = new ByteArrayOutputStream(out.size() + boundary.length() + 8);
        result.writeBytes(out.toByteArray());
        result.writeBytes(("--" + boundary + "--" + CRLF).getBytes(StandardCharsets.US_ASCII));
        return result.toByteArray();
    }

    private void writeAscii(String text) {
        out.writeBytes(text.getBytes(StandardCharsets.US_ASCII));
    }

    private void writeUtf8(String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String escape(String value) {
        return value.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
    }

    private static String randomBoundary() {
        StringBuilder sb = new StringBuilder("--------------------------");
        for (int i = 0; i < 24; i++) {
            sb.append(RANDOM.nextInt(10));
        }
        return sb.toString();
    }
}
