package io.twitterapi.sdk.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Centralised ObjectMapper configuration: one mapper for reading responses, one for writing request bodies.
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    // Request bodies keep explicit nulls; only top-level unset fields are trimmed before encoding.
    private static final ObjectMapper BODY_MAPPER = MAPPER.copy()
        .setSerializationInclusion(JsonInclude.Include.ALWAYS);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Mapper for outgoing request bodies and JSON-valued parameters. Same settings as {@link #mapper()} except that
     * {@code null} values are written.
     */
    public static ObjectMapper bodyMapper() {
        return BODY_MAPPER;
    }
}
