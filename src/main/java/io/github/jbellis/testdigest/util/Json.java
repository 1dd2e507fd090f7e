package io.github.jbellis.testdigest.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;

/**
 * Single, centrally-configured Jackson {@link ObjectMapper}.
 *
 * *  Registers the JDK 8 and JSR-310 modules automatically
 * *  Turns off timestamp-style dates so reports stay legible
 * *  Omits null fields, which is also what the late truncator measures
 *
 * Callers just import {@code Json.mapper}.
 */
public final class Json {
    public static final ObjectMapper mapper;

    static {
        mapper = new ObjectMapper()
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    private Json() {}   // no instances

    public static String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * Two-space indented JSON, the form report token estimates are taken on.
     */
    public static String toPrettyJson(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
