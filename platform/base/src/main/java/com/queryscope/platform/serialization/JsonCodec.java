package com.queryscope.platform.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.queryscope.platform.base.Result;

import java.util.Objects;

/**
 * Jackson-backed {@link Codec}.
 *
 * Usage:
 *   Codec<ReportPayload> codec = JsonCodec.forClass(ReportPayload.class);
 *   Result<byte[]> bytes = codec.encode(payload);
 *
 * The shared mapper writes java.time values as ISO-8601 strings and ignores
 * unknown properties on read.
 */
public final class JsonCodec<A> implements Codec<A> {

    private static final ObjectMapper DEFAULT_MAPPER = createDefaultMapper();

    private final Class<A> type;
    private final ObjectMapper mapper;

    private JsonCodec(Class<A> type, ObjectMapper mapper) {
        this.type = Objects.requireNonNull(type, "type");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static <A> Codec<A> forClass(Class<A> type) {
        return forClass(type, DEFAULT_MAPPER);
    }

    public static <A> Codec<A> forClass(Class<A> type, ObjectMapper mapper) {
        return new JsonCodec<>(type, mapper);
    }

    @Override
    public Result<byte[]> encode(A value) {
        return Result.of(() -> mapper.writeValueAsBytes(value));
    }

    @Override
    public Result<A> decode(byte[] bytes) {
        return Result.of(() -> mapper.readValue(bytes, type));
    }

    @Override
    public String contentType() {
        return "application/json";
    }

    @Override
    public String name() {
        return "json:" + type.getSimpleName();
    }

    private static ObjectMapper createDefaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }
}
