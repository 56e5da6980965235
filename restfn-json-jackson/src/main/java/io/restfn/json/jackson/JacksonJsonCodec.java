package io.restfn.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.restfn.json.spi.JsonCodec;
import io.restfn.json.spi.JsonException;

import java.io.InputStream;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Jackson implementation of {@link JsonCodec}.
 *
 * <p>The default mapper ignores unknown properties and matches property names
 * case-insensitively, so {@code {"Message":"hi"}} binds to a {@code message} component.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this(defaultMapper());
    }

    /** Uses {@code mapper} as configured; none of the defaults above are applied. */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .build();
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize " + describe(value), e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Type type) throws JsonException {
        JavaType javaType = mapper.constructType(type);
        try {
            return mapper.readValue(data, javaType);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize " + javaType.toCanonical() + ": " + reason(e), e);
        }
    }

    @Override
    public <T> T readValue(InputStream input, Type type) throws JsonException {
        JavaType javaType = mapper.constructType(type);
        try {
            return mapper.readValue(input, javaType);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize " + javaType.toCanonical() + ": " + reason(e), e);
        }
    }

    private static String reason(Exception e) {
        if (e instanceof JsonProcessingException jpe) {
            return jpe.getOriginalMessage();
        }
        return e.getMessage();
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
