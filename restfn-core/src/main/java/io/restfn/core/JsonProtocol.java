package io.restfn.core;

import io.restfn.http.spi.HttpClientRequest;
import io.restfn.http.spi.HttpClientResponse;
import io.restfn.json.spi.JsonCodec;
import io.restfn.json.spi.JsonCodecs;
import io.restfn.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * JSON wire format over a {@link JsonCodec}.
 *
 * <p>Error bodies are {@link ErrorResponse.Payload}s. Every response carries
 * {@code Content-Type: application/json}; a null body is written without a payload.
 */
public final class JsonProtocol implements Protocol {
    private static final Logger log = LoggerFactory.getLogger(JsonProtocol.class);

    public static final String CONTENT_TYPE = "application/json";

    private final JsonCodec codec;

    public JsonProtocol(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Creates a protocol over the codec found on the classpath.
     *
     * @throws IllegalStateException if no {@code JsonCodecProvider} is registered
     */
    public static JsonProtocol create() {
        return new JsonProtocol(JsonCodecs.load());
    }

    public JsonCodec codec() {
        return codec;
    }

    @Override
    public Object decodeRequest(ServerRequest request, Type type) throws ProtocolException {
        InputStream body = request.body();
        if (body == null) {
            throw new ProtocolException("request body is empty");
        }
        byte[] data;
        try {
            data = body.readAllBytes();
        } catch (IOException e) {
            throw new ProtocolException("failed to read request body: " + e.getMessage(), e);
        }
        if (data.length == 0) {
            throw new ProtocolException("request body is empty");
        }
        try {
            return codec.readValue(data, type);
        } catch (JsonException e) {
            throw new ProtocolException(e.getMessage(), e);
        }
    }

    @Override
    public void encodeResponse(ServerRequest request, ResponseWriter response, int status, Throwable error,
                               Object body) throws IOException {
        if (error != null) {
            ErrorResponse err = ErrorResponse.from(error, status);
            encodeResponse(request, response, err.status(), null, err.payload());
            return;
        }
        if (status == 0) {
            status = defaultStatus(request, body);
        }
        byte[] payload = null;
        if (body != null) {
            try {
                payload = codec.writeBytes(body);
            } catch (JsonException e) {
                if (body instanceof ErrorResponse.Payload) {
                    throw new IOException("failed to encode error response", e);
                }
                log.warn("Failed to encode {} response body for {} {}", body.getClass().getName(),
                        request.method(), request.rawPath(), e);
                encodeResponse(request, response, 500, null,
                        new ErrorResponse.Payload(500, "failed to encode response body: " + e.getMessage()));
                return;
            }
        }
        response.header("Content-Type", CONTENT_TYPE);
        response.write(status, payload);
    }

    static int defaultStatus(ServerRequest request, Object body) {
        if (body == null) {
            return 204;
        }
        return request.method() == HttpMethod.POST ? 201 : 200;
    }

    @Override
    public void encodeRequest(HttpClientRequest.Builder request, Object value) throws ProtocolException {
        if (value == null) {
            return;
        }
        try {
            request.body(codec.writeBytes(value));
        } catch (JsonException e) {
            throw new ProtocolException(e.getMessage(), e);
        }
        request.header("Content-Type", CONTENT_TYPE);
        request.header("Accept", CONTENT_TYPE);
    }

    @Override
    public <T> T decodeResponse(HttpClientResponse response, Type type) throws ProtocolException {
        byte[] data = response.body();
        int status = response.statusCode();
        if (status < 400) {
            if (data.length == 0 || type == Void.class || type == void.class) {
                return null;
            }
            try {
                return codec.readValue(data, type);
            } catch (JsonException e) {
                throw new ProtocolException(e.getMessage(), e);
            }
        }
        ErrorResponse.Payload payload;
        try {
            payload = data.length == 0 ? null : codec.readValue(data, ErrorResponse.Payload.class);
        } catch (JsonException e) {
            throw new ProtocolException("HTTP " + status + " with undecodable error body: " + e.getMessage(), e);
        }
        if (payload == null) {
            throw new ErrorResponse(status, "HTTP " + status);
        }
        throw new ErrorResponse(payload.status() == 0 ? status : payload.status(), payload.message());
    }
}
