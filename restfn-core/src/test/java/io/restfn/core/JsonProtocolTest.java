package io.restfn.core;

import io.restfn.http.spi.HttpClientRequest;
import io.restfn.http.spi.HttpClientResponse;
import io.restfn.json.jackson.JacksonJsonCodec;
import io.restfn.json.spi.JsonCodec;
import io.restfn.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonProtocolTest {

    private final JsonProtocol protocol = JsonProtocol.create();

    @Test
    void createFindsTheJacksonCodec() {
        assertThat(protocol.codec()).isInstanceOf(JacksonJsonCodec.class);
    }

    @Test
    void defaultStatusDependsOnMethodAndBody() throws Exception {
        assertThat(encode(HttpMethod.POST, 0, null, "x").status()).isEqualTo(201);
        assertThat(encode(HttpMethod.POST, 0, null, null).status()).isEqualTo(204);
        assertThat(encode(HttpMethod.GET, 0, null, null).status()).isEqualTo(204);
        assertThat(encode(HttpMethod.PUT, 0, null, "x").status()).isEqualTo(200);
        assertThat(encode(HttpMethod.GET, 202, null, null).status()).isEqualTo(202);
    }

    @Test
    void errorsAreWrappedWithTheGivenStatus() throws Exception {
        ServerResponse response = encode(HttpMethod.GET, 422, new IllegalArgumentException("bad id"), null);
        assertThat(response.status()).isEqualTo(422);
        assertThat(body(response)).isEqualTo("{\"status\":422,\"message\":\"bad id\"}");
    }

    @Test
    void structuredErrorsKeepTheirOwnStatus() throws Exception {
        ServerResponse response = encode(HttpMethod.GET, 422, ErrorResponse.of(409, "taken"), "ignored");
        assertThat(response.status()).isEqualTo(409);
        assertThat(body(response)).isEqualTo("{\"status\":409,\"message\":\"taken\"}");
    }

    @Test
    void structuredErrorWithoutUsableStatusBecomes500() throws Exception {
        ServerResponse zero = encode(HttpMethod.POST, 0, ErrorResponse.of(0, "broken"), null);
        assertThat(zero.status()).isEqualTo(500);
        assertThat(body(zero)).isEqualTo("{\"status\":500,\"message\":\"broken\"}");

        ServerResponse negative = encode(HttpMethod.GET, 0, ErrorResponse.of(-7, "neg"), null);
        assertThat(negative.status()).isEqualTo(500);

        ServerResponse tooLarge = encode(HttpMethod.GET, 422, ErrorResponse.of(1000, "odd"), null);
        assertThat(tooLarge.status()).isEqualTo(422);
    }

    @Test
    void errorWithoutMessageUsesItsClassName() throws Exception {
        ServerResponse response = encode(HttpMethod.GET, 0, new NullPointerException(), null);
        assertThat(response.status()).isEqualTo(500);
        assertThat(body(response)).contains("java.lang.NullPointerException");
    }

    @Test
    void writesJsonContentTypeAndNoPayloadForNullBody() throws Exception {
        ServerResponse response = encode(HttpMethod.DELETE, 0, null, null);
        assertThat(response.header("Content-Type")).contains("application/json");
        assertThat(response.body()).isEmpty();
    }

    @Test
    void unencodableBodyBecomes500() throws Exception {
        JsonProtocol failing = new JsonProtocol(new FailingCodec());
        ServerResponse response = new ServerResponse();
        failing.encodeResponse(request(HttpMethod.GET, null), response, 0, null, "x");
        assertThat(response.status()).isEqualTo(500);
        assertThat(response.isCommitted()).isTrue();
    }

    @Test
    void secondWriteIsRejected() throws Exception {
        ServerResponse response = new ServerResponse();
        ServerRequest request = request(HttpMethod.GET, null);
        protocol.encodeResponse(request, response, 0, null, "x");
        assertThatThrownBy(() -> protocol.encodeResponse(request, response, 0, null, "y"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void decodesRequestBody() throws Exception {
        Object value = protocol.decodeRequest(request(HttpMethod.POST, "{\"message\":\"hi\"}"), Message.class);
        assertThat(value).isEqualTo(new Message("hi"));
    }

    @Test
    void emptyRequestBodyIsAProtocolError() {
        assertThatThrownBy(() -> protocol.decodeRequest(request(HttpMethod.POST, null), Message.class))
                .isInstanceOf(ProtocolException.class)
                .hasMessage("request body is empty");
        assertThatThrownBy(() -> protocol.decodeRequest(request(HttpMethod.POST, ""), Message.class))
                .isInstanceOf(ProtocolException.class)
                .hasMessage("request body is empty");
    }

    @Test
    void encodeRequestSetsBodyAndHeaders() throws Exception {
        HttpClientRequest.Builder builder = HttpClientRequest.builder("POST", URI.create("http://localhost/x"));
        protocol.encodeRequest(builder, new Message("hello"));
        HttpClientRequest request = builder.build();
        assertThat(new String(request.body(), StandardCharsets.UTF_8)).isEqualTo("{\"Message\":\"hello\"}");
        assertThat(request.header("Content-Type")).contains("application/json");
        assertThat(request.header("Accept")).contains("application/json");
    }

    @Test
    void encodeRequestIgnoresNull() throws Exception {
        HttpClientRequest.Builder builder = HttpClientRequest.builder("GET", URI.create("http://localhost/x"));
        protocol.encodeRequest(builder, null);
        HttpClientRequest request = builder.build();
        assertThat(request.body()).isNull();
        assertThat(request.headers()).isEmpty();
    }

    @Test
    void decodeResponseReadsSuccessBodies() throws Exception {
        Message message = protocol.decodeResponse(response(200, "{\"Message\":\"ok\"}"), Message.class);
        assertThat(message).isEqualTo(new Message("ok"));
        assertThat((Object) protocol.decodeResponse(response(204, ""), Message.class)).isNull();
        assertThat((Object) protocol.decodeResponse(response(200, "{}"), Void.class)).isNull();
    }

    @Test
    void decodeResponseThrowsErrorResponses() {
        assertThatThrownBy(() -> protocol.decodeResponse(
                response(400, "{\"status\":400,\"message\":\"invalid\"}"), Message.class))
                .isInstanceOfSatisfying(ErrorResponse.class, error -> {
                    assertThat(error.status()).isEqualTo(400);
                    assertThat(error.getMessage()).isEqualTo("invalid");
                    assertThat(error).hasToString("400: invalid");
                });
        assertThatThrownBy(() -> protocol.decodeResponse(response(503, ""), Message.class))
                .isInstanceOfSatisfying(ErrorResponse.class, error -> assertThat(error.status()).isEqualTo(503));
    }

    @Test
    void undecodableErrorBodyIsAProtocolError() {
        assertThatThrownBy(() -> protocol.decodeResponse(response(500, "<html>"), Message.class))
                .isInstanceOf(ProtocolException.class)
                .hasMessageStartingWith("HTTP 500");
    }

    private ServerResponse encode(HttpMethod method, int status, Throwable error, Object body) throws Exception {
        ServerResponse response = new ServerResponse();
        protocol.encodeResponse(request(method, null), response, status, error, body);
        return response;
    }

    private static ServerRequest request(HttpMethod method, String body) {
        InputStream in = body == null ? null : new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8));
        return new ServerRequest(method, URI.create("http://localhost/x"), Map.of(), in);
    }

    private static String body(ServerResponse response) {
        return new String(response.body(), StandardCharsets.UTF_8);
    }

    private static HttpClientResponse response(int status, String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return new HttpClientResponse() {
            @Override
            public int statusCode() {
                return status;
            }

            @Override
            public Optional<String> header(String name) {
                return Optional.empty();
            }

            @Override
            public byte[] body() {
                return bytes;
            }
        };
    }

    private static final class FailingCodec implements JsonCodec {
        private final JsonCodec delegate = new JacksonJsonCodec();

        @Override
        public byte[] writeBytes(Object value) throws JsonException {
            if (value instanceof String) {
                throw new JsonException("cannot write strings");
            }
            return delegate.writeBytes(value);
        }

        @Override
        public <T> T readValue(byte[] data, Type type) throws JsonException {
            return delegate.readValue(data, type);
        }

        @Override
        public <T> T readValue(InputStream input, Type type) throws JsonException {
            return delegate.readValue(input, type);
        }
    }
}
