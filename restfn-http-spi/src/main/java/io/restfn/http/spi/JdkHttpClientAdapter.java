package io.restfn.http.spi;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sends requests through {@code java.net.http}. Used by the REST client whenever no
 * other adapter is supplied.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient delegate;

    public JdkHttpClientAdapter(HttpClient delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /** Adapter over {@link HttpClient#newHttpClient()}. */
    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newHttpClient());
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        String target = request.method() + " " + request.uri();
        HttpResponse<byte[]> reply;
        try {
            reply = delegate.send(jdkRequest(request), HttpResponse.BodyHandlers.ofByteArray());
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException(target + " timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException(target + " interrupted", e);
        } catch (IOException | IllegalArgumentException e) {
            throw new HttpClientException(target + " failed: " + e.getMessage(), e);
        }
        return new JdkResponse(reply);
    }

    private static HttpRequest jdkRequest(HttpClientRequest request) {
        byte[] payload = request.body();
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .method(request.method(), payload == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofByteArray(payload));
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        return builder.build();
    }

    private static final class JdkResponse implements HttpClientResponse {
        private final int status;
        private final HttpHeaders headers;
        private final byte[] payload;

        JdkResponse(HttpResponse<byte[]> reply) {
            this.status = reply.statusCode();
            this.headers = reply.headers();
            this.payload = reply.body() == null ? new byte[0] : reply.body();
        }

        @Override
        public int statusCode() {
            return status;
        }

        @Override
        public Optional<String> header(String name) {
            return headers.firstValue(name);
        }

        @Override
        public byte[] body() {
            return payload;
        }
    }
}
