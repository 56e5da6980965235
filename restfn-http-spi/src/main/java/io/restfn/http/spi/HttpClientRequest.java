package io.restfn.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An outgoing HTTP request. Immutable; assembled through {@link Builder}, which a wire
 * protocol fills in with headers and an encoded body before the request is sent.
 */
public final class HttpClientRequest {

    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;

    private HttpClientRequest(Builder builder) {
        this.method = builder.method;
        this.uri = builder.uri;
        this.headers = Map.copyOf(builder.headers);
        this.body = builder.body;
        this.timeout = builder.timeout;
    }

    public String method() { return method; }
    public URI uri() { return uri; }
    public Map<String, String> headers() { return headers; }
    /** The encoded payload, or null when the request carries none. */
    public byte[] body() { return body; }
    public Duration timeout() { return timeout; }

    public Optional<String> header(String name) {
        String target = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                return Optional.of(e.getValue());
            }
        }
        return Optional.empty();
    }

    public static Builder builder(String method, URI uri) {
        return new Builder(method, uri);
    }

    public static final class Builder {
        private final String method;
        private final URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;

        private Builder(String method, URI uri) {
            this.method = Objects.requireNonNull(method, "method");
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        public String method() {
            return method;
        }

        public URI uri() {
            return uri;
        }

        /** Sets a header, replacing any earlier value. */
        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, List<String>> headers) {
            if (headers != null) {
                headers.forEach((name, values) -> {
                    if (values != null && !values.isEmpty()) {
                        header(name, String.join(", ", values));
                    }
                });
            }
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(this);
        }
    }
}
