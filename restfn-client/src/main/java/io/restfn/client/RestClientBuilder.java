package io.restfn.client;

import io.restfn.core.ClientProtocol;
import io.restfn.core.JsonProtocol;
import io.restfn.http.spi.HttpClientAdapter;
import io.restfn.http.spi.JdkHttpClientAdapter;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Builder for {@link RestClient}.
 *
 * <p>Only the base URI is required. The adapter defaults to the JDK {@code HttpClient} and
 * the protocol to {@link JsonProtocol#create()}.
 */
public final class RestClientBuilder {
    private URI baseUri;
    private HttpClientAdapter adapter;
    private ClientProtocol protocol;
    private Duration timeout;

    RestClientBuilder() {
    }

    public RestClientBuilder baseUri(URI baseUri) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        return this;
    }

    public RestClientBuilder baseUri(String baseUri) {
        return baseUri(URI.create(Objects.requireNonNull(baseUri, "baseUri")));
    }

    public RestClientBuilder adapter(HttpClientAdapter adapter) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        return this;
    }

    public RestClientBuilder protocol(ClientProtocol protocol) {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        return this;
    }

    /**
     * Per-request timeout. Unset means the adapter's default.
     */
    public RestClientBuilder timeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
        return this;
    }

    /**
     * @throws IllegalStateException if no base URI was set
     */
    public RestClient build() {
        if (baseUri == null) {
            throw new IllegalStateException("baseUri is required");
        }
        HttpClientAdapter resolvedAdapter = adapter != null ? adapter : JdkHttpClientAdapter.create();
        ClientProtocol resolvedProtocol = protocol != null ? protocol : JsonProtocol.create();
        return new DefaultRestClient(baseUri, resolvedAdapter, resolvedProtocol, timeout);
    }
}
