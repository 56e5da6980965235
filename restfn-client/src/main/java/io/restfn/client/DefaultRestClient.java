package io.restfn.client;

import io.restfn.core.ClientProtocol;
import io.restfn.core.HttpMethod;
import io.restfn.core.ProtocolException;
import io.restfn.core.routing.PathPattern;
import io.restfn.http.spi.HttpClientAdapter;
import io.restfn.http.spi.HttpClientException;
import io.restfn.http.spi.HttpClientRequest;
import io.restfn.http.spi.HttpClientResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

final class DefaultRestClient implements RestClient {
    private static final Logger log = LoggerFactory.getLogger(DefaultRestClient.class);

    private final String base;
    private final HttpClientAdapter adapter;
    private final ClientProtocol protocol;
    private final Duration timeout;

    DefaultRestClient(URI baseUri, HttpClientAdapter adapter, ClientProtocol protocol, Duration timeout) {
        String s = baseUri.toString();
        this.base = s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
        this.adapter = adapter;
        this.protocol = protocol;
        this.timeout = timeout;
    }

    @Override
    public <T> T get(String path, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException {
        return exchange(HttpMethod.GET, path, null, responseType, pathValues);
    }

    @Override
    public <T> T delete(String path, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException {
        return exchange(HttpMethod.DELETE, path, null, responseType, pathValues);
    }

    @Override
    public <T> T post(String path, Object body, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException {
        return exchange(HttpMethod.POST, path, body, responseType, pathValues);
    }

    @Override
    public <T> T put(String path, Object body, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException {
        return exchange(HttpMethod.PUT, path, body, responseType, pathValues);
    }

    @Override
    public <T> T patch(String path, Object body, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException {
        return exchange(HttpMethod.PATCH, path, body, responseType, pathValues);
    }

    @Override
    public <T> T exchange(HttpMethod method, String path, Object body, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(responseType, "responseType");
        URI uri = URI.create(base + PathPattern.parse(path).expand(pathValues));

        HttpClientRequest.Builder builder = HttpClientRequest.builder(method.name(), uri).timeout(timeout);
        protocol.encodeRequest(builder, body);
        HttpClientResponse response = adapter.send(builder.build());
        log.debug("{} {} -> {}", method, uri, response.statusCode());
        return protocol.decodeResponse(response, responseType);
    }
}
