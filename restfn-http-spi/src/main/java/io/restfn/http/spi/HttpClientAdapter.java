package io.restfn.http.spi;

/**
 * Abstraction over the HTTP client library used by {@code restfn-client}.
 *
 * <p>Implementations must be thread-safe and reusable. Responses are fully buffered;
 * streaming bodies are not supported.
 *
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientResponse response = adapter.send(HttpClientRequest.builder("GET", uri).build());
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends a request and reads the whole response body into memory.
     *
     * @param request the request to send
     * @return the response
     * @throws HttpClientException if the exchange fails
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;
}
