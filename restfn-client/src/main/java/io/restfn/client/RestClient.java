package io.restfn.client;

import io.restfn.core.HttpMethod;
import io.restfn.core.ProtocolException;
import io.restfn.http.spi.HttpClientException;

import java.lang.reflect.Type;

/**
 * Typed client for routes served through the same wire protocol.
 *
 * <p>Paths are route patterns; named segments are filled from {@code pathValues} in order:
 * <pre>{@code
 * int answer = client.get("/integer/:id", Integer.class, 10);
 * }</pre>
 *
 * <p>Error statuses surface as {@link io.restfn.core.ErrorResponse}s carrying the server's
 * status and message.
 */
public interface RestClient {

    <T> T get(String path, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException;

    <T> T delete(String path, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException;

    <T> T post(String path, Object body, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException;

    <T> T put(String path, Object body, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException;

    <T> T patch(String path, Object body, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException;

    /**
     * Sends one request.
     *
     * @param body the request payload, or null for none
     * @param responseType the type to decode a success body into; {@code Void.class} discards it
     */
    <T> T exchange(HttpMethod method, String path, Object body, Type responseType, Object... pathValues)
            throws HttpClientException, ProtocolException;

    static RestClientBuilder builder() {
        return new RestClientBuilder();
    }
}
