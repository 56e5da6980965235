package io.restfn.core;

import io.restfn.http.spi.HttpClientRequest;

/**
 * Attaches an outgoing payload to a client request.
 */
public interface ClientEncoder {

    /**
     * Encodes {@code value} as the request body. A null value leaves the request untouched.
     */
    void encodeRequest(HttpClientRequest.Builder request, Object value) throws ProtocolException;
}
