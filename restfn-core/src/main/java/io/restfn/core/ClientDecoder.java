package io.restfn.core;

import io.restfn.http.spi.HttpClientResponse;

import java.lang.reflect.Type;

/**
 * Reads a client response.
 */
public interface ClientDecoder {

    /**
     * Decodes a success response (status below 400) into {@code type}.
     *
     * @throws ErrorResponse for an error status, decoded from the response payload
     * @throws ProtocolException when the payload cannot be decoded
     */
    <T> T decodeResponse(HttpClientResponse response, Type type) throws ProtocolException;
}
