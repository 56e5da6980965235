package io.restfn.core;

import java.lang.reflect.Type;

/**
 * Decodes request payloads into handler body parameters.
 */
public interface ServerDecoder {

    /**
     * Decodes the request payload into a fresh value of {@code type}.
     *
     * @throws ProtocolException when the request has no payload or it cannot be decoded
     */
    Object decodeRequest(ServerRequest request, Type type) throws ProtocolException;
}
