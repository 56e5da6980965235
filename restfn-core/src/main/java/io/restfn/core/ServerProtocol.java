package io.restfn.core;

/**
 * The server half of a {@link Protocol}.
 */
public interface ServerProtocol extends ServerDecoder, ServerEncoder {
}
