package io.restfn.core;

/**
 * The client half of a {@link Protocol}.
 */
public interface ClientProtocol extends ClientEncoder, ClientDecoder {
}
