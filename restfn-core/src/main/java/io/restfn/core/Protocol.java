package io.restfn.core;

/**
 * Wire format shared by routers and clients. {@link JsonProtocol} is the default.
 */
public interface Protocol extends ServerProtocol, ClientProtocol {
}
