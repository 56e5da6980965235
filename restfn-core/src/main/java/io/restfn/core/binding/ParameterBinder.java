package io.restfn.core.binding;

import io.restfn.core.ServerRequest;

/**
 * Produces one handler argument from a request. Instances are shared by all requests of a
 * route and hold no per-request state.
 */
@FunctionalInterface
public interface ParameterBinder {
    Object bind(ServerRequest request) throws BindingException;
}
