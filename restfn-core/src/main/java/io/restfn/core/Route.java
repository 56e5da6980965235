package io.restfn.core;

import io.restfn.core.binding.HandlerMethod;

/**
 * A registered (method, path pattern, handler) triple.
 */
public record Route(HttpMethod method, String path, HandlerMethod handler) {
    @Override
    public String toString() {
        return method + " " + path + " -> " + handler;
    }
}
