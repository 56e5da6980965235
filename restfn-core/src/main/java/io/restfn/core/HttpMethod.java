package io.restfn.core;

import java.util.Locale;
import java.util.Optional;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS;

    /**
     * Looks up a method by name, ignoring case. {@code DEL} is accepted as an alias of {@link #DELETE}.
     */
    public static Optional<HttpMethod> fromString(String name) {
        if (name == null) return Optional.empty();
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("DEL")) return Optional.of(DELETE);
        for (HttpMethod method : values()) {
            if (method.name().equals(normalized)) return Optional.of(method);
        }
        return Optional.empty();
    }
}
