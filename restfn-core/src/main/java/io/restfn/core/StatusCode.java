package io.restfn.core;

/**
 * An explicit response status with no body. Handlers declare it as their return type
 * when the status alone is the answer.
 */
public record StatusCode(int value) {
    public StatusCode {
        if (value < 100 || value > 599) {
            throw new IllegalArgumentException("HTTP status out of range: " + value);
        }
    }

    public static StatusCode of(int value) {
        return new StatusCode(value);
    }
}
