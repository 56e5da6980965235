package io.restfn.core;

/**
 * A payload could not be encoded or decoded by a {@link Protocol}.
 */
public class ProtocolException extends Exception {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
