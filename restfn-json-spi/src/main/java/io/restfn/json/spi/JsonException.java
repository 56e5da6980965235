package io.restfn.json.spi;

/**
 * Raised when a value cannot be written to or read from JSON.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
