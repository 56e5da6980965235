package io.restfn.core.binding;

/**
 * A handler cannot be registered: an unsupported parameter or return type, a parameter
 * with no binding source, or a method that cannot be resolved or invoked.
 */
public class InvalidHandlerException extends IllegalArgumentException {
    public InvalidHandlerException(String message) {
        super(message);
    }

    public InvalidHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
