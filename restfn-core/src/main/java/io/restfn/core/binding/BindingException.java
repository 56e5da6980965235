package io.restfn.core.binding;

/**
 * A parameter value could not be produced from the request. Answered with 422.
 */
public class BindingException extends Exception {
    public BindingException(String message) {
        super(message);
    }

    public BindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
