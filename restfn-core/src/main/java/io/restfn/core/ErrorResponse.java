package io.restfn.core;

import java.util.Locale;
import java.util.Objects;

/**
 * A failure that carries the HTTP status it should be answered with.
 *
 * <p>Handlers throw it to pick an error status; the wire form is {@link Payload}, written
 * as {@code {"status":..,"message":..}} by the JSON protocol. Any other exception reaching
 * the protocol is wrapped through {@link #from(Throwable, int)}.
 */
public class ErrorResponse extends RuntimeException {
    private final int status;

    public ErrorResponse(int status, String message) {
        super(message);
        this.status = status;
    }

    public ErrorResponse(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public static ErrorResponse of(int status, String message) {
        return new ErrorResponse(status, message);
    }

    public static ErrorResponse format(int status, String format, Object... args) {
        return new ErrorResponse(status, String.format(Locale.ROOT, format, args));
    }

    /**
     * Returns {@code error} itself when it is an {@code ErrorResponse} with a status in
     * 100..599; otherwise wraps it with {@code defaultStatus}, or 500 when that is 0.
     */
    public static ErrorResponse from(Throwable error, int defaultStatus) {
        Objects.requireNonNull(error, "error");
        if (error instanceof ErrorResponse && ((ErrorResponse) error).hasValidStatus()) {
            return (ErrorResponse) error;
        }
        int status = defaultStatus == 0 ? 500 : defaultStatus;
        String message = error.getMessage();
        if (message == null || message.isEmpty()) {
            message = error.getClass().getName();
        }
        return new ErrorResponse(status, message, error);
    }

    public int status() {
        return status;
    }

    boolean hasValidStatus() {
        return status >= 100 && status <= 599;
    }

    public Payload payload() {
        return new Payload(status, getMessage());
    }

    @Override
    public String toString() {
        return status + ": " + getMessage();
    }

    /**
     * Serialized form of an error response.
     */
    public record Payload(int status, String message) {
    }
}
