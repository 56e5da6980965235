package io.restfn.http.spi;

/**
 * Raised when an HTTP exchange fails before a response is received.
 * Wraps the client library's own exceptions.
 */
public class HttpClientException extends Exception {

    public HttpClientException(String message) {
        super(message);
    }

    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
