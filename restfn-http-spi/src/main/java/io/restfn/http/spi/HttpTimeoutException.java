package io.restfn.http.spi;

/**
 * Raised when a request exceeds its timeout, so callers can tell timeouts
 * apart from other transport failures.
 */
public class HttpTimeoutException extends HttpClientException {

    public HttpTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
