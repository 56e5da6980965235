package io.restfn.core;

import java.io.IOException;

/**
 * Sink for exactly one HTTP response.
 *
 * <p>Headers may be added until {@link #write(int, byte[])} is called. Writing a second time
 * for the same request is a contract violation and fails with {@link IllegalStateException}.
 */
public interface ResponseWriter {

    /**
     * Adds a header value.
     *
     * @throws IllegalStateException if the response has already been written
     */
    void header(String name, String value);

    /**
     * Writes the status line and payload.
     *
     * @param status the HTTP status code
     * @param body the payload, or null for none
     * @throws IllegalStateException if the response has already been written
     */
    void write(int status, byte[] body) throws IOException;

    boolean isCommitted();
}
