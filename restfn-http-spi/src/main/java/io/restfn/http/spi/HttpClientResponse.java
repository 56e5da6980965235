package io.restfn.http.spi;

import java.util.Optional;

/**
 * Response read completely into memory by an {@link HttpClientAdapter}.
 */
public interface HttpClientResponse {

    int statusCode();

    /** First value of a header, matched case-insensitively. */
    Optional<String> header(String name);

    /** Payload bytes. An empty array, never null, when the server sent nothing. */
    byte[] body();
}
