package io.restfn.core;

import java.io.IOException;

/**
 * Writes the final response for a request.
 */
public interface ServerEncoder {

    /**
     * Encodes a handler outcome.
     *
     * <p>A non-null {@code error} wins: it is turned into an {@link ErrorResponse} (keeping
     * its own status, else {@code status}, else 500) and written as the body. Without an
     * error, a {@code status} of 0 selects the default: 201 for a POST with a body, 204 when
     * there is no body, 200 otherwise. Implementations call {@link ResponseWriter#write}
     * exactly once.
     *
     * @param status explicit status, or 0 for the default
     * @param error the failure, or null
     * @param body the body, or null for none
     */
    void encodeResponse(ServerRequest request, ResponseWriter response, int status, Throwable error, Object body)
            throws IOException;
}
