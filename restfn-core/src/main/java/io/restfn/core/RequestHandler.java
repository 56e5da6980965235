package io.restfn.core;

import java.io.IOException;

/**
 * Produces the response for one request. Implementations are shared by all requests and
 * must be safe to call concurrently.
 */
@FunctionalInterface
public interface RequestHandler {
    void handle(ServerRequest request, ResponseWriter response) throws IOException;
}
