package io.restfn.core.binding;

import io.restfn.core.ErrorResponse;
import io.restfn.core.Reply;
import io.restfn.core.RequestHandler;
import io.restfn.core.ResponseWriter;
import io.restfn.core.ServerEncoder;
import io.restfn.core.ServerRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * The per-route dispatcher built by {@link HandlerAdapterBuilder}: binds every argument,
 * invokes the handler, and passes the outcome to the encoder.
 *
 * <p>A binding failure answers 422 without invoking the handler. An exception thrown by the
 * handler answers with its {@link ErrorResponse} status, or 500.
 */
public final class HandlerAdapter implements RequestHandler {
    private static final Logger log = LoggerFactory.getLogger(HandlerAdapter.class);

    static final int UNPROCESSABLE_ENTITY = 422;

    private final String route;
    private final HandlerMethod handler;
    private final HandlerSignature signature;
    private final List<ParameterBinder> binders;
    private final ServerEncoder encoder;

    HandlerAdapter(String route, HandlerMethod handler, HandlerSignature signature,
                   List<ParameterBinder> binders, ServerEncoder encoder) {
        this.route = route;
        this.handler = handler;
        this.signature = signature;
        this.binders = List.copyOf(binders);
        this.encoder = encoder;
    }

    public HandlerSignature signature() {
        return signature;
    }

    public HandlerMethod handler() {
        return handler;
    }

    @Override
    public void handle(ServerRequest request, ResponseWriter response) throws IOException {
        Object[] args = new Object[binders.size()];
        for (int i = 0; i < args.length; i++) {
            try {
                args[i] = binders.get(i).bind(request);
            } catch (BindingException e) {
                log.debug("Rejected {} {} for route {}: {}", request.method(), request.rawPath(), route,
                        e.getMessage());
                encoder.encodeResponse(request, response, UNPROCESSABLE_ENTITY, e, null);
                return;
            }
        }

        Object result;
        try {
            result = handler.invoke(args);
        } catch (Exception e) {
            logFailure(request, e);
            encoder.encodeResponse(request, response, 0, e, null);
            return;
        }

        Reply<?> reply = signature.returnShape().interpret(result);
        encoder.encodeResponse(request, response, reply.status(), null, reply.body());
    }

    private void logFailure(ServerRequest request, Exception e) {
        int status = e instanceof ErrorResponse err ? err.status() : 500;
        if (status >= 500) {
            log.warn("Handler {} failed for {} {}", handler, request.method(), request.rawPath(), e);
        } else {
            log.debug("Handler {} answered {} for {} {}: {}", handler, status, request.method(),
                    request.rawPath(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return route + " -> " + handler;
    }
}
