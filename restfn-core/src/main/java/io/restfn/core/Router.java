package io.restfn.core;

import io.restfn.core.binding.HandlerAdapter;
import io.restfn.core.binding.HandlerAdapterBuilder;
import io.restfn.core.binding.HandlerMethod;
import io.restfn.core.binding.InvalidHandlerException;
import io.restfn.core.routing.PathPattern;
import io.restfn.core.routing.RouteTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Maps (method, path pattern) pairs to handler functions.
 *
 * <p>Each registration analyses the handler once and fails fast with an
 * {@link InvalidHandlerException} when its signature cannot be served, so a misdeclared
 * handler aborts startup instead of being dropped. Named segments ({@code :id}) bind to the
 * handler's parameters left to right; see {@link HandlerAdapterBuilder} for the full rules.
 *
 * <pre>{@code
 * interface Lookup { User find(long id); }
 *
 * Router router = Router.create()
 *         .get("/users/:id", (Lookup) users::find);
 * }</pre>
 *
 * <p>Register all routes before serving; {@link #handle} may then be called concurrently.
 */
public final class Router implements RequestHandler {
    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final ServerProtocol protocol;
    private final RouteTable table = new RouteTable();
    private volatile List<Route> routes = List.of();

    private Router(Builder builder) {
        this.protocol = builder.protocol != null ? builder.protocol : JsonProtocol.create();
    }

    /** A router using {@link JsonProtocol#create()}. */
    public static Router create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ServerProtocol protocol() {
        return protocol;
    }

    /** Registered routes in registration order. */
    public List<Route> routes() {
        return routes;
    }

    /**
     * Registers {@code handler}, a functional-interface instance or a {@link HandlerMethod}.
     *
     * @throws InvalidHandlerException if the handler cannot be served
     * @throws IllegalArgumentException if the path pattern is malformed
     */
    public Router add(HttpMethod method, String path, Object handler) {
        Objects.requireNonNull(handler, "handler");
        return add(method, path, HandlerMethod.of(handler));
    }

    /**
     * Registers by verb name; {@code DEL} is accepted for {@code DELETE}.
     */
    public Router add(String method, String path, Object handler) {
        HttpMethod m = HttpMethod.fromString(method)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported HTTP method: " + method));
        return add(m, path, handler);
    }

    /**
     * Registers the public method {@code methodName} of {@code target}; pass a
     * {@link Class} for a static method.
     */
    public Router add(HttpMethod method, String path, Object target, String methodName) {
        return add(method, path, HandlerMethod.of(target, methodName));
    }

    public Router add(HttpMethod method, String path, HandlerMethod handler) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(handler, "handler");
        PathPattern pattern = PathPattern.parse(path);
        String route = method + " " + path;
        HandlerAdapter adapter = HandlerAdapterBuilder.build(route, pattern, handler, protocol);
        table.add(method, pattern, adapter);
        List<Route> next = new ArrayList<>(routes);
        next.add(new Route(method, path, handler));
        routes = List.copyOf(next);
        log.debug("Registered {} -> {} ({})", route, handler, adapter.signature().returnShape());
        return this;
    }

    public Router get(String path, Object handler) {
        return add(HttpMethod.GET, path, handler);
    }

    public Router post(String path, Object handler) {
        return add(HttpMethod.POST, path, handler);
    }

    public Router put(String path, Object handler) {
        return add(HttpMethod.PUT, path, handler);
    }

    public Router patch(String path, Object handler) {
        return add(HttpMethod.PATCH, path, handler);
    }

    public Router delete(String path, Object handler) {
        return add(HttpMethod.DELETE, path, handler);
    }

    /** Same as {@link #delete(String, Object)}. */
    public Router del(String path, Object handler) {
        return delete(path, handler);
    }

    public Router head(String path, Object handler) {
        return add(HttpMethod.HEAD, path, handler);
    }

    public Router options(String path, Object handler) {
        return add(HttpMethod.OPTIONS, path, handler);
    }

    /**
     * Registers every public method of {@code resource} annotated with {@link Endpoint},
     * ordered by method name.
     *
     * @throws IllegalArgumentException if {@code resource} has no endpoint methods
     */
    public Router register(Object resource) {
        Objects.requireNonNull(resource, "resource");
        List<Method> endpoints = Arrays.stream(resource.getClass().getMethods())
                .filter(m -> m.isAnnotationPresent(Endpoint.class))
                .sorted(Comparator.comparing(Method::getName))
                .collect(Collectors.toList());
        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("No @Endpoint methods on " + resource.getClass().getName());
        }
        for (Method m : endpoints) {
            Endpoint endpoint = m.getAnnotation(Endpoint.class);
            add(endpoint.method(), endpoint.path(), HandlerMethod.of(resource, m));
        }
        return this;
    }

    @Override
    public void handle(ServerRequest request, ResponseWriter response) throws IOException {
        RouteTable.Resolution resolution = table.resolve(request.method(), request.rawPath());
        if (resolution instanceof RouteTable.Found found) {
            found.handler().handle(request.withPathParameters(found.pathParameters()), response);
        } else if (resolution instanceof RouteTable.MethodNotAllowed notAllowed) {
            String allow = notAllowed.allowed().stream()
                    .sorted()
                    .map(Enum::name)
                    .collect(Collectors.joining(", "));
            response.header("Allow", allow);
            protocol.encodeResponse(request, response, 405,
                    ErrorResponse.format(405, "method %s not allowed for %s", request.method(), request.rawPath()),
                    null);
        } else {
            protocol.encodeResponse(request, response, 404,
                    ErrorResponse.format(404, "no route for %s %s", request.method(), request.rawPath()), null);
        }
    }

    public static final class Builder {
        private ServerProtocol protocol;

        private Builder() {}

        /** Wire format for every route of the router. Defaults to {@link JsonProtocol#create()}. */
        public Builder protocol(ServerProtocol protocol) {
            this.protocol = Objects.requireNonNull(protocol, "protocol");
            return this;
        }

        public Router build() {
            return new Router(this);
        }
    }
}
