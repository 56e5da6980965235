package io.restfn.core;

import java.io.InputStream;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Framework-neutral request abstraction.
 *
 * <p>Server adapters map their framework-specific request objects to this class. The router
 * attaches the values captured by the matched path pattern before dispatching.
 */
public final class ServerRequest {
    private final HttpMethod method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final InputStream body; // null when the request has no payload
    private final RequestContext context;
    private final Map<String, String> pathParameters;

    /**
     * Creates a request with a background context.
     *
     * @param method the HTTP method
     * @param uri the full request URI (including query parameters)
     * @param headers the request headers
     * @param body the request body stream (null if empty)
     */
    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body) {
        this(method, uri, headers, body, RequestContext.background());
    }

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body,
                         RequestContext context) {
        this(method, uri, headers, body, context, Map.of());
    }

    private ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body,
                          RequestContext context, Map<String, String> pathParameters) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = body;
        this.context = Objects.requireNonNull(context, "context");
        this.pathParameters = pathParameters;
    }

    /**
     * Returns a copy of this request carrying the given path parameter values.
     */
    public ServerRequest withPathParameters(Map<String, String> values) {
        Map<String, String> copy = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        return new ServerRequest(method, uri, headers, body, context, copy);
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    /** The undecoded path component of the request URI, "/" when absent. */
    public String rawPath() {
        String path = uri.getRawPath();
        return path == null || path.isEmpty() ? "/" : path;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        if (name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey() == null || !e.getKey().toLowerCase(Locale.ROOT).equals(target)) continue;
            List<String> values = e.getValue();
            if (values == null) return Optional.empty();
            for (String v : values) {
                if (v != null) return Optional.of(v);
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    public InputStream body() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    public RequestContext context() {
        return context;
    }

    public Map<String, String> pathParameters() {
        return pathParameters;
    }

    public Optional<String> pathParameter(String name) {
        return Optional.ofNullable(pathParameters.get(name));
    }
}
