package io.restfn.servlet;

import io.restfn.core.ErrorResponse;
import io.restfn.core.HttpMethod;
import io.restfn.core.RequestContext;
import io.restfn.core.Router;
import io.restfn.core.ServerRequest;
import io.restfn.core.ServerResponse;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Serves a {@link Router} from any Jakarta Servlet container.
 *
 * <p>Route patterns are matched against the path below the servlet mapping, so a router
 * mounted at {@code /api/*} serves {@code /api/users/7} through its {@code /users/:id} route.
 * Request bodies are buffered; an empty body reaches handlers as "no payload".
 */
public final class RestServlet extends HttpServlet {
    private static final Logger log = LoggerFactory.getLogger(RestServlet.class);

    private static final String ALL_METHODS = Arrays.stream(HttpMethod.values())
            .map(Enum::name)
            .collect(Collectors.joining(", "));

    private final transient Router router;
    private final long maxBodySize;
    private final Duration requestTimeout;
    private final transient Clock clock;

    private RestServlet(Builder builder) {
        this.router = builder.router;
        this.maxBodySize = builder.maxBodySize;
        this.requestTimeout = builder.requestTimeout;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static RestServlet create(Router router) {
        return builder(router).build();
    }

    public static Builder builder(Router router) {
        return new Builder(router);
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        Optional<HttpMethod> method = HttpMethod.fromString(req.getMethod());
        if (method.isEmpty()) {
            resp.setHeader("Allow", ALL_METHODS);
            resp.setStatus(405);
            return;
        }

        URI uri;
        try {
            uri = routedUri(req);
        } catch (IllegalArgumentException e) {
            log.debug("Rejected malformed request URI {}", req.getRequestURI(), e);
            resp.setStatus(400);
            return;
        }

        ServerResponse out = new ServerResponse();
        try {
            byte[] body;
            try {
                body = readBody(req);
            } catch (BodySizeLimiter.PayloadTooLargeException e) {
                ServerRequest rejected = toServerRequest(req, method.get(), uri, null);
                router.protocol().encodeResponse(rejected, out, 413, ErrorResponse.of(413, e.getMessage()), null);
                copy(out, resp);
                return;
            }
            ServerRequest request = toServerRequest(req, method.get(), uri, body);
            router.handle(request, out);
            if (!out.isCommitted()) {
                throw new IllegalStateException("router did not write a response");
            }
            copy(out, resp);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to serve {} {}", req.getMethod(), req.getRequestURI(), e);
            if (!resp.isCommitted()) {
                resp.reset();
                resp.setStatus(500);
            }
        }
    }

    private ServerRequest toServerRequest(HttpServletRequest req, HttpMethod method, URI uri, byte[] body) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }
        InputStream in = (body == null || body.length == 0) ? null : new ByteArrayInputStream(body);
        RequestContext context = requestTimeout == null
                ? RequestContext.background()
                : RequestContext.withDeadline(clock.instant().plus(requestTimeout));
        return new ServerRequest(method, uri, headers, in, context);
    }

    // The path below the servlet mapping, still percent-encoded, plus the query string.
    private static URI routedUri(HttpServletRequest req) {
        String prefix = req.getContextPath();
        if (req.getPathInfo() != null) {
            prefix += req.getServletPath();
        }
        String requestUri = req.getRequestURI();
        String path = requestUri.startsWith(prefix) ? requestUri.substring(prefix.length()) : requestUri;
        if (path.isEmpty()) {
            path = "/";
        }
        String query = req.getQueryString();
        String authority = req.getServerName() + ":" + req.getServerPort();
        return URI.create(req.getScheme() + "://" + authority + path + (query == null ? "" : "?" + query));
    }

    private byte[] readBody(HttpServletRequest req) throws IOException {
        long declared = req.getContentLengthLong();
        if (declared == 0) {
            return new byte[0];
        }
        if (maxBodySize > 0 && declared > maxBodySize) {
            throw new BodySizeLimiter.PayloadTooLargeException(maxBodySize);
        }
        try (InputStream in = BodySizeLimiter.limit(req.getInputStream(), maxBodySize)) {
            return in.readAllBytes();
        }
    }

    private static void copy(ServerResponse out, HttpServletResponse resp) throws IOException {
        resp.setStatus(out.status());
        out.headers().forEach((name, values) -> values.forEach(v -> resp.addHeader(name, v)));
        byte[] body = out.body();
        if (body.length > 0) {
            resp.setContentLength(body.length);
            resp.getOutputStream().write(body);
        }
    }

    public static final class Builder {
        private final Router router;
        private long maxBodySize;
        private Duration requestTimeout;
        private Clock clock;

        private Builder(Router router) {
            this.router = Objects.requireNonNull(router, "router");
        }

        /**
         * Largest accepted request body in bytes; larger bodies are answered with 413.
         * 0, the default, means unlimited.
         */
        public Builder maxBodySize(long bytes) {
            if (bytes < 0) {
                throw new IllegalArgumentException("maxBodySize must not be negative: " + bytes);
            }
            this.maxBodySize = bytes;
            return this;
        }

        /**
         * Deadline handed to handlers through {@link RequestContext}. It is not enforced.
         */
        public Builder requestTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("requestTimeout must be positive: " + timeout);
            }
            this.requestTimeout = timeout;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public RestServlet build() {
            return new RestServlet(this);
        }
    }
}
