package io.restfn.core.routing;

import io.restfn.core.HttpMethod;
import io.restfn.core.RequestHandler;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered list of (method, pattern, handler) entries; the first entry matching both the
 * method and the path wins.
 *
 * <p>Writers must be confined to one thread; readers see an immutable snapshot and need no
 * locking.
 */
public final class RouteTable {
    private volatile List<Entry> entries = List.of();

    public void add(HttpMethod method, PathPattern pattern, RequestHandler handler) {
        List<Entry> next = new ArrayList<>(entries);
        next.add(new Entry(Objects.requireNonNull(method, "method"), Objects.requireNonNull(pattern, "pattern"),
                Objects.requireNonNull(handler, "handler")));
        entries = List.copyOf(next);
    }

    public int size() {
        return entries.size();
    }

    public Resolution resolve(HttpMethod method, String rawPath) {
        Set<HttpMethod> allowed = EnumSet.noneOf(HttpMethod.class);
        for (Entry entry : entries) {
            Optional<Map<String, String>> values = entry.pattern().match(rawPath);
            if (values.isEmpty()) continue;
            if (entry.method() == method) {
                return new Found(entry.handler(), entry.pattern(), values.get());
            }
            allowed.add(entry.method());
        }
        if (allowed.isEmpty()) {
            return NotFound.INSTANCE;
        }
        return new MethodNotAllowed(Set.copyOf(allowed));
    }

    record Entry(HttpMethod method, PathPattern pattern, RequestHandler handler) {
    }

    /**
     * Outcome of {@link #resolve(HttpMethod, String)}.
     */
    public sealed interface Resolution permits Found, MethodNotAllowed, NotFound {
    }

    public record Found(RequestHandler handler, PathPattern pattern, Map<String, String> pathParameters)
            implements Resolution {
    }

    /** The path is known, but only under {@code allowed}. */
    public record MethodNotAllowed(Set<HttpMethod> allowed) implements Resolution {
    }

    public static final class NotFound implements Resolution {
        static final NotFound INSTANCE = new NotFound();

        private NotFound() {
        }
    }
}
