package io.restfn.core.routing;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A route path made of literal and named segments, e.g. {@code /users/:id/orders/:order}.
 *
 * <p>A named segment starts with {@code :} and captures exactly one path segment. Captured
 * values are percent-decoded once, segment by segment.
 */
public final class PathPattern {
    private static final char PARAM_PREFIX = ':';

    private final String pattern;
    private final List<String> segments;
    private final List<String> parameterNames;

    private PathPattern(String pattern, List<String> segments, List<String> parameterNames) {
        this.pattern = pattern;
        this.segments = segments;
        this.parameterNames = parameterNames;
    }

    /**
     * Parses a pattern.
     *
     * @throws IllegalArgumentException if the pattern does not start with {@code /}, has an
     *         empty parameter name, or repeats a parameter name
     */
    public static PathPattern parse(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (!pattern.startsWith("/")) {
            throw new IllegalArgumentException("Path pattern must start with '/': " + pattern);
        }
        List<String> segments = split(pattern);
        List<String> names = new ArrayList<>();
        for (String segment : segments) {
            if (!isParameter(segment)) continue;
            String name = segment.substring(1);
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty parameter name in path pattern: " + pattern);
            }
            if (names.contains(name)) {
                throw new IllegalArgumentException("Duplicate parameter '" + name + "' in path pattern: " + pattern);
            }
            names.add(name);
        }
        return new PathPattern(pattern, List.copyOf(segments), Collections.unmodifiableList(names));
    }

    public String pattern() {
        return pattern;
    }

    /** Named segments in declaration order. */
    public List<String> parameterNames() {
        return parameterNames;
    }

    /**
     * Matches a raw (still percent-encoded) request path.
     *
     * @return the captured values keyed by name, or empty when the path does not match
     */
    public Optional<Map<String, String>> match(String rawPath) {
        List<String> actual = split(rawPath == null || rawPath.isEmpty() ? "/" : rawPath);
        if (actual.size() != segments.size()) {
            return Optional.empty();
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            String expected = segments.get(i);
            String decoded = decode(actual.get(i));
            if (decoded == null) {
                return Optional.empty();
            }
            if (isParameter(expected)) {
                values.put(expected.substring(1), decoded);
            } else if (!expected.equals(decoded)) {
                return Optional.empty();
            }
        }
        return Optional.of(values);
    }

    /**
     * Substitutes {@code values} into the named segments, in order, percent-encoding each.
     *
     * @throws IllegalArgumentException if the number of values differs from the number of
     *         named segments
     */
    public String expand(Object... values) {
        Object[] args = values == null ? new Object[0] : values;
        if (args.length != parameterNames.size()) {
            throw new IllegalArgumentException("Path pattern " + pattern + " expects " + parameterNames.size()
                    + " value(s), got " + args.length);
        }
        if (segments.isEmpty()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        int next = 0;
        for (String segment : segments) {
            sb.append('/');
            if (isParameter(segment)) {
                sb.append(encode(String.valueOf(args[next++])));
            } else {
                sb.append(encode(segment));
            }
        }
        if (pattern.length() > 1 && pattern.endsWith("/")) {
            sb.append('/');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return pattern;
    }

    private static boolean isParameter(String segment) {
        return !segment.isEmpty() && segment.charAt(0) == PARAM_PREFIX;
    }

    // "/" has no segments; a trailing slash does not add an empty one
    private static List<String> split(String path) {
        List<String> out = new ArrayList<>();
        int start = path.startsWith("/") ? 1 : 0;
        if (start >= path.length()) {
            return out;
        }
        String trimmed = path.endsWith("/") ? path.substring(start, path.length() - 1) : path.substring(start);
        for (String s : trimmed.split("/", -1)) {
            out.add(s);
        }
        return out;
    }

    private static String decode(String segment) {
        try {
            return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
