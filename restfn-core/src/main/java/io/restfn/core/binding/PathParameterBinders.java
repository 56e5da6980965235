package io.restfn.core.binding;

import java.util.Map;
import java.util.Set;

/**
 * Binders that convert a named path segment into a scalar handler argument.
 *
 * <p>Supported: {@code String}, {@code float}, {@code double}, and the signed integer types
 * {@code byte}, {@code short}, {@code int}, {@code long} (boxed or primitive). The integer
 * types may be marked {@link io.restfn.core.Unsigned}. Parse failures are
 * {@link BindingException}s; an out-of-range value never binds.
 */
public final class PathParameterBinders {
    private static final Set<Class<?>> INTEGRAL = Set.of(
            byte.class, Byte.class, short.class, Short.class, int.class, Integer.class, long.class, Long.class);
    private static final Set<Class<?>> SUPPORTED = Set.of(
            String.class, float.class, Float.class, double.class, Double.class,
            byte.class, Byte.class, short.class, Short.class, int.class, Integer.class, long.class, Long.class);

    private static final Map<Class<?>, Class<?>> BOXES = Map.of(
            byte.class, Byte.class, short.class, Short.class, int.class, Integer.class,
            long.class, Long.class, float.class, Float.class, double.class, Double.class);

    private PathParameterBinders() {}

    public static boolean supports(Class<?> type, boolean unsigned) {
        return unsigned ? INTEGRAL.contains(type) : SUPPORTED.contains(type);
    }

    /**
     * Returns the binder for path parameter {@code name}.
     *
     * @throws InvalidHandlerException if {@code type} cannot be bound from a path segment
     */
    public static ParameterBinder forType(String name, Class<?> type, boolean unsigned) {
        if (!supports(type, unsigned)) {
            throw new InvalidHandlerException("unsupported " + (unsigned ? "unsigned " : "")
                    + "path parameter type " + type.getTypeName() + " for '" + name + "'");
        }
        Class<?> boxed = BOXES.getOrDefault(type, type);
        Parser parser = unsigned ? unsignedParser(boxed) : signedParser(boxed);
        String kind = kindName(boxed, unsigned);
        return request -> {
            String raw = request.pathParameter(name)
                    .orElseThrow(() -> new BindingException("missing path parameter '" + name + "'"));
            try {
                return parser.parse(raw);
            } catch (NumberFormatException e) {
                throw new BindingException("invalid value for path parameter '" + name + "': \""
                        + raw + "\" is not a valid " + kind, e);
            }
        };
    }

    static String kindName(Class<?> boxed, boolean unsigned) {
        String prefix = unsigned ? "uint" : "int";
        if (boxed == Byte.class) return prefix + "8";
        if (boxed == Short.class) return prefix + "16";
        if (boxed == Integer.class) return prefix + "32";
        if (boxed == Long.class) return prefix + "64";
        if (boxed == Float.class) return "float32";
        if (boxed == Double.class) return "float64";
        return "string";
    }

    private static Parser signedParser(Class<?> boxed) {
        if (boxed == String.class) return s -> s;
        if (boxed == Byte.class) return s -> Byte.parseByte(checkIntegerSyntax(s, true));
        if (boxed == Short.class) return s -> Short.parseShort(checkIntegerSyntax(s, true));
        if (boxed == Integer.class) return s -> Integer.parseInt(checkIntegerSyntax(s, true));
        if (boxed == Long.class) return s -> Long.parseLong(checkIntegerSyntax(s, true));
        if (boxed == Float.class) return PathParameterBinders::parseFloat;
        return PathParameterBinders::parseDouble;
    }

    private static Parser unsignedParser(Class<?> boxed) {
        if (boxed == Byte.class) return s -> (byte) parseUnsignedBounded(s, 0xFF);
        if (boxed == Short.class) return s -> (short) parseUnsignedBounded(s, 0xFFFF);
        if (boxed == Integer.class) return s -> Integer.parseUnsignedInt(checkIntegerSyntax(s, false));
        return s -> Long.parseUnsignedLong(checkIntegerSyntax(s, false));
    }

    private static int parseUnsignedBounded(String s, int max) {
        int value = Integer.parseUnsignedInt(checkIntegerSyntax(s, false));
        if (Integer.compareUnsigned(value, max) > 0) {
            throw new NumberFormatException("out of range: " + s);
        }
        return value;
    }

    private static Float parseFloat(String s) {
        checkDecimalSyntax(s);
        float value = Float.parseFloat(s);
        if (Float.isInfinite(value) && !s.contains("Infinity")) {
            throw new NumberFormatException("out of range: " + s);
        }
        return value;
    }

    private static Double parseDouble(String s) {
        checkDecimalSyntax(s);
        double value = Double.parseDouble(s);
        if (Double.isInfinite(value) && !s.contains("Infinity")) {
            throw new NumberFormatException("out of range: " + s);
        }
        return value;
    }

    // ASCII digits only, with an optional sign for signed kinds. Java's parsers accept any
    // Unicode digit, and the unsigned ones a leading '+'.
    private static String checkIntegerSyntax(String s, boolean signed) {
        int start = signed && !s.isEmpty() && (s.charAt(0) == '-' || s.charAt(0) == '+') ? 1 : 0;
        if (start == s.length()) {
            throw new NumberFormatException(s);
        }
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                throw new NumberFormatException(s);
            }
        }
        return s;
    }

    // Java's parser also accepts surrounding whitespace and f/d type suffixes
    private static void checkDecimalSyntax(String s) {
        if (s.isEmpty() || !s.equals(s.strip())) {
            throw new NumberFormatException(s);
        }
        char last = Character.toLowerCase(s.charAt(s.length() - 1));
        if (last == 'f' || last == 'd') {
            throw new NumberFormatException(s);
        }
    }

    @FunctionalInterface
    private interface Parser {
        Object parse(String raw);
    }
}
