package io.restfn.core.binding;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A handler function: a reflected method plus the object it is invoked on.
 *
 * <p>The method's generic parameter and return types drive the signature analysis, so for
 * lambdas and method references it is the functional interface's abstract method that is
 * analysed. Handlers are therefore typed through dedicated interfaces with concrete types
 * rather than through {@code java.util.function} generics, whose type variables carry no
 * runtime type information.
 */
public final class HandlerMethod {
    private final Object target;
    private final Method method;

    private HandlerMethod(Object target, Method method) {
        this.target = target;
        this.method = method;
        if (!method.trySetAccessible()) {
            throw new InvalidHandlerException("handler method " + describe(method) + " is not accessible");
        }
    }

    /**
     * Wraps a functional-interface instance (lambda, method reference or explicit
     * implementation).
     *
     * @throws InvalidHandlerException if {@code function} does not implement exactly one
     *         functional interface
     */
    public static HandlerMethod of(Object function) {
        Objects.requireNonNull(function, "function");
        if (function instanceof HandlerMethod handlerMethod) {
            return handlerMethod;
        }
        Set<Method> candidates = new LinkedHashSet<>();
        for (Class<?> iface : allInterfaces(function.getClass())) {
            Method sam = singleAbstractMethod(iface);
            if (sam != null) {
                candidates.add(sam);
            }
        }
        if (candidates.size() != 1) {
            throw new InvalidHandlerException("handler " + function.getClass().getName()
                    + " must implement exactly one functional interface, found " + candidates.size());
        }
        return new HandlerMethod(function, candidates.iterator().next());
    }

    /**
     * Resolves the public method named {@code methodName}. When {@code target} is a
     * {@link Class}, its static methods are searched; otherwise the instance methods of the
     * target's class.
     *
     * @throws InvalidHandlerException if no method, or more than one, has that name
     */
    public static HandlerMethod of(Object target, String methodName) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(methodName, "methodName");
        boolean statics = target instanceof Class<?>;
        Class<?> type = statics ? (Class<?>) target : target.getClass();
        List<Method> matches = new ArrayList<>();
        for (Method m : type.getMethods()) {
            if (m.getName().equals(methodName) && Modifier.isStatic(m.getModifiers()) == statics
                    && !m.isBridge() && !m.isSynthetic()) {
                matches.add(m);
            }
        }
        if (matches.size() != 1) {
            throw new InvalidHandlerException("expected exactly one public " + (statics ? "static " : "")
                    + "method named '" + methodName + "' on " + type.getName() + ", found " + matches.size());
        }
        return new HandlerMethod(statics ? null : target, matches.get(0));
    }

    /**
     * Wraps an explicit method. {@code target} is ignored for static methods and required
     * otherwise.
     */
    public static HandlerMethod of(Object target, Method method) {
        Objects.requireNonNull(method, "method");
        if (Modifier.isStatic(method.getModifiers())) {
            return new HandlerMethod(null, method);
        }
        if (target == null || !method.getDeclaringClass().isInstance(target)) {
            throw new InvalidHandlerException("instance method " + describe(method) + " needs a target of type "
                    + method.getDeclaringClass().getName());
        }
        return new HandlerMethod(target, method);
    }

    public Object target() {
        return target;
    }

    public Method method() {
        return method;
    }

    /**
     * Invokes the handler, unwrapping reflection wrappers so the handler's own exception
     * reaches the caller.
     */
    public Object invoke(Object... args) throws Exception {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("handler " + this + " is not accessible", e);
        }
    }

    @Override
    public String toString() {
        return describe(method);
    }

    static String describe(Method method) {
        return method.getDeclaringClass().getSimpleName() + "." + method.getName()
                + Arrays.stream(method.getParameterTypes()).map(Class::getSimpleName)
                .collect(Collectors.joining(", ", "(", ")"));
    }

    private static Set<Class<?>> allInterfaces(Class<?> type) {
        Set<Class<?>> out = new LinkedHashSet<>();
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            for (Class<?> iface : c.getInterfaces()) {
                collect(iface, out);
            }
        }
        return out;
    }

    private static void collect(Class<?> iface, Set<Class<?>> out) {
        if (out.add(iface)) {
            for (Class<?> parent : iface.getInterfaces()) {
                collect(parent, out);
            }
        }
    }

    private static Method singleAbstractMethod(Class<?> iface) {
        Method found = null;
        for (Method m : iface.getMethods()) {
            if (!Modifier.isAbstract(m.getModifiers()) || isObjectMethod(m)) continue;
            if (found != null && !sameSignature(found, m)) {
                return null;
            }
            if (found == null) {
                found = m;
            }
        }
        return found;
    }

    private static boolean sameSignature(Method a, Method b) {
        return a.getName().equals(b.getName()) && Arrays.equals(a.getParameterTypes(), b.getParameterTypes());
    }

    private static boolean isObjectMethod(Method m) {
        try {
            Object.class.getMethod(m.getName(), m.getParameterTypes());
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
