package io.restfn.core.binding;

import io.restfn.core.RequestContext;
import io.restfn.core.ServerProtocol;
import io.restfn.core.ServerRequest;
import io.restfn.core.Unsigned;
import io.restfn.core.routing.PathPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Analyses a handler once, at registration, and builds its {@link HandlerAdapter}.
 *
 * <p>Parameters are classified in declaration order:
 * <ol>
 *   <li>{@link RequestContext} receives the request's context;</li>
 *   <li>{@link ServerRequest} receives the request itself;</li>
 *   <li>while named segments of the pattern remain unconsumed, the parameter binds the next
 *       one, left to right, converted by {@link PathParameterBinders};</li>
 *   <li>otherwise the first remaining parameter is the body, decoded by the protocol;
 *       {@code Optional<T>} decodes {@code T} and binds empty without a payload;</li>
 *   <li>any further parameter has no binding source and fails the registration.</li>
 * </ol>
 * The return type is classified by {@link ReturnShape#classify(Type)}.
 */
public final class HandlerAdapterBuilder {
    private static final Logger log = LoggerFactory.getLogger(HandlerAdapterBuilder.class);

    private HandlerAdapterBuilder() {}

    /**
     * @throws InvalidHandlerException if the handler's signature is not supported
     */
    public static HandlerAdapter build(String route, PathPattern pattern, HandlerMethod handler,
                                       ServerProtocol protocol) {
        Objects.requireNonNull(protocol, "protocol");
        HandlerSignature signature = classify(pattern, handler);
        List<ParameterBinder> binders = new ArrayList<>(signature.parameters().size());
        for (ParameterSlot slot : signature.parameters()) {
            binders.add(slot.binder(protocol));
        }
        return new HandlerAdapter(route, handler, signature, binders, protocol);
    }

    /**
     * @throws InvalidHandlerException if the handler's signature is not supported
     */
    public static HandlerSignature classify(PathPattern pattern, HandlerMethod handler) {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(handler, "handler");
        Method method = handler.method();
        Type[] types = method.getGenericParameterTypes();
        Iterator<String> segments = pattern.parameterNames().iterator();
        List<ParameterSlot> slots = new ArrayList<>(types.length);
        boolean bodyAssigned = false;

        for (int i = 0; i < types.length; i++) {
            Type type = types[i];
            boolean unsigned = method.getParameters()[i].isAnnotationPresent(Unsigned.class);
            if (type instanceof TypeVariable<?>) {
                throw invalid(handler, i, "has type variable " + type.getTypeName()
                        + "; declare handlers through an interface with concrete types");
            }
            if (type == RequestContext.class || type == ServerRequest.class) {
                if (unsigned) throw invalid(handler, i, "cannot be @Unsigned");
                slots.add(type == RequestContext.class ? new ParameterSlot.Context() : new ParameterSlot.Request());
            } else if (segments.hasNext()) {
                String name = segments.next();
                if (!(type instanceof Class<?> raw) || !PathParameterBinders.supports(raw, unsigned)) {
                    throw invalid(handler, i, "binds path parameter '" + name + "' but its type "
                            + type.getTypeName() + (unsigned ? " cannot be @Unsigned" : " is not supported"));
                }
                slots.add(new ParameterSlot.PathParameter(name, raw, unsigned));
            } else if (!bodyAssigned) {
                if (unsigned) throw invalid(handler, i, "is the request body and cannot be @Unsigned");
                slots.add(bodySlot(handler, i, type));
                bodyAssigned = true;
            } else {
                throw invalid(handler, i, "cannot determine a binding source: no path parameter left"
                        + " and the body is already bound");
            }
        }

        if (segments.hasNext()) {
            List<String> unused = new ArrayList<>();
            segments.forEachRemaining(unused::add);
            log.debug("Path parameters {} of {} are not bound by {}", unused, pattern, handler);
        }

        Type returnType = method.getGenericReturnType();
        ReturnShape shape;
        try {
            shape = ReturnShape.classify(returnType);
        } catch (InvalidHandlerException e) {
            throw new InvalidHandlerException("handler " + handler + ": " + e.getMessage(), e);
        }
        return new HandlerSignature(slots, shape, returnType);
    }

    private static ParameterSlot.Body bodySlot(HandlerMethod handler, int index, Type type) {
        if (type == Optional.class) {
            throw invalid(handler, index, "is a raw Optional; declare its value type");
        }
        if (type instanceof ParameterizedType p && p.getRawType() == Optional.class) {
            Type value = p.getActualTypeArguments()[0];
            if (value instanceof TypeVariable<?> || value instanceof WildcardType) {
                throw invalid(handler, index, "has unresolved body type " + type.getTypeName());
            }
            return new ParameterSlot.Body(value, true);
        }
        return new ParameterSlot.Body(type, false);
    }

    private static InvalidHandlerException invalid(HandlerMethod handler, int index, String reason) {
        return new InvalidHandlerException("handler " + handler + ": parameter " + index + " " + reason);
    }
}
