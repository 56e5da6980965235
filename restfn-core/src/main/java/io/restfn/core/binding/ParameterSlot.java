package io.restfn.core.binding;

import io.restfn.core.ServerDecoder;
import io.restfn.core.ProtocolException;

import java.lang.reflect.Type;
import java.util.Objects;
import java.util.Optional;

/**
 * The binding source of one handler parameter.
 */
public sealed interface ParameterSlot
        permits ParameterSlot.Context, ParameterSlot.Request, ParameterSlot.PathParameter, ParameterSlot.Body {

    ParameterBinder binder(ServerDecoder decoder);

    /** The request's {@link io.restfn.core.RequestContext}. */
    record Context() implements ParameterSlot {
        @Override
        public ParameterBinder binder(ServerDecoder decoder) {
            return request -> request.context();
        }
    }

    /** The {@link io.restfn.core.ServerRequest} itself. */
    record Request() implements ParameterSlot {
        @Override
        public ParameterBinder binder(ServerDecoder decoder) {
            return request -> request;
        }
    }

    record PathParameter(String name, Class<?> type, boolean unsigned) implements ParameterSlot {
        public PathParameter {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }

        @Override
        public ParameterBinder binder(ServerDecoder decoder) {
            return PathParameterBinders.forType(name, type, unsigned);
        }
    }

    /**
     * The decoded request payload.
     *
     * @param type the type to decode into; for an {@code Optional<T>} parameter this is {@code T}
     * @param optional whether the parameter is an {@code Optional}, which binds empty when
     *        the request has no payload
     */
    record Body(Type type, boolean optional) implements ParameterSlot {
        public Body {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public ParameterBinder binder(ServerDecoder decoder) {
            return request -> {
                if (optional && !request.hasBody()) {
                    return Optional.empty();
                }
                Object value;
                try {
                    value = decoder.decodeRequest(request, type);
                } catch (ProtocolException e) {
                    throw new BindingException(e.getMessage(), e);
                }
                if (optional) {
                    return Optional.ofNullable(value);
                }
                if (value == null) {
                    throw new BindingException("request body decoded to null");
                }
                return value;
            };
        }
    }
}
