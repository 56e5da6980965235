package io.restfn.core.binding;

import io.restfn.core.Reply;
import io.restfn.core.StatusCode;

import java.io.InputStream;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;
import java.util.concurrent.Future;

/**
 * How a handler's return value maps onto a {@link Reply}. Failures are thrown, not returned,
 * so every shape also carries the error channel.
 */
public enum ReturnShape {
    /** {@code void}: no body, default status. */
    NO_BODY {
        @Override
        public Reply<?> interpret(Object result) {
            return Reply.noBody();
        }
    },
    /** Any value type: the value is the body, default status. */
    BODY {
        @Override
        public Reply<?> interpret(Object result) {
            return result == null ? Reply.noBody() : Reply.body(result);
        }
    },
    /** {@link StatusCode}: explicit status, no body. */
    STATUS_ONLY {
        @Override
        public Reply<?> interpret(Object result) {
            return result == null ? Reply.noBody() : Reply.status((StatusCode) result);
        }
    },
    /** {@link Reply}: the handler picks the variant. */
    REPLY {
        @Override
        public Reply<?> interpret(Object result) {
            return result == null ? Reply.noBody() : (Reply<?>) result;
        }
    };

    private static final List<Class<?>> FORBIDDEN = List.of(
            Throwable.class, Future.class, CompletionStage.class, Flow.Publisher.class, InputStream.class);

    public abstract Reply<?> interpret(Object result);

    /**
     * @throws InvalidHandlerException for return types that cannot be encoded as one response
     */
    public static ReturnShape classify(Type returnType) {
        if (returnType == void.class || returnType == Void.class) {
            return NO_BODY;
        }
        Class<?> raw = rawType(returnType);
        if (raw == null) {
            return BODY;
        }
        if (raw == StatusCode.class) {
            return STATUS_ONLY;
        }
        if (Reply.class.isAssignableFrom(raw)) {
            return REPLY;
        }
        for (Class<?> forbidden : FORBIDDEN) {
            if (forbidden.isAssignableFrom(raw)) {
                throw new InvalidHandlerException("unsupported return type " + returnType.getTypeName()
                        + (forbidden == Throwable.class
                        ? ": throw errors instead of returning them"
                        : ": asynchronous and streaming results are not supported"));
            }
        }
        return BODY;
    }

    private static Class<?> rawType(Type type) {
        if (type instanceof Class<?> c) {
            return c;
        }
        if (type instanceof ParameterizedType p) {
            return (Class<?>) p.getRawType();
        }
        if (type instanceof GenericArrayType) {
            return Object[].class;
        }
        return null;
    }
}
