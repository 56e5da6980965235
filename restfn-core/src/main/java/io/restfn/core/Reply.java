package io.restfn.core;

import java.util.Objects;

/**
 * The result of a handler invocation: an optional body and an optional explicit status.
 *
 * <p>Handlers may return a {@code Reply} directly to choose both. Every other supported
 * return type is normalised into one of these variants before encoding. A status of 0
 * lets the protocol pick its default.
 */
public sealed interface Reply<T> permits Reply.NoBody, Reply.BodyOnly, Reply.StatusOnly, Reply.BodyAndStatus {

    /** The explicit status, or 0 when unset. */
    int status();

    /** The body, or null when the response has none. */
    T body();

    static <T> Reply<T> noBody() {
        return new NoBody<>();
    }

    static <T> Reply<T> body(T body) {
        return new BodyOnly<>(body);
    }

    static <T> Reply<T> status(int status) {
        return new StatusOnly<>(StatusCode.of(status));
    }

    static <T> Reply<T> status(StatusCode status) {
        return new StatusOnly<>(status);
    }

    static <T> Reply<T> of(T body, int status) {
        return new BodyAndStatus<>(body, StatusCode.of(status));
    }

    record NoBody<T>() implements Reply<T> {
        @Override
        public int status() {
            return 0;
        }

        @Override
        public T body() {
            return null;
        }
    }

    record BodyOnly<T>(T body) implements Reply<T> {
        @Override
        public int status() {
            return 0;
        }
    }

    record StatusOnly<T>(StatusCode code) implements Reply<T> {
        public StatusOnly {
            Objects.requireNonNull(code, "code");
        }

        @Override
        public int status() {
            return code.value();
        }

        @Override
        public T body() {
            return null;
        }
    }

    record BodyAndStatus<T>(T body, StatusCode code) implements Reply<T> {
        public BodyAndStatus {
            Objects.requireNonNull(code, "code");
        }

        @Override
        public int status() {
            return code.value();
        }
    }
}
