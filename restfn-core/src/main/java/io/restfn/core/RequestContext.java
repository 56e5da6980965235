package io.restfn.core;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Cancellation and deadline signal of the server hosting a request.
 *
 * <p>Handlers declare a parameter of this type to receive it. The router only passes it
 * along; creating and enforcing deadlines is up to the hosting server adapter.
 */
public interface RequestContext {

    /**
     * The instant after which the server no longer wants a response, if any.
     */
    Optional<Instant> deadline();

    /**
     * Whether the server has abandoned the request (client gone, shutdown, ...).
     */
    boolean isCancelled();

    /**
     * A context that is never cancelled and has no deadline.
     */
    static RequestContext background() {
        return Simple.BACKGROUND;
    }

    static RequestContext withDeadline(Instant deadline) {
        return new Simple(Objects.requireNonNull(deadline, "deadline"));
    }

    final class Simple implements RequestContext {
        private static final Simple BACKGROUND = new Simple(null);

        private final Instant deadline;

        private Simple(Instant deadline) {
            this.deadline = deadline;
        }

        @Override
        public Optional<Instant> deadline() {
            return Optional.ofNullable(deadline);
        }

        @Override
        public boolean isCancelled() {
            return false;
        }
    }
}
