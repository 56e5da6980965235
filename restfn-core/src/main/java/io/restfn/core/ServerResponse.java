package io.restfn.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Buffered {@link ResponseWriter}.
 *
 * <p>Adapters hand one of these to the router and copy the outcome onto their
 * framework-specific response objects afterwards.
 */
public final class ServerResponse implements ResponseWriter {
    private static final byte[] EMPTY = new byte[0];

    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private int status;
    private byte[] body = EMPTY;
    private boolean committed;

    @Override
    public void header(String name, String value) {
        requireUncommitted();
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
    }

    @Override
    public void write(int status, byte[] body) {
        requireUncommitted();
        this.status = status;
        this.body = body == null ? EMPTY : body;
        this.committed = true;
    }

    @Override
    public boolean isCommitted() {
        return committed;
    }

    /** The written status, or 0 before {@link #write(int, byte[])}. */
    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        String target = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target) && !e.getValue().isEmpty()) {
                return Optional.of(e.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    public byte[] body() {
        return body;
    }

    private void requireUncommitted() {
        if (committed) {
            throw new IllegalStateException("Response already written (status " + status + ")");
        }
    }
}
