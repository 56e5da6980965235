package io.restfn.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 *
 * <p>The first provider found wins. Put exactly one codec module on the classpath, or pass a
 * codec explicitly wherever one is accepted.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> providers = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        while (providers.hasNext()) {
            JsonCodec codec = providers.next().codec();
            if (codec != null) return codec;
        }
        throw new IllegalStateException("No " + JsonCodecProvider.class.getName()
                + " found on the classpath; add restfn-json-jackson or supply a JsonCodec");
    }
}
