package io.restfn.json.spi;

/**
 * ServiceLoader provider for {@link JsonCodec}.
 *
 * <p>Modules such as {@code restfn-json-jackson} register implementations
 * via {@code META-INF/services/io.restfn.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {
    JsonCodec codec();
}
