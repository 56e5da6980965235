package io.restfn.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@code byte}, {@code short}, {@code int} or {@code long} path parameter as
 * unsigned. The segment is parsed over the full unsigned range of the width and stored as
 * its two's-complement bit pattern, so {@code 255} binds to {@code (byte) -1}. Read it back
 * with {@link Byte#toUnsignedInt}, {@link Integer#toUnsignedLong} and friends.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.PARAMETER)
public @interface Unsigned {
}
