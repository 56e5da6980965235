package io.restfn.servlet;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BodySizeLimiterTest {

    @Test
    void allowsExactlyTheLimit() throws Exception {
        InputStream limited = BodySizeLimiter.limit(new ByteArrayInputStream("hello".getBytes()), 5);
        assertThat(limited.readAllBytes()).hasSize(5);
    }

    @Test
    void failsOnceTheLimitIsExceeded() {
        InputStream limited = BodySizeLimiter.limit(new ByteArrayInputStream("hello!".getBytes()), 5);
        assertThatThrownBy(limited::readAllBytes)
                .isInstanceOfSatisfying(BodySizeLimiter.PayloadTooLargeException.class,
                        e -> assertThat(e.maxBytes()).isEqualTo(5));
    }

    @Test
    void singleByteReadsAreCounted() throws Exception {
        InputStream limited = BodySizeLimiter.limit(new ByteArrayInputStream("abc".getBytes()), 2);
        assertThat(limited.read()).isEqualTo('a');
        assertThat(limited.read()).isEqualTo('b');
        assertThatThrownBy(limited::read).isInstanceOf(BodySizeLimiter.PayloadTooLargeException.class);
    }

    @Test
    void nullStaysNull() {
        assertThat(BodySizeLimiter.limit(null, 5)).isNull();
    }

    @Test
    void nonPositiveLimitDisablesTheCheck() throws Exception {
        InputStream source = new ByteArrayInputStream("hello".getBytes());
        assertThat(BodySizeLimiter.limit(source, 0)).isSameAs(source);
    }
}
