package io.restfn.servlet;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Caps the number of bytes read from a request body.
 */
final class BodySizeLimiter {

    private BodySizeLimiter() {}

    /**
     * Wraps {@code delegate} so that reading past {@code maxBytes} fails with
     * {@link PayloadTooLargeException}. A non-positive limit disables the check.
     */
    static InputStream limit(InputStream delegate, long maxBytes) {
        if (delegate == null) return null;
        if (maxBytes <= 0 || maxBytes == Long.MAX_VALUE) return delegate;
        return new LimitedInputStream(delegate, maxBytes);
    }

    static final class PayloadTooLargeException extends IOException {
        private final long maxBytes;

        PayloadTooLargeException(long maxBytes) {
            super("request body exceeds " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
        }

        long maxBytes() {
            return maxBytes;
        }
    }

    private static final class LimitedInputStream extends FilterInputStream {
        private final long maxBytes;
        private long count;

        LimitedInputStream(InputStream in, long maxBytes) {
            super(in);
            this.maxBytes = maxBytes;
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b >= 0) {
                count(1);
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            // one byte past the limit is enough to detect an oversized body
            int n = super.read(b, off, (int) Math.min(len, maxBytes - count + 1));
            if (n > 0) {
                count(n);
            }
            return n;
        }

        @Override
        public long skip(long n) throws IOException {
            long skipped = super.skip(Math.min(n, maxBytes - count + 1));
            count(skipped);
            return skipped;
        }

        private void count(long n) throws PayloadTooLargeException {
            count += n;
            if (count > maxBytes) {
                throw new PayloadTooLargeException(maxBytes);
            }
        }
    }
}
