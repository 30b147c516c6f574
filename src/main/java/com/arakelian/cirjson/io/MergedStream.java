/*
 * Copyright 2012-2017 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.arakelian.cirjson.io;

import java.io.IOException;
import java.io.InputStream;

/**
 * Input stream that first returns bytes that were already read into a buffer, then continues with
 * the underlying stream. Used after encoding detection has consumed the start of the input.
 */
public final class MergedStream extends InputStream {
    private final IOContext context;

    private final InputStream in;

    private byte[] buffer;

    private int ptr;

    private final int end;

    public MergedStream(
            final IOContext context,
            final InputStream in,
            final byte[] buffer,
            final int start,
            final int end) {
        this.context = context;
        this.in = in;
        this.buffer = buffer;
        this.ptr = start;
        this.end = end;
    }

    @Override
    public int available() throws IOException {
        if (buffer != null) {
            return end - ptr;
        }
        return in.available();
    }

    @Override
    public void close() throws IOException {
        free();
        in.close();
    }

    private void free() {
        final byte[] buf = buffer;
        if (buf != null) {
            buffer = null;
            if (context != null) {
                context.releaseReadIOBuffer(buf);
            }
        }
    }

    @Override
    public synchronized void mark(final int readlimit) {
        if (buffer == null) {
            in.mark(readlimit);
        }
    }

    @Override
    public boolean markSupported() {
        // only once the buffered bytes are used up
        return buffer == null && in.markSupported();
    }

    @Override
    public int read() throws IOException {
        if (buffer != null) {
            final int c = buffer[ptr++] & 0xFF;
            if (ptr >= end) {
                free();
            }
            return c;
        }
        return in.read();
    }

    @Override
    public int read(final byte[] b) throws IOException {
        return read(b, 0, b.length);
    }

    @Override
    public int read(final byte[] b, final int off, int len) throws IOException {
        if (buffer != null) {
            final int avail = end - ptr;
            if (len > avail) {
                len = avail;
            }
            System.arraycopy(buffer, ptr, b, off, len);
            ptr += len;
            if (ptr >= end) {
                free();
            }
            return len;
        }
        return in.read(b, off, len);
    }

    @Override
    public synchronized void reset() throws IOException {
        if (buffer == null) {
            in.reset();
        }
    }

    @Override
    public long skip(long n) throws IOException {
        long count = 0L;
        if (buffer != null) {
            final int amount = end - ptr;
            if (amount > n) {
                ptr += (int) n;
                return n;
            }
            free();
            count += amount;
            n -= amount;
        }
        if (n > 0) {
            count += in.skip(n);
        }
        return count;
    }
}
