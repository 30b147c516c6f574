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

package com.arakelian.cirjson.util;

import java.util.concurrent.atomic.AtomicReferenceArray;

import com.google.common.base.Preconditions;

/**
 * Holder of reusable byte and char buffers, keyed by purpose. A recycler is used by one parser or
 * generator at a time; it is borrowed from a {@link RecyclerPool} and returned when the parser or
 * generator is closed.
 */
public class BufferRecycler implements RecyclerPool.WithPool<BufferRecycler> {
    /** Buffer used for reading byte-based input **/
    public static final int BYTE_READ_IO_BUFFER = 0;

    /** Buffer used for temporary storage of encoded content by generators **/
    public static final int BYTE_WRITE_ENCODING_BUFFER = 1;

    /** Buffer used for concatenating binary output **/
    public static final int BYTE_WRITE_CONCAT_BUFFER = 2;

    /** Buffer used by Base64 encoding and decoding **/
    public static final int BYTE_BASE64_CODEC_BUFFER = 3;

    /** Buffer used for tokenizing char-based input **/
    public static final int CHAR_TOKEN_BUFFER = 0;

    /** Buffer used by generators for concatenating output **/
    public static final int CHAR_CONCAT_BUFFER = 1;

    /** First segment of a {@link TextBuffer} **/
    public static final int CHAR_TEXT_BUFFER = 2;

    /** Buffer used for copying property names **/
    public static final int CHAR_NAME_COPY_BUFFER = 3;

    private static final int[] BYTE_BUFFER_LENGTHS = new int[] { 8000, 8000, 2000, 2000 };

    private static final int[] CHAR_BUFFER_LENGTHS = new int[] { 4000, 4000, 200, 200 };

    protected final AtomicReferenceArray<byte[]> byteBuffers;

    protected final AtomicReferenceArray<char[]> charBuffers;

    /** Pool this recycler should be returned to, if any **/
    private RecyclerPool<BufferRecycler> pool;

    public BufferRecycler() {
        this(4, 4);
    }

    protected BufferRecycler(final int byteBufferCount, final int charBufferCount) {
        byteBuffers = new AtomicReferenceArray<>(byteBufferCount);
        charBuffers = new AtomicReferenceArray<>(charBufferCount);
    }

    public final byte[] allocByteBuffer(final int ix) {
        return allocByteBuffer(ix, 0);
    }

    /**
     * Returns a byte buffer for the given slot, reusing the pooled one when it is large enough.
     *
     * @param ix
     *            slot index
     * @param minSize
     *            minimum size of the returned buffer
     * @return buffer with at least the requested size
     */
    public byte[] allocByteBuffer(final int ix, final int minSize) {
        final int size = Math.max(byteBufferLength(ix), minSize);
        final byte[] buffer = byteBuffers.getAndSet(ix, null);
        if (buffer == null || buffer.length < size) {
            return new byte[size];
        }
        return buffer;
    }

    public final char[] allocCharBuffer(final int ix) {
        return allocCharBuffer(ix, 0);
    }

    /**
     * Returns a char buffer for the given slot, reusing the pooled one when it is large enough.
     *
     * @param ix
     *            slot index
     * @param minSize
     *            minimum size of the returned buffer
     * @return buffer with at least the requested size
     */
    public char[] allocCharBuffer(final int ix, final int minSize) {
        final int size = Math.max(charBufferLength(ix), minSize);
        final char[] buffer = charBuffers.getAndSet(ix, null);
        if (buffer == null || buffer.length < size) {
            return new char[size];
        }
        return buffer;
    }

    protected int byteBufferLength(final int ix) {
        return BYTE_BUFFER_LENGTHS[ix];
    }

    protected int charBufferLength(final int ix) {
        return CHAR_BUFFER_LENGTHS[ix];
    }

    /**
     * Returns true if this recycler is currently linked to a pool.
     *
     * @return true if linked to a pool
     */
    public boolean isLinkedWithPool() {
        return pool != null;
    }

    public void releaseByteBuffer(final int ix, final byte[] buffer) {
        // keep the larger of the two
        final byte[] old = byteBuffers.get(ix);
        if (old == null || buffer.length > old.length) {
            byteBuffers.set(ix, buffer);
        }
    }

    public void releaseCharBuffer(final int ix, final char[] buffer) {
        final char[] old = charBuffers.get(ix);
        if (old == null || buffer.length > old.length) {
            charBuffers.set(ix, buffer);
        }
    }

    @Override
    public void releaseToPool() {
        if (pool != null) {
            final RecyclerPool<BufferRecycler> tmp = pool;
            // unlink first so that a second release is a no-op
            pool = null;
            tmp.releasePooled(this);
        }
    }

    @Override
    public BufferRecycler withPool(final RecyclerPool<BufferRecycler> pool) {
        Preconditions.checkArgument(pool != null, "pool must be non-null");
        Preconditions.checkState(this.pool == null, "BufferRecycler already linked to pool: %s", this.pool);
        this.pool = pool;
        return this;
    }
}
