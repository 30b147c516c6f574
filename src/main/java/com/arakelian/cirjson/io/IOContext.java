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

import com.arakelian.cirjson.StreamReadConstraints;
import com.arakelian.cirjson.StreamWriteConstraints;
import com.arakelian.cirjson.util.BufferRecycler;
import com.arakelian.cirjson.util.ReadConstrainedTextBuffer;
import com.arakelian.cirjson.util.TextBuffer;

/**
 * Per-session context shared by a parser or generator and the helper objects it creates. Each
 * kind of buffer can be allocated once and must be released before it can be allocated again.
 */
public class IOContext implements AutoCloseable {
    private final ContentReference contentReference;

    /** True if the parser or generator owns the input or output and should close it **/
    private final boolean managedResource;

    private final BufferRecycler bufferRecycler;

    /** True if {@link #bufferRecycler} should be released to its pool on close **/
    private boolean releaseRecycler;

    private final StreamReadConstraints streamReadConstraints;

    private final StreamWriteConstraints streamWriteConstraints;

    private CirJsonEncoding encoding;

    private byte[] readIOBuffer;

    private byte[] writeEncodingBuffer;

    private byte[] base64Buffer;

    private char[] tokenCBuffer;

    private char[] concatCBuffer;

    private char[] nameCopyBuffer;

    private boolean closed;

    public IOContext(
            final StreamReadConstraints streamReadConstraints,
            final StreamWriteConstraints streamWriteConstraints,
            final BufferRecycler bufferRecycler,
            final ContentReference contentReference,
            final boolean managedResource,
            final CirJsonEncoding encoding) {
        this.streamReadConstraints = streamReadConstraints != null ? streamReadConstraints
                : StreamReadConstraints.defaults();
        this.streamWriteConstraints = streamWriteConstraints != null ? streamWriteConstraints
                : StreamWriteConstraints.defaults();
        this.bufferRecycler = bufferRecycler;
        this.contentReference = contentReference != null ? contentReference : ContentReference.unknown();
        this.managedResource = managedResource;
        this.encoding = encoding;
    }

    public byte[] allocBase64Buffer() {
        verifyAlloc(base64Buffer);
        return base64Buffer = bufferRecycler.allocByteBuffer(BufferRecycler.BYTE_BASE64_CODEC_BUFFER);
    }

    public byte[] allocBase64Buffer(final int minSize) {
        verifyAlloc(base64Buffer);
        return base64Buffer = bufferRecycler.allocByteBuffer(BufferRecycler.BYTE_BASE64_CODEC_BUFFER, minSize);
    }

    public char[] allocConcatBuffer() {
        verifyAlloc(concatCBuffer);
        return concatCBuffer = bufferRecycler.allocCharBuffer(BufferRecycler.CHAR_CONCAT_BUFFER);
    }

    public char[] allocNameCopyBuffer(final int minSize) {
        verifyAlloc(nameCopyBuffer);
        return nameCopyBuffer = bufferRecycler.allocCharBuffer(BufferRecycler.CHAR_NAME_COPY_BUFFER, minSize);
    }

    public byte[] allocReadIOBuffer() {
        verifyAlloc(readIOBuffer);
        return readIOBuffer = bufferRecycler.allocByteBuffer(BufferRecycler.BYTE_READ_IO_BUFFER);
    }

    public byte[] allocReadIOBuffer(final int minSize) {
        verifyAlloc(readIOBuffer);
        return readIOBuffer = bufferRecycler.allocByteBuffer(BufferRecycler.BYTE_READ_IO_BUFFER, minSize);
    }

    public char[] allocTokenBuffer() {
        verifyAlloc(tokenCBuffer);
        return tokenCBuffer = bufferRecycler.allocCharBuffer(BufferRecycler.CHAR_TOKEN_BUFFER);
    }

    public char[] allocTokenBuffer(final int minSize) {
        verifyAlloc(tokenCBuffer);
        return tokenCBuffer = bufferRecycler.allocCharBuffer(BufferRecycler.CHAR_TOKEN_BUFFER, minSize);
    }

    public byte[] allocWriteEncodingBuffer() {
        verifyAlloc(writeEncodingBuffer);
        return writeEncodingBuffer = bufferRecycler.allocByteBuffer(BufferRecycler.BYTE_WRITE_ENCODING_BUFFER);
    }

    public byte[] allocWriteEncodingBuffer(final int minSize) {
        verifyAlloc(writeEncodingBuffer);
        return writeEncodingBuffer = bufferRecycler
                .allocByteBuffer(BufferRecycler.BYTE_WRITE_ENCODING_BUFFER, minSize);
    }

    /**
     * Releases the buffer recycler back to its pool, if this context acquired it from one. Safe to
     * call more than once.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            if (releaseRecycler) {
                releaseRecycler = false;
                bufferRecycler.releaseToPool();
            }
        }
    }

    public ReadConstrainedTextBuffer constructReadConstrainedTextBuffer() {
        return new ReadConstrainedTextBuffer(streamReadConstraints, bufferRecycler);
    }

    public TextBuffer constructTextBuffer() {
        return new TextBuffer(bufferRecycler);
    }

    public ContentReference contentReference() {
        return contentReference;
    }

    public BufferRecycler getBufferRecycler() {
        return bufferRecycler;
    }

    public CirJsonEncoding getEncoding() {
        return encoding;
    }

    public StreamReadConstraints getStreamReadConstraints() {
        return streamReadConstraints;
    }

    public StreamWriteConstraints getStreamWriteConstraints() {
        return streamWriteConstraints;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isResourceManaged() {
        return managedResource;
    }

    /**
     * Marks the buffer recycler as one acquired from a pool, to be released on {@link #close()}.
     *
     * @return this context
     */
    public IOContext markBufferRecyclerReleased() {
        releaseRecycler = true;
        return this;
    }

    public void releaseBase64Buffer(final byte[] buf) {
        if (buf != null) {
            verifyRelease(buf, base64Buffer);
            base64Buffer = null;
            bufferRecycler.releaseByteBuffer(BufferRecycler.BYTE_BASE64_CODEC_BUFFER, buf);
        }
    }

    public void releaseConcatBuffer(final char[] buf) {
        if (buf != null) {
            verifyRelease(buf, concatCBuffer);
            concatCBuffer = null;
            bufferRecycler.releaseCharBuffer(BufferRecycler.CHAR_CONCAT_BUFFER, buf);
        }
    }

    public void releaseNameCopyBuffer(final char[] buf) {
        if (buf != null) {
            verifyRelease(buf, nameCopyBuffer);
            nameCopyBuffer = null;
            bufferRecycler.releaseCharBuffer(BufferRecycler.CHAR_NAME_COPY_BUFFER, buf);
        }
    }

    public void releaseReadIOBuffer(final byte[] buf) {
        if (buf != null) {
            verifyRelease(buf, readIOBuffer);
            readIOBuffer = null;
            bufferRecycler.releaseByteBuffer(BufferRecycler.BYTE_READ_IO_BUFFER, buf);
        }
    }

    public void releaseTokenBuffer(final char[] buf) {
        if (buf != null) {
            verifyRelease(buf, tokenCBuffer);
            tokenCBuffer = null;
            bufferRecycler.releaseCharBuffer(BufferRecycler.CHAR_TOKEN_BUFFER, buf);
        }
    }

    public void releaseWriteEncodingBuffer(final byte[] buf) {
        if (buf != null) {
            verifyRelease(buf, writeEncodingBuffer);
            writeEncodingBuffer = null;
            bufferRecycler.releaseByteBuffer(BufferRecycler.BYTE_WRITE_ENCODING_BUFFER, buf);
        }
    }

    public void setEncoding(final CirJsonEncoding encoding) {
        this.encoding = encoding;
    }

    private void verifyAlloc(final Object buffer) {
        if (buffer != null) {
            throw new IllegalStateException("Trying to call same allocXxx() method second time");
        }
    }

    private void verifyRelease(final byte[] toRelease, final byte[] src) {
        // caller may release a larger buffer it grew, but never a smaller one
        if (toRelease != src && src != null && toRelease.length < src.length) {
            throw new IllegalArgumentException("Trying to release buffer smaller than original");
        }
    }

    private void verifyRelease(final char[] toRelease, final char[] src) {
        if (toRelease != src && src != null && toRelease.length < src.length) {
            throw new IllegalArgumentException("Trying to release buffer smaller than original");
        }
    }
}
