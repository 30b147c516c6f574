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
package com.arakelian.cirjson.json;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import com.arakelian.cirjson.ObjectWriteContext;
import com.arakelian.cirjson.PrettyPrinter;
import com.arakelian.cirjson.SerializableString;
import com.arakelian.cirjson.StreamWriteFeature;
import com.arakelian.cirjson.io.CharacterEscapes;
import com.arakelian.cirjson.io.IOContext;

/**
 * Generator that encodes characters as UTF-8 into an {@link OutputStream}.
 */
public class UTF8CirJsonGenerator extends CirJsonGeneratorBase {
    protected final OutputStream out;

    protected byte[] outputBuffer;

    protected int outputTail;

    protected final int outputEnd;

    /** High surrogate waiting for its low half, or 0 **/
    private char pendingHighSurrogate;

    public UTF8CirJsonGenerator(
            final ObjectWriteContext writeCtxt,
            final IOContext ioContext,
            final int streamWriteFeatures,
            final int formatWriteFeatures,
            final OutputStream out,
            final PrettyPrinter prettyPrinter,
            final SerializableString rootValueSeparator,
            final CharacterEscapes characterEscapes) {
        super(writeCtxt, ioContext, streamWriteFeatures, formatWriteFeatures, prettyPrinter, rootValueSeparator,
                characterEscapes);
        this.out = out;
        this.outputBuffer = ioContext.allocWriteEncodingBuffer();
        this.outputEnd = outputBuffer.length;
    }

    @Override
    public int getOutputBuffered() {
        return outputTail;
    }

    @Override
    public Object streamWriteOutputTarget() {
        return out;
    }

    @Override
    public void writeRawUTF8String(final byte[] buffer, final int offset, final int len) throws IOException {
        verifyOffsets(buffer.length, offset, len);
        final String id = writeContext.isExpectingIdValue()
                ? new String(buffer, offset, len, StandardCharsets.UTF_8)
                : "";
        writeSeparator(verifyStringWrite(id, null, 0, 0));
        emit('"');
        emitBytes(buffer, offset, len);
        emit('"');
    }

    @Override
    protected void closeOutput(final boolean closeTarget) throws IOException {
        if (out == null) {
            return;
        }
        try {
            if (closeTarget) {
                out.close();
            } else if (isEnabled(StreamWriteFeature.FLUSH_PASSED_TO_STREAM)) {
                out.flush();
            }
        } catch (final IOException e) {
            throw wrapIOFailure(e);
        }
    }

    @Override
    protected void emit(final char c) throws IOException {
        if (pendingHighSurrogate != 0) {
            if (!Character.isLowSurrogate(c)) {
                reportError(
                        "Broken surrogate pair: first char 0x" + Integer.toHexString(pendingHighSurrogate)
                                + ", second 0x" + Integer.toHexString(c));
            }
            final int cp = Character.toCodePoint(pendingHighSurrogate, c);
            pendingHighSurrogate = 0;
            ensureRoom(4);
            outputBuffer[outputTail++] = (byte) (0xF0 | cp >> 18);
            outputBuffer[outputTail++] = (byte) (0x80 | cp >> 12 & 0x3F);
            outputBuffer[outputTail++] = (byte) (0x80 | cp >> 6 & 0x3F);
            outputBuffer[outputTail++] = (byte) (0x80 | cp & 0x3F);
            return;
        }
        if (c < 0x80) {
            ensureRoom(1);
            outputBuffer[outputTail++] = (byte) c;
        } else if (c < 0x800) {
            ensureRoom(2);
            outputBuffer[outputTail++] = (byte) (0xC0 | c >> 6);
            outputBuffer[outputTail++] = (byte) (0x80 | c & 0x3F);
        } else if (Character.isHighSurrogate(c)) {
            pendingHighSurrogate = c;
        } else if (Character.isLowSurrogate(c)) {
            reportError("Broken surrogate pair: second part 0x" + Integer.toHexString(c) + " without first");
        } else {
            ensureRoom(3);
            outputBuffer[outputTail++] = (byte) (0xE0 | c >> 12);
            outputBuffer[outputTail++] = (byte) (0x80 | c >> 6 & 0x3F);
            outputBuffer[outputTail++] = (byte) (0x80 | c & 0x3F);
        }
    }

    @Override
    protected void emit(final char[] text, final int offset, final int len) throws IOException {
        for (int i = offset, end = offset + len; i < end; i++) {
            final char c = text[i];
            if (c < 0x80 && pendingHighSurrogate == 0 && outputTail < outputEnd) {
                outputBuffer[outputTail++] = (byte) c;
            } else {
                emit(c);
            }
        }
    }

    @Override
    protected void emit(final String text, final int offset, final int len) throws IOException {
        for (int i = offset, end = offset + len; i < end; i++) {
            final char c = text.charAt(i);
            if (c < 0x80 && pendingHighSurrogate == 0 && outputTail < outputEnd) {
                outputBuffer[outputTail++] = (byte) c;
            } else {
                emit(c);
            }
        }
    }

    @Override
    protected void flushBuffer() throws IOException {
        if (outputTail > 0 && out != null) {
            final int len = outputTail;
            outputTail = 0;
            try {
                out.write(outputBuffer, 0, len);
            } catch (final IOException e) {
                throw wrapIOFailure(e);
            }
        }
    }

    @Override
    protected void flushOutput() throws IOException {
        if (out != null) {
            try {
                out.flush();
            } catch (final IOException e) {
                throw wrapIOFailure(e);
            }
        }
    }

    @Override
    protected void releaseBuffers() {
        final byte[] buf = outputBuffer;
        if (buf != null) {
            outputBuffer = null;
            ioContext.releaseWriteEncodingBuffer(buf);
        }
    }

    private void emitBytes(final byte[] bytes, int offset, int len) throws IOException {
        while (len > 0) {
            final int room = outputEnd - outputTail;
            if (room == 0) {
                flushBuffer();
                continue;
            }
            final int n = Math.min(room, len);
            System.arraycopy(bytes, offset, outputBuffer, outputTail, n);
            outputTail += n;
            offset += n;
            len -= n;
        }
    }

    private void ensureRoom(final int bytes) throws IOException {
        if (outputTail + bytes > outputEnd) {
            flushBuffer();
        }
    }
}
