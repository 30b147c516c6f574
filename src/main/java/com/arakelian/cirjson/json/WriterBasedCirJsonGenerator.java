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
import java.io.Writer;

import com.arakelian.cirjson.ObjectWriteContext;
import com.arakelian.cirjson.PrettyPrinter;
import com.arakelian.cirjson.SerializableString;
import com.arakelian.cirjson.StreamWriteFeature;
import com.arakelian.cirjson.io.CharacterEscapes;
import com.arakelian.cirjson.io.IOContext;

/**
 * Generator that writes characters to a {@link Writer} through a recycled buffer.
 */
public class WriterBasedCirJsonGenerator extends CirJsonGeneratorBase {
    protected final Writer writer;

    protected char[] outputBuffer;

    protected int outputTail;

    protected final int outputEnd;

    public WriterBasedCirJsonGenerator(
            final ObjectWriteContext writeCtxt,
            final IOContext ioContext,
            final int streamWriteFeatures,
            final int formatWriteFeatures,
            final Writer writer,
            final PrettyPrinter prettyPrinter,
            final SerializableString rootValueSeparator,
            final CharacterEscapes characterEscapes) {
        super(writeCtxt, ioContext, streamWriteFeatures, formatWriteFeatures, prettyPrinter, rootValueSeparator,
                characterEscapes);
        this.writer = writer;
        this.outputBuffer = ioContext.allocConcatBuffer();
        this.outputEnd = outputBuffer.length;
    }

    @Override
    public int getOutputBuffered() {
        return outputTail;
    }

    @Override
    public Object streamWriteOutputTarget() {
        return writer;
    }

    @Override
    protected void closeOutput(final boolean closeTarget) throws IOException {
        if (writer == null) {
            return;
        }
        try {
            if (closeTarget) {
                writer.close();
            } else if (isEnabled(StreamWriteFeature.FLUSH_PASSED_TO_STREAM)) {
                writer.flush();
            }
        } catch (final IOException e) {
            throw wrapIOFailure(e);
        }
    }

    @Override
    protected void emit(final char c) throws IOException {
        if (outputTail >= outputEnd) {
            flushBuffer();
        }
        outputBuffer[outputTail++] = c;
    }

    @Override
    protected void emit(final char[] text, int offset, int len) throws IOException {
        while (len > 0) {
            final int room = outputEnd - outputTail;
            if (room == 0) {
                flushBuffer();
                continue;
            }
            final int n = Math.min(room, len);
            System.arraycopy(text, offset, outputBuffer, outputTail, n);
            outputTail += n;
            offset += n;
            len -= n;
        }
    }

    @Override
    protected void emit(final String text, int offset, int len) throws IOException {
        while (len > 0) {
            final int room = outputEnd - outputTail;
            if (room == 0) {
                flushBuffer();
                continue;
            }
            final int n = Math.min(room, len);
            text.getChars(offset, offset + n, outputBuffer, outputTail);
            outputTail += n;
            offset += n;
            len -= n;
        }
    }

    @Override
    protected void flushBuffer() throws IOException {
        if (outputTail > 0 && writer != null) {
            final int len = outputTail;
            outputTail = 0;
            try {
                writer.write(outputBuffer, 0, len);
            } catch (final IOException e) {
                throw wrapIOFailure(e);
            }
        }
    }

    @Override
    protected void flushOutput() throws IOException {
        if (writer != null) {
            try {
                writer.flush();
            } catch (final IOException e) {
                throw wrapIOFailure(e);
            }
        }
    }

    @Override
    protected void releaseBuffers() {
        final char[] buf = outputBuffer;
        if (buf != null) {
            outputBuffer = null;
            ioContext.releaseConcatBuffer(buf);
        }
    }
}
