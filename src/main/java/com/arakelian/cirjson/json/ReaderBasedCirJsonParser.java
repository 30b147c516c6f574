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
import java.io.Reader;

import com.arakelian.cirjson.ObjectReadContext;
import com.arakelian.cirjson.StreamReadFeature;
import com.arakelian.cirjson.io.IOContext;
import com.arakelian.cirjson.sym.CharsToNameCanonicalizer;

/**
 * Parser over character input: a {@link Reader}, or a char array or String held entirely in
 * memory.
 */
public class ReaderBasedCirJsonParser extends CirJsonParserBase {
    protected Reader reader;

    protected char[] inputBuffer;

    /** True if {@link #inputBuffer} came from the buffer recycler and must be returned to it **/
    protected boolean bufferRecyclable;

    protected final CharsToNameCanonicalizer symbols;

    public ReaderBasedCirJsonParser(
            final ObjectReadContext readCtxt,
            final IOContext ioContext,
            final int streamReadFeatures,
            final int formatReadFeatures,
            final Reader reader,
            final CharsToNameCanonicalizer symbols) {
        super(readCtxt, ioContext, streamReadFeatures, formatReadFeatures);
        this.reader = reader;
        this.symbols = symbols;
        this.inputBuffer = ioContext.allocTokenBuffer();
        this.bufferRecyclable = true;
        this.inputPtr = 0;
        this.inputEnd = 0;
    }

    public ReaderBasedCirJsonParser(
            final ObjectReadContext readCtxt,
            final IOContext ioContext,
            final int streamReadFeatures,
            final int formatReadFeatures,
            final CharsToNameCanonicalizer symbols,
            final char[] inputBuffer,
            final int start,
            final int end) {
        super(readCtxt, ioContext, streamReadFeatures, formatReadFeatures);
        this.reader = null;
        this.symbols = symbols;
        this.inputBuffer = inputBuffer;
        this.bufferRecyclable = false;
        this.inputPtr = start;
        this.inputEnd = end;
        this.currInputProcessed = -start;
        this.currInputRowStart = 0;
    }

    @Override
    protected String canonicalizeName() throws IOException {
        final char[] buf = textBuffer.getTextBuffer();
        final int start = textBuffer.getTextOffset();
        final int len = textBuffer.size();
        return symbols.findSymbol(buf, start, len, symbols.calcHash(buf, start, len));
    }

    @Override
    protected void closeInput() throws IOException {
        if (reader != null) {
            if (ioContext.isResourceManaged() || isEnabled(StreamReadFeature.AUTO_CLOSE_SOURCE)) {
                reader.close();
            }
            reader = null;
        }
    }

    private String errEscape(final int a, int b) {
        b = Math.min(b, inputEnd);
        if (a >= b) {
            return "";
        }
        return new String(inputBuffer, a, b - a).replaceAll("\\s+", " ");
    }

    @Override
    protected String getErrorContext() {
        if (inputBuffer == null) {
            return "";
        }
        final int start = Math.max(inputPtr - 1, 0);
        String context = " BEFORE='" + errEscape(Math.max(start - 60, 0), start + 1) + "'";
        if (start < inputEnd) {
            context += " AFTER='" + errEscape(start + 1, start + 40) + "'";
        }
        return context;
    }

    protected boolean loadMore() throws IOException {
        if (reader == null) {
            return false;
        }
        currInputProcessed += inputEnd;
        inputPtr = 0;
        inputEnd = 0;
        for (;;) {
            final int count = reader.read(inputBuffer, 0, inputBuffer.length);
            if (count > 0) {
                inputEnd = count;
                if (streamReadConstraints.hasMaxDocumentLength()) {
                    streamReadConstraints.validateDocumentLength(currInputProcessed + inputEnd);
                }
                return true;
            }
            if (count < 0) {
                return false;
            }
        }
    }

    @Override
    protected int readRaw() throws IOException {
        if (inputPtr >= inputEnd && !loadMore()) {
            return -1;
        }
        return inputBuffer[inputPtr++];
    }

    @Override
    protected void releaseBuffers() throws IOException {
        super.releaseBuffers();
        symbols.release();
        if (bufferRecyclable) {
            final char[] buf = inputBuffer;
            if (buf != null) {
                inputBuffer = null;
                ioContext.releaseTokenBuffer(buf);
            }
        }
    }
}
