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
import java.io.InputStream;
import java.util.Arrays;

import com.arakelian.cirjson.CirJsonLocation;
import com.arakelian.cirjson.CirJsonToken;
import com.arakelian.cirjson.ObjectReadContext;
import com.arakelian.cirjson.StreamReadFeature;
import com.arakelian.cirjson.exc.CirJsonIOException;
import com.arakelian.cirjson.io.IOContext;
import com.arakelian.cirjson.sym.ByteQuadsCanonicalizer;
import com.arakelian.cirjson.sym.PropertyNameMatcher;

/**
 * Parser over UTF-8 encoded bytes from an {@link InputStream} or a byte array. Property names are
 * looked up by their UTF-8 quads, so known names are matched without building a String.
 */
public class UTF8StreamCirJsonParser extends CirJsonParserBase {
    protected InputStream inputStream;

    protected byte[] inputBuffer;

    /** True if {@link #inputBuffer} came from the buffer recycler and must be returned to it **/
    protected boolean bufferRecyclable;

    protected final ByteQuadsCanonicalizer symbols;

    /** Low half of a surrogate pair decoded from a 4-byte sequence, or -1 **/
    protected int pendingLowSurrogate = -1;

    /** Quads of the current property name **/
    protected int[] quadBuffer = new int[16];

    protected int quadLen;

    public UTF8StreamCirJsonParser(
            final ObjectReadContext readCtxt,
            final IOContext ioContext,
            final int streamReadFeatures,
            final int formatReadFeatures,
            final InputStream in,
            final ByteQuadsCanonicalizer symbols,
            final byte[] inputBuffer,
            final int start,
            final int end,
            final int bytesPreProcessed,
            final boolean bufferRecyclable) {
        super(readCtxt, ioContext, streamReadFeatures, formatReadFeatures);
        this.inputStream = in;
        this.symbols = symbols;
        this.inputBuffer = inputBuffer;
        this.inputPtr = start;
        this.inputEnd = end;
        this.bufferRecyclable = bufferRecyclable;
        this.currInputProcessed = -start + bytesPreProcessed;
        this.currInputRowStart = 0;
    }

    private void addQuadByte(final int b, final int[] state) {
        int q = state[0] << 8 | b;
        if (++state[1] == 4) {
            appendQuad(q);
            q = 0;
            state[1] = 0;
        }
        state[0] = q;
    }

    private void appendQuad(final int q) {
        if (quadLen >= quadBuffer.length) {
            quadBuffer = Arrays.copyOf(quadBuffer, quadBuffer.length << 1);
        }
        quadBuffer[quadLen++] = q;
    }

    /**
     * Packs the UTF-8 encoding of the name in the text buffer into {@link #quadBuffer}.
     */
    private void buildQuads(final char[] buf, final int start, final int len) {
        quadLen = 0;
        final int[] state = new int[2];
        for (int i = start, end = start + len; i < end; i++) {
            int c = buf[i];
            if (c < 0x80) {
                addQuadByte(c, state);
                continue;
            }
            if (c < 0x800) {
                addQuadByte(0xC0 | c >> 6, state);
            } else {
                if (Character.isHighSurrogate((char) c) && i + 1 < end && Character.isLowSurrogate(buf[i + 1])) {
                    c = Character.toCodePoint((char) c, buf[++i]);
                    addQuadByte(0xF0 | c >> 18, state);
                    addQuadByte(0x80 | c >> 12 & 0x3F, state);
                } else {
                    addQuadByte(0xE0 | c >> 12, state);
                }
                addQuadByte(0x80 | c >> 6 & 0x3F, state);
            }
            addQuadByte(0x80 | c & 0x3F, state);
        }
        if (state[1] > 0) {
            appendQuad(ByteQuadsCanonicalizer.pad(state[0], state[1]));
        }
    }

    @Override
    protected String canonicalizeName() throws IOException {
        final char[] buf = textBuffer.getTextBuffer();
        final int start = textBuffer.getTextOffset();
        final int len = textBuffer.size();
        buildQuads(buf, start, len);
        if (quadLen == 0) {
            return "";
        }
        final String found = findName();
        if (found != null) {
            return found;
        }
        final String name = new String(buf, start, len);
        return symbols.addName(name, quadBuffer, quadLen);
    }

    @Override
    protected void closeInput() throws IOException {
        if (inputStream != null) {
            if (ioContext.isResourceManaged() || isEnabled(StreamReadFeature.AUTO_CLOSE_SOURCE)) {
                inputStream.close();
            }
            inputStream = null;
        }
    }

    @Override
    protected CirJsonLocation createLocation(final long offset, final int row, final int col) {
        return new CirJsonLocation(contentReference(), offset, -1L, row, col);
    }

    @Override
    public int currentNameMatch(final PropertyNameMatcher matcher) throws IOException {
        if ((currToken == CirJsonToken.PROPERTY_NAME || currToken == CirJsonToken.CIRJSON_ID_PROPERTY_NAME)
                && matcher.supportsQuadMatching() && quadLen > 0) {
            switch (quadLen) {
            case 1:
                return matcher.matchByQuad(quadBuffer[0]);
            case 2:
                return matcher.matchByQuad(quadBuffer[0], quadBuffer[1]);
            case 3:
                return matcher.matchByQuad(quadBuffer[0], quadBuffer[1], quadBuffer[2]);
            default:
                return matcher.matchByQuad(quadBuffer, quadLen);
            }
        }
        return super.currentNameMatch(matcher);
    }

    private String findName() {
        switch (quadLen) {
        case 1:
            return symbols.findName(quadBuffer[0]);
        case 2:
            return symbols.findName(quadBuffer[0], quadBuffer[1]);
        case 3:
            return symbols.findName(quadBuffer[0], quadBuffer[1], quadBuffer[2]);
        default:
            return symbols.findName(quadBuffer, quadLen);
        }
    }

    private boolean loadMore() throws IOException {
        if (inputStream == null) {
            return false;
        }
        final int bufSize = inputBuffer.length;
        if (bufSize == 0) {
            return false;
        }
        currInputProcessed += inputEnd;
        inputPtr = 0;
        inputEnd = 0;
        for (;;) {
            final int count;
            try {
                count = inputStream.read(inputBuffer, 0, bufSize);
            } catch (final IOException e) {
                throw CirJsonIOException.wrap(e);
            }
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

    private int nextByte() throws IOException {
        if (inputPtr >= inputEnd && !loadMore()) {
            reportInvalidEOF(" in a multi-byte UTF-8 character");
        }
        return inputBuffer[inputPtr++];
    }

    @Override
    protected int readRaw() throws IOException {
        if (pendingLowSurrogate >= 0) {
            final int c = pendingLowSurrogate;
            pendingLowSurrogate = -1;
            return c;
        }
        if (inputPtr >= inputEnd && !loadMore()) {
            return -1;
        }
        final int c = inputBuffer[inputPtr++] & 0xFF;
        if (c < 0x80) {
            return c;
        }
        int code;
        final int needed;
        if ((c & 0xE0) == 0xC0) {
            code = c & 0x1F;
            needed = 1;
        } else if ((c & 0xF0) == 0xE0) {
            code = c & 0x0F;
            needed = 2;
        } else if ((c & 0xF8) == 0xF0) {
            code = c & 0x07;
            needed = 3;
        } else {
            reportError("Invalid UTF-8 start byte 0x" + Integer.toHexString(c));
            return -1;
        }
        for (int i = 0; i < needed; i++) {
            final int d = nextByte();
            if ((d & 0xC0) != 0x80) {
                reportError("Invalid UTF-8 middle byte 0x" + Integer.toHexString(d & 0xFF));
            }
            code = code << 6 | d & 0x3F;
        }
        if (needed == 3) {
            if (code > Character.MAX_CODE_POINT) {
                reportError("Invalid UTF-8 code point 0x" + Integer.toHexString(code));
            }
            pendingLowSurrogate = Character.lowSurrogate(code);
            return Character.highSurrogate(code);
        }
        return code;
    }

    @Override
    protected void releaseBuffers() throws IOException {
        super.releaseBuffers();
        symbols.release();
        if (bufferRecyclable) {
            final byte[] buf = inputBuffer;
            if (buf != null) {
                inputBuffer = null;
                ioContext.releaseReadIOBuffer(buf);
            }
        }
    }
}
