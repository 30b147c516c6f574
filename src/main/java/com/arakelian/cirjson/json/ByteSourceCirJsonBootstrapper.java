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

import java.io.ByteArrayInputStream;
import java.io.CharConversionException;
import java.io.DataInput;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.ObjectReadContext;
import com.arakelian.cirjson.StreamReadFeature;
import com.arakelian.cirjson.exc.CirJsonIOException;
import com.arakelian.cirjson.io.CirJsonEncoding;
import com.arakelian.cirjson.io.IOContext;
import com.arakelian.cirjson.io.MergedStream;
import com.arakelian.cirjson.io.UTF32Reader;
import com.arakelian.cirjson.sym.ByteQuadsCanonicalizer;
import com.arakelian.cirjson.sym.CharsToNameCanonicalizer;

/**
 * Determines the encoding of byte input from its first bytes and constructs the matching parser.
 *
 * <p>
 * A byte order mark wins when present. Otherwise the first character of a CirJSON document is
 * ASCII (<code>{</code>, <code>[</code>, a quote, a digit or white space), so its zero bytes give
 * away UTF-16 and UTF-32 along with their byte order. Without any signal the input is UTF-8.
 * </p>
 */
public final class ByteSourceCirJsonBootstrapper {
    private static final Logger LOGGER = LoggerFactory.getLogger(ByteSourceCirJsonBootstrapper.class);

    /**
     * Helper for {@link DataInput} sources that skips a UTF-8 byte order mark without reading
     * ahead.
     *
     * @param input
     *            data input
     * @return first byte after the optional BOM, as an unsigned value, or -1 if the input is empty
     * @throws IOException
     *             if the input cannot be read or starts with a broken BOM
     */
    public static int skipUTF8BOM(final DataInput input) throws IOException {
        try {
            int b;
            try {
                b = input.readUnsignedByte();
            } catch (final EOFException e) {
                return -1;
            }
            if (b != 0xEF) {
                return b;
            }
            b = input.readUnsignedByte();
            if (b != 0xBB) {
                throw new IOException("Unexpected byte 0x" + Integer.toHexString(b)
                        + " following 0xEF; should get 0xBB as part of UTF-8 BOM");
            }
            b = input.readUnsignedByte();
            if (b != 0xBF) {
                throw new IOException("Unexpected byte 0x" + Integer.toHexString(b)
                        + " following 0xEF 0xBB; should get 0xBF as part of UTF-8 BOM");
            }
            return input.readUnsignedByte();
        } catch (final IOException e) {
            throw CirJsonIOException.wrap(e);
        }
    }

    private final IOContext context;

    private final InputStream in;

    private final byte[] inputBuffer;

    private final int inputStart;

    private int inputPtr;

    private int inputEnd;

    /** True if {@link #inputBuffer} was allocated from the context and must be released **/
    private final boolean bufferRecyclable;

    private boolean bigEndian = true;

    private int bytesPerChar;

    public ByteSourceCirJsonBootstrapper(
            final IOContext context,
            final byte[] inputBuffer,
            final int start,
            final int len) {
        this.context = context;
        this.in = null;
        this.inputBuffer = inputBuffer;
        this.inputStart = start;
        this.inputPtr = start;
        this.inputEnd = start + len;
        this.bufferRecyclable = false;
    }

    public ByteSourceCirJsonBootstrapper(final IOContext context, final InputStream in) {
        this.context = context;
        this.in = in;
        this.inputBuffer = context.allocReadIOBuffer();
        this.inputStart = 0;
        this.inputPtr = 0;
        this.inputEnd = 0;
        this.bufferRecyclable = true;
    }

    private boolean checkUTF16(final int i16) {
        if ((i16 & 0xFF00) == 0) {
            bigEndian = true;
        } else if ((i16 & 0x00FF) == 0) {
            bigEndian = false;
        } else {
            return false;
        }
        bytesPerChar = 2;
        return true;
    }

    private boolean checkUTF32(final int quad) throws IOException {
        if (quad >> 8 == 0) {
            // 00 00 00 xx
            bigEndian = true;
        } else if ((quad & 0x00FFFFFF) == 0) {
            // xx 00 00 00
            bigEndian = false;
        } else if ((quad & ~0x00FF0000) == 0) {
            // 00 xx 00 00
            reportWeirdUCS4("3412");
        } else if ((quad & ~0x0000FF00) == 0) {
            // 00 00 xx 00
            reportWeirdUCS4("2143");
        } else {
            return false;
        }
        bytesPerChar = 4;
        return true;
    }

    /**
     * Constructs the parser for the detected encoding: the byte parser for UTF-8, a reader based
     * parser for the other encodings.
     *
     * @param readCtxt
     *            object read context
     * @param streamReadFeatures
     *            stream read features
     * @param formatReadFeatures
     *            CirJSON read features
     * @param rootByteSymbols
     *            root table for UTF-8 names
     * @param rootCharSymbols
     *            root table for char names
     * @return new parser
     * @throws IOException
     *             if the encoding cannot be detected or the input cannot be read
     */
    public CirJsonParser constructParser(
            final ObjectReadContext readCtxt,
            final int streamReadFeatures,
            final int formatReadFeatures,
            final ByteQuadsCanonicalizer rootByteSymbols,
            final CharsToNameCanonicalizer rootCharSymbols) throws IOException {
        final CirJsonEncoding enc = detectEncoding();
        if (enc == CirJsonEncoding.UTF8) {
            return new UTF8StreamCirJsonParser(readCtxt, context, streamReadFeatures, formatReadFeatures, in,
                    rootByteSymbols.makeChild(), inputBuffer, inputPtr, inputEnd, inputPtr - inputStart,
                    bufferRecyclable);
        }
        return new ReaderBasedCirJsonParser(readCtxt, context, streamReadFeatures, formatReadFeatures,
                constructReader(StreamReadFeature.AUTO_CLOSE_SOURCE.enabledIn(streamReadFeatures)),
                rootCharSymbols.makeChild());
    }

    /**
     * Constructs a reader over the remaining input, decoding the encoding found by
     * {@link #detectEncoding()}.
     *
     * @param autoClose
     *            true if closing the reader should close the underlying stream
     * @return reader
     * @throws IOException
     *             if the encoding is not supported
     */
    public Reader constructReader(final boolean autoClose) throws IOException {
        final CirJsonEncoding enc = context.getEncoding();
        switch (enc.bits()) {
        case 8:
        case 16:
            final InputStream input;
            if (in == null) {
                input = new ByteArrayInputStream(inputBuffer, inputPtr, inputEnd - inputPtr);
            } else if (inputPtr < inputEnd) {
                input = new MergedStream(context, in, inputBuffer, inputPtr, inputEnd);
            } else {
                context.releaseReadIOBuffer(inputBuffer);
                input = in;
            }
            return new InputStreamReader(input, enc.getJavaName());
        case 32:
            return new UTF32Reader(context, in, autoClose, inputBuffer, inputPtr, inputEnd, enc.isBigEndian());
        default:
            throw new IllegalStateException("Internal error: unsupported encoding " + enc);
        }
    }

    /**
     * Detects the encoding of the input and skips its byte order mark, if any. The result is also
     * stored in the I/O context.
     *
     * @return detected encoding; {@link CirJsonEncoding#UTF8} when there is no signal
     * @throws IOException
     *             if the input cannot be read or uses an unsupported UCS-4 byte order
     */
    public CirJsonEncoding detectEncoding() throws IOException {
        boolean foundEncoding = false;

        if (ensureLoaded(4)) {
            final int quad = inputBuffer[inputPtr] << 24 //
                    | (inputBuffer[inputPtr + 1] & 0xFF) << 16 //
                    | (inputBuffer[inputPtr + 2] & 0xFF) << 8 //
                    | inputBuffer[inputPtr + 3] & 0xFF;
            if (handleBOM(quad)) {
                foundEncoding = true;
            } else if (checkUTF32(quad)) {
                foundEncoding = true;
            } else if (checkUTF16(quad >>> 16)) {
                foundEncoding = true;
            }
        } else if (ensureLoaded(2)) {
            final int i16 = (inputBuffer[inputPtr] & 0xFF) << 8 | inputBuffer[inputPtr + 1] & 0xFF;
            if (handleBOM16(i16) || checkUTF16(i16)) {
                foundEncoding = true;
            }
        }

        final CirJsonEncoding enc;
        if (!foundEncoding) {
            enc = CirJsonEncoding.UTF8;
        } else {
            switch (bytesPerChar) {
            case 1:
                enc = CirJsonEncoding.UTF8;
                break;
            case 2:
                enc = bigEndian ? CirJsonEncoding.UTF16_BE : CirJsonEncoding.UTF16_LE;
                break;
            case 4:
                enc = bigEndian ? CirJsonEncoding.UTF32_BE : CirJsonEncoding.UTF32_LE;
                break;
            default:
                throw new IllegalStateException("Internal error: " + bytesPerChar + " bytes per char");
            }
        }
        LOGGER.debug("Detected {} input", enc);
        context.setEncoding(enc);
        return enc;
    }

    private boolean ensureLoaded(final int minimum) throws IOException {
        int gotten = inputEnd - inputPtr;
        while (gotten < minimum) {
            if (in == null) {
                return false;
            }
            final int count;
            try {
                count = in.read(inputBuffer, inputEnd, inputBuffer.length - inputEnd);
            } catch (final IOException e) {
                throw CirJsonIOException.wrap(e);
            }
            if (count < 1) {
                return false;
            }
            inputEnd += count;
            gotten += count;
        }
        return true;
    }

    private boolean handleBOM(final int quad) throws IOException {
        switch (quad) {
        case 0x0000FEFF:
            bigEndian = true;
            inputPtr += 4;
            bytesPerChar = 4;
            return true;
        case 0xFFFE0000:
            bigEndian = false;
            inputPtr += 4;
            bytesPerChar = 4;
            return true;
        case 0x0000FFFE:
            reportWeirdUCS4("2143");
            break;
        case 0xFEFF0000:
            reportWeirdUCS4("3412");
            break;
        default:
            break;
        }
        if (handleBOM16(quad >>> 16)) {
            return true;
        }
        if (quad >>> 8 == 0xEFBBBF) {
            inputPtr += 3;
            bytesPerChar = 1;
            bigEndian = true;
            return true;
        }
        return false;
    }

    private boolean handleBOM16(final int i16) {
        if (i16 == 0xFEFF) {
            bigEndian = true;
        } else if (i16 == 0xFFFE) {
            bigEndian = false;
        } else {
            return false;
        }
        inputPtr += 2;
        bytesPerChar = 2;
        return true;
    }

    private void reportWeirdUCS4(final String type) throws IOException {
        throw CirJsonIOException
                .wrap(new CharConversionException("Unsupported UCS-4 endianness (" + type + ") detected"));
    }
}
