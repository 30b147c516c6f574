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

import java.io.CharConversionException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

/**
 * Decoder for UTF-32 (UCS-4) input in either byte order. Code points above the Basic Multilingual
 * Plane are returned as surrogate pairs.
 */
public class UTF32Reader extends Reader {
    /** Largest valid Unicode code point **/
    private static final int LAST_VALID_UNICODE_CHAR = 0x10FFFF;

    private static final char NO_CHAR = (char) 0;

    private final IOContext context;

    private InputStream in;

    private final boolean autoClose;

    private byte[] buffer;

    private int ptr;

    private int length;

    private final boolean bigEndian;

    private final boolean managedBuffers;

    /** Low surrogate pending from the previous read, or {@link #NO_CHAR} **/
    private char surrogate = NO_CHAR;

    /** Chars returned so far, for error messages **/
    private int charCount;

    /** Bytes consumed before the current buffer, for error messages **/
    private int byteCount;

    private char[] tmpBuffer;

    public UTF32Reader(
            final IOContext context,
            final InputStream in,
            final boolean autoClose,
            final byte[] buffer,
            final int ptr,
            final int length,
            final boolean bigEndian) {
        this.context = context;
        this.in = in;
        this.autoClose = autoClose;
        this.buffer = buffer;
        this.ptr = ptr;
        this.length = length;
        this.bigEndian = bigEndian;
        this.managedBuffers = in != null;
    }

    @Override
    public void close() throws IOException {
        final InputStream input = in;
        if (input != null) {
            in = null;
            if (autoClose) {
                input.close();
            }
        }
        freeBuffers();
    }

    private void freeBuffers() {
        final byte[] buf = buffer;
        if (buf != null) {
            buffer = null;
            if (context != null && managedBuffers) {
                context.releaseReadIOBuffer(buf);
            }
        }
    }

    /**
     * Makes at least 4 bytes available in the buffer.
     *
     * @param available
     *            number of unread bytes in the buffer
     * @return false on clean end of input
     */
    private boolean loadMore(final int available) throws IOException {
        if (in == null || buffer == null) {
            return false;
        }
        byteCount += length - available;

        if (available > 0) {
            if (ptr > 0) {
                System.arraycopy(buffer, ptr, buffer, 0, available);
                ptr = 0;
            }
            length = available;
        } else {
            ptr = 0;
            final int count = in.read(buffer);
            if (count < 1) {
                length = 0;
                if (count < 0) {
                    if (managedBuffers) {
                        freeBuffers();
                    }
                    return false;
                }
                throw new IOException("Strange I/O stream, returned 0 bytes on read");
            }
            length = count;
        }

        while (length < 4) {
            final int count = in.read(buffer, length, buffer.length - length);
            if (count < 1) {
                if (count < 0) {
                    final int got = length;
                    if (managedBuffers) {
                        freeBuffers();
                    }
                    throw new CharConversionException("Unexpected EOF in the middle of a 4-byte UTF-32 char: got "
                            + got + ", needed 4, at char #" + charCount + ", byte #" + (byteCount + got) + ")");
                }
                throw new IOException("Strange I/O stream, returned 0 bytes on read");
            }
            length += count;
        }
        return true;
    }

    @Override
    public int read() throws IOException {
        if (tmpBuffer == null) {
            tmpBuffer = new char[1];
        }
        if (read(tmpBuffer, 0, 1) < 1) {
            return -1;
        }
        return tmpBuffer[0];
    }

    @Override
    public int read(final char[] cbuf, final int start, int len) throws IOException {
        if (buffer == null) {
            return -1;
        }
        if (len < 1) {
            return len;
        }
        if (start < 0 || start + len > cbuf.length) {
            throw new IndexOutOfBoundsException(
                    "read(buf," + start + "," + len + "), cbuf[" + cbuf.length + "]");
        }

        int outPtr = start;
        final int outEnd = len + start;

        if (surrogate != NO_CHAR) {
            cbuf[outPtr++] = surrogate;
            surrogate = NO_CHAR;
        } else {
            final int left = length - ptr;
            if (left < 4) {
                if (!loadMore(left)) {
                    if (left == 0) {
                        return -1;
                    }
                    throw new CharConversionException("Unexpected EOF in the middle of a 4-byte UTF-32 char: got "
                            + left + ", needed 4, at char #" + charCount + ", byte #" + (byteCount + left) + ")");
                }
            }
        }

        final int lastValidInputStart = length - 4;
        while (outPtr < outEnd) {
            final int p = ptr;
            if (p > lastValidInputStart) {
                break;
            }
            int hi;
            int lo;
            if (bigEndian) {
                hi = buffer[p] << 8 | buffer[p + 1] & 0xFF;
                lo = (buffer[p + 2] & 0xFF) << 8 | buffer[p + 3] & 0xFF;
            } else {
                lo = buffer[p] & 0xFF | (buffer[p + 1] & 0xFF) << 8;
                hi = buffer[p + 2] & 0xFF | buffer[p + 3] << 8;
            }
            ptr += 4;

            if (hi != 0) {
                hi &= 0xFFFF;
                int ch = (hi - 1) << 16 | lo;
                if (hi > 0x10) {
                    throw new CharConversionException("Invalid UTF-32 character 0x"
                            + Integer.toHexString(ch + 0x10000) + " (above 0x"
                            + Integer.toHexString(LAST_VALID_UNICODE_CHAR)
                            + ") at char #" + (charCount + outPtr - start) + ", byte #" + (byteCount + ptr - 1) + ")");
                }
                cbuf[outPtr++] = (char) (0xD800 + (ch >> 10));
                ch = 0xDC00 | ch & 0x03FF;
                if (outPtr >= outEnd) {
                    surrogate = (char) ch;
                    break;
                }
                lo = ch;
            }
            cbuf[outPtr++] = (char) lo;
        }

        final int actualLen = outPtr - start;
        charCount += actualLen;
        return actualLen;
    }
}
