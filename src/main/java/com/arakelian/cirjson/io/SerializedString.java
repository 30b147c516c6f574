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
import java.io.OutputStream;

import com.arakelian.cirjson.SerializableString;
import com.google.common.base.Preconditions;

/**
 * {@link SerializableString} that lazily computes and caches its escaped and encoded forms. Safe
 * to share between threads; at worst a form is computed more than once.
 */
public class SerializedString implements SerializableString {
    private final String value;

    private volatile byte[] quotedUTF8;

    private volatile byte[] unquotedUTF8;

    private volatile char[] quotedChars;

    public SerializedString(final String value) {
        Preconditions.checkArgument(value != null, "value must be non-null");
        this.value = value;
    }

    @Override
    public int appendQuoted(final char[] buffer, final int offset) {
        final char[] result = asQuotedChars();
        return copy(result, buffer, offset);
    }

    @Override
    public int appendQuotedUTF8(final byte[] buffer, final int offset) {
        final byte[] result = asQuotedUTF8();
        final int len = result.length;
        if (offset + len > buffer.length) {
            return -1;
        }
        System.arraycopy(result, 0, buffer, offset, len);
        return len;
    }

    @Override
    public int appendUnquoted(final char[] buffer, final int offset) {
        final int len = value.length();
        if (offset + len > buffer.length) {
            return -1;
        }
        value.getChars(0, len, buffer, offset);
        return len;
    }

    @Override
    public int appendUnquotedUTF8(final byte[] buffer, final int offset) {
        final byte[] result = asUnquotedUTF8();
        final int len = result.length;
        if (offset + len > buffer.length) {
            return -1;
        }
        System.arraycopy(result, 0, buffer, offset, len);
        return len;
    }

    @Override
    public final char[] asQuotedChars() {
        char[] result = quotedChars;
        if (result == null) {
            quotedChars = result = CirJsonStringEncoder.quoteAsChars(value);
        }
        return result;
    }

    @Override
    public final byte[] asQuotedUTF8() {
        byte[] result = quotedUTF8;
        if (result == null) {
            quotedUTF8 = result = CirJsonStringEncoder.quoteAsUTF8(value);
        }
        return result;
    }

    @Override
    public final byte[] asUnquotedUTF8() {
        byte[] result = unquotedUTF8;
        if (result == null) {
            unquotedUTF8 = result = CirJsonStringEncoder.encodeAsUTF8(value);
        }
        return result;
    }

    @Override
    public final int charLength() {
        return value.length();
    }

    private int copy(final char[] src, final char[] buffer, final int offset) {
        final int len = src.length;
        if (offset + len > buffer.length) {
            return -1;
        }
        System.arraycopy(src, 0, buffer, offset, len);
        return len;
    }

    @Override
    public boolean equals(final Object o) {
        if (o == this) {
            return true;
        }
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        return value.equals(((SerializedString) o).value);
    }

    @Override
    public final String getValue() {
        return value;
    }

    @Override
    public final int hashCode() {
        return value.hashCode();
    }

    @Override
    public final String toString() {
        return value;
    }

    @Override
    public int writeQuotedUTF8(final OutputStream out) throws IOException {
        final byte[] result = asQuotedUTF8();
        out.write(result);
        return result.length;
    }

    @Override
    public int writeUnquotedUTF8(final OutputStream out) throws IOException {
        final byte[] result = asUnquotedUTF8();
        out.write(result);
        return result.length;
    }
}
