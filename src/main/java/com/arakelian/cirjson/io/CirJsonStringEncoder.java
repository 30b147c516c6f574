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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Escapes text for use inside CirJSON string literals, as chars or as UTF-8 bytes.
 */
public final class CirJsonStringEncoder {
    /**
     * Returns the UTF-8 encoding of the given text, with no escaping. Unpaired surrogates are
     * replaced with <code>?</code>.
     *
     * @param text
     *            text to encode
     * @return UTF-8 bytes
     */
    public static byte[] encodeAsUTF8(final CharSequence text) {
        return text.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns the escaped form of the given text, without surrounding quotes.
     *
     * @param text
     *            text to escape
     * @return escaped characters
     */
    public static char[] quoteAsChars(final CharSequence text) {
        final String s = text.toString();
        final int[] escCodes = CharTypes.getSevenBitOutputEscapes(false);
        // most text needs no escaping at all
        int i = 0;
        final int len = s.length();
        while (i < len) {
            final char c = s.charAt(i);
            if (c < 128 && escCodes[c] != 0) {
                break;
            }
            ++i;
        }
        if (i == len) {
            return s.toCharArray();
        }
        final StringBuilder sb = new StringBuilder(len + 16);
        sb.append(s, 0, i);
        for (; i < len; i++) {
            final char c = s.charAt(i);
            if (c >= 128 || escCodes[c] == 0) {
                sb.append(c);
                continue;
            }
            appendEscape(sb, c, escCodes[c]);
        }
        final char[] result = new char[sb.length()];
        sb.getChars(0, result.length, result, 0);
        return result;
    }

    /**
     * Returns the escaped form of the given text as UTF-8 bytes, without surrounding quotes.
     *
     * @param text
     *            text to escape
     * @return escaped UTF-8 bytes
     */
    public static byte[] quoteAsUTF8(final CharSequence text) {
        final String s = text.toString();
        final int[] escCodes = CharTypes.getSevenBitOutputEscapes(false);
        final ByteArrayOutputStream out = new ByteArrayOutputStream(s.length() + 16);
        final StringBuilder esc = new StringBuilder(6);
        int start = 0;
        for (int i = 0, len = s.length(); i < len; i++) {
            final char c = s.charAt(i);
            if (c >= 128 || escCodes[c] == 0) {
                continue;
            }
            if (i > start) {
                final byte[] chunk = s.substring(start, i).getBytes(StandardCharsets.UTF_8);
                out.write(chunk, 0, chunk.length);
            }
            esc.setLength(0);
            appendEscape(esc, c, escCodes[c]);
            for (int j = 0; j < esc.length(); j++) {
                out.write(esc.charAt(j));
            }
            start = i + 1;
        }
        if (start < s.length()) {
            final byte[] chunk = s.substring(start).getBytes(StandardCharsets.UTF_8);
            out.write(chunk, 0, chunk.length);
        }
        return out.toByteArray();
    }

    private static void appendEscape(final StringBuilder sb, final char c, final int escCode) {
        sb.append('\\');
        if (escCode > 0) {
            sb.append((char) escCode);
        } else {
            sb.append("u00").append(CharTypes.hexToChar(c >> 4)).append(CharTypes.hexToChar(c & 0xF));
        }
    }

    private CirJsonStringEncoder() {
        // utility class
    }
}
