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

import java.util.Arrays;

/**
 * Character classification tables shared by parsers and generators.
 */
public final class CharTypes {
    /** Output escape code meaning "use a <code>\\uXXXX</code> escape" **/
    public static final int ESCAPE_STANDARD = -1;

    private static final char[] HEX_CHARS = "0123456789ABCDEF".toCharArray();

    private static final char[] HEX_CHARS_LOWER = "0123456789abcdef".toCharArray();

    /** 0 for plain characters, 1 for quote and backslash, -1 for control characters **/
    private static final int[] INPUT_CODES = new int[256];

    /** Like {@link #INPUT_CODES} plus UTF-8 sequence length (2-4) for lead bytes, -1 for bad bytes **/
    private static final int[] INPUT_CODES_UTF8;

    /** 0 for characters allowed in unquoted property names, -1 otherwise **/
    private static final int[] INPUT_CODES_JS_NAMES = new int[256];

    /** Like {@link #INPUT_CODES_JS_NAMES} but accepting every high-bit byte **/
    private static final int[] INPUT_CODES_UTF8_JS_NAMES;

    /** Escapes for the first 128 code points, forward slash left alone **/
    private static final int[] OUTPUT_ESCAPES_NO_SLASH = new int[128];

    private static final int[] OUTPUT_ESCAPES_WITH_SLASH;

    private static final int[] HEX_VALUES = new int[256];

    static {
        for (int i = 0; i < 32; i++) {
            INPUT_CODES[i] = -1;
        }
        INPUT_CODES['"'] = 1;
        INPUT_CODES['\\'] = 1;

        INPUT_CODES_UTF8 = Arrays.copyOf(INPUT_CODES, 256);
        for (int c = 128; c < 256; c++) {
            final int code;
            if ((c & 0xE0) == 0xC0) {
                code = 2;
            } else if ((c & 0xF0) == 0xE0) {
                code = 3;
            } else if ((c & 0xF8) == 0xF0) {
                code = 4;
            } else {
                code = -1;
            }
            INPUT_CODES_UTF8[c] = code;
        }

        Arrays.fill(INPUT_CODES_JS_NAMES, -1);
        for (int i = 33; i < 256; i++) {
            if (Character.isJavaIdentifierPart((char) i)) {
                INPUT_CODES_JS_NAMES[i] = 0;
            }
        }
        INPUT_CODES_JS_NAMES['@'] = 0;
        INPUT_CODES_JS_NAMES['#'] = 0;
        INPUT_CODES_JS_NAMES['*'] = 0;
        INPUT_CODES_JS_NAMES['-'] = 0;
        INPUT_CODES_JS_NAMES['+'] = 0;

        INPUT_CODES_UTF8_JS_NAMES = Arrays.copyOf(INPUT_CODES_JS_NAMES, 256);
        Arrays.fill(INPUT_CODES_UTF8_JS_NAMES, 128, 256, 0);

        for (int i = 0; i < 32; i++) {
            OUTPUT_ESCAPES_NO_SLASH[i] = ESCAPE_STANDARD;
        }
        OUTPUT_ESCAPES_NO_SLASH['"'] = '"';
        OUTPUT_ESCAPES_NO_SLASH['\\'] = '\\';
        OUTPUT_ESCAPES_NO_SLASH['\b'] = 'b';
        OUTPUT_ESCAPES_NO_SLASH['\t'] = 't';
        OUTPUT_ESCAPES_NO_SLASH['\f'] = 'f';
        OUTPUT_ESCAPES_NO_SLASH['\n'] = 'n';
        OUTPUT_ESCAPES_NO_SLASH['\r'] = 'r';

        OUTPUT_ESCAPES_WITH_SLASH = Arrays.copyOf(OUTPUT_ESCAPES_NO_SLASH, 128);
        OUTPUT_ESCAPES_WITH_SLASH['/'] = '/';

        Arrays.fill(HEX_VALUES, -1);
        for (int i = 0; i < 10; i++) {
            HEX_VALUES['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            HEX_VALUES['a' + i] = 10 + i;
            HEX_VALUES['A' + i] = 10 + i;
        }
    }

    /**
     * Appends the given text to a buffer with the minimum escaping a CirJSON string requires.
     *
     * @param sb
     *            buffer to append to
     * @param content
     *            unescaped text
     */
    public static void appendQuoted(final StringBuilder sb, final String content) {
        final int[] escCodes = OUTPUT_ESCAPES_WITH_SLASH;
        final int escLen = escCodes.length;
        for (int i = 0, len = content.length(); i < len; i++) {
            final char c = content.charAt(i);
            if (c >= escLen || escCodes[c] == 0) {
                sb.append(c);
                continue;
            }
            sb.append('\\');
            final int escCode = escCodes[c];
            if (escCode > 0) {
                sb.append((char) escCode);
            } else {
                sb.append("u00").append(HEX_CHARS[c >> 4]).append(HEX_CHARS[c & 0xF]);
            }
        }
    }

    /**
     * Returns the value of a hex digit.
     *
     * @param ch
     *            character to decode
     * @return value 0-15, or -1 if not a hex digit
     */
    public static int charToHex(final int ch) {
        return ch > 255 || ch < 0 ? -1 : HEX_VALUES[ch];
    }

    public static char[] copyHexChars(final boolean uppercase) {
        return (uppercase ? HEX_CHARS : HEX_CHARS_LOWER).clone();
    }

    public static int[] getInputCodeLatin1() {
        return INPUT_CODES;
    }

    public static int[] getInputCodeLatin1JsNames() {
        return INPUT_CODES_JS_NAMES;
    }

    public static int[] getInputCodeUtf8() {
        return INPUT_CODES_UTF8;
    }

    public static int[] getInputCodeUtf8JsNames() {
        return INPUT_CODES_UTF8_JS_NAMES;
    }

    /**
     * Returns the read-only escape table for the first 128 code points. A value of 0 means no
     * escaping, a positive value is the character to put after the backslash and
     * {@link #ESCAPE_STANDARD} means a <code>\\uXXXX</code> escape.
     *
     * @param escapeSlash
     *            true to escape forward slashes
     * @return 128-entry escape table
     */
    public static int[] getSevenBitOutputEscapes(final boolean escapeSlash) {
        return escapeSlash ? OUTPUT_ESCAPES_WITH_SLASH : OUTPUT_ESCAPES_NO_SLASH;
    }

    public static char hexToChar(final int value) {
        return HEX_CHARS[value];
    }

    private CharTypes() {
        // utility class
    }
}
