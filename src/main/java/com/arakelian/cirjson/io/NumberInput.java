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

import java.math.BigDecimal;
import java.math.BigInteger;

import ch.randelshofer.fastdoubleparser.JavaDoubleParser;
import ch.randelshofer.fastdoubleparser.JavaFloatParser;

/**
 * Number parsing helpers used by parsers. The integer methods that take a char slice expect
 * digits that have already been validated by the tokenizer, with any sign handled by the caller.
 */
public final class NumberInput {
    static final String MIN_LONG_STR_NO_SIGN = String.valueOf(Long.MIN_VALUE).substring(1);

    static final String MAX_LONG_STR = String.valueOf(Long.MAX_VALUE);

    /**
     * Returns true if the given digits, which must be 19 characters long, are within the range
     * of a long.
     *
     * @param ch
     *            characters
     * @param off
     *            offset of first digit
     * @param len
     *            number of digits
     * @param negative
     *            true if the value is negative
     * @return true if the value fits in a long
     */
    public static boolean inLongRange(final char[] ch, final int off, final int len, final boolean negative) {
        final String cmpStr = negative ? MIN_LONG_STR_NO_SIGN : MAX_LONG_STR;
        final int cmpLen = cmpStr.length();
        if (len < cmpLen) {
            return true;
        }
        if (len > cmpLen) {
            return false;
        }
        for (int i = 0; i < cmpLen; ++i) {
            final int diff = ch[off + i] - cmpStr.charAt(i);
            if (diff != 0) {
                return diff < 0;
            }
        }
        return true;
    }

    public static boolean inLongRange(final String s, final boolean negative) {
        final String cmpStr = negative ? MIN_LONG_STR_NO_SIGN : MAX_LONG_STR;
        final int cmpLen = cmpStr.length();
        final int alen = s.length();
        if (alen < cmpLen) {
            return true;
        }
        if (alen > cmpLen) {
            return false;
        }
        for (int i = 0; i < cmpLen; ++i) {
            final int diff = s.charAt(i) - cmpStr.charAt(i);
            if (diff != 0) {
                return diff < 0;
            }
        }
        return true;
    }

    /**
     * Returns true if the string looks like a number acceptable to {@link #parseDouble}. Used when
     * coercing String values.
     *
     * @param s
     *            string to test
     * @return true if it looks like a valid number
     */
    public static boolean looksLikeValidNumber(final String s) {
        if (s == null || s.isEmpty()) {
            return false;
        }
        if (s.length() == 1) {
            final char c = s.charAt(0);
            return c <= '9' && c >= '0';
        }
        int i = 0;
        final char first = s.charAt(0);
        if (first == '-' || first == '+') {
            i = 1;
        }
        boolean digits = false;
        for (final int len = s.length(); i < len; ++i) {
            final char c = s.charAt(i);
            if (c >= '0' && c <= '9') {
                digits = true;
            } else if (!(c == 'e' || c == 'E' || c == '.' || c == '-' || c == '+')) {
                return false;
            }
        }
        return digits;
    }

    public static BigDecimal parseBigDecimal(final char[] ch, final boolean useFastParser) {
        return parseBigDecimal(ch, 0, ch.length, useFastParser);
    }

    public static BigDecimal parseBigDecimal(
            final char[] ch,
            final int off,
            final int len,
            final boolean useFastParser) {
        return useFastParser ? BigDecimalParser.parseWithFastParser(ch, off, len)
                : BigDecimalParser.parse(ch, off, len);
    }

    public static BigDecimal parseBigDecimal(final String s, final boolean useFastParser) {
        return useFastParser ? BigDecimalParser.parseWithFastParser(s) : BigDecimalParser.parse(s);
    }

    public static BigInteger parseBigInteger(final String s, final boolean useFastParser) {
        return useFastParser ? BigIntegerParser.parseWithFastParser(s) : BigIntegerParser.parse(s);
    }

    public static double parseDouble(final String s, final boolean useFastParser) {
        return useFastParser ? JavaDoubleParser.parseDouble(s) : Double.parseDouble(s);
    }

    public static float parseFloat(final String s, final boolean useFastParser) {
        return useFastParser ? JavaFloatParser.parseFloat(s) : Float.parseFloat(s);
    }

    /**
     * Parses an int from at most 9 pre-validated digits, without sign.
     *
     * @param ch
     *            characters
     * @param off
     *            offset of first digit
     * @param len
     *            number of digits
     * @return parsed value
     */
    public static int parseInt(final char[] ch, int off, int len) {
        int num = 0;
        while (--len >= 0) {
            num = num * 10 + (ch[off++] - '0');
        }
        return num;
    }

    /**
     * Parses an int from a String that is known to hold a valid integer, with optional minus
     * sign.
     *
     * @param s
     *            string to parse
     * @return parsed value
     */
    public static int parseInt(final String s) {
        final int len = s.length();
        final boolean neg = len > 0 && s.charAt(0) == '-';
        final int offset = neg ? 1 : 0;
        if (len - offset > 9) {
            return Integer.parseInt(s);
        }
        int num = 0;
        for (int i = offset; i < len; ++i) {
            final char c = s.charAt(i);
            if (c > '9' || c < '0') {
                return Integer.parseInt(s);
            }
            num = num * 10 + (c - '0');
        }
        return neg ? -num : num;
    }

    /**
     * Parses a long from pre-validated digits, without sign. The magnitude of
     * {@link Long#MIN_VALUE} wraps to itself, so negating the result gives the right value.
     *
     * @param ch
     *            characters
     * @param off
     *            offset of first digit
     * @param len
     *            number of digits
     * @return parsed value
     */
    public static long parseLong(final char[] ch, int off, int len) {
        long num = 0L;
        while (--len >= 0) {
            num = num * 10L + (ch[off++] - '0');
        }
        return num;
    }

    public static long parseLong(final String s) {
        final int len = s.length();
        if (len <= 9) {
            return parseInt(s);
        }
        return Long.parseLong(s);
    }

    private NumberInput() {
        // utility class
    }
}
