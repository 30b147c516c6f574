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

import com.arakelian.cirjson.io.schubfach.DoubleToDecimal;
import com.arakelian.cirjson.io.schubfach.FloatToDecimal;

/**
 * Writes numbers directly into char and byte buffers, without creating intermediate Strings.
 */
public final class NumberOutput {
    private static final char[] MIN_INT_CHARS = String.valueOf(Integer.MIN_VALUE).toCharArray();

    private static final char[] MIN_LONG_CHARS = String.valueOf(Long.MIN_VALUE).toCharArray();

    /** Two ASCII digits for every value 0-99 **/
    private static final byte[] DIGIT_PAIRS = new byte[200];

    static {
        for (int i = 0; i < 100; i++) {
            DIGIT_PAIRS[i << 1] = (byte) ('0' + i / 10);
            DIGIT_PAIRS[(i << 1) + 1] = (byte) ('0' + i % 10);
        }
    }

    /**
     * Writes the decimal representation of an int.
     *
     * @param v
     *            value to write
     * @param b
     *            destination buffer, with room for at least 11 bytes
     * @param off
     *            offset of the first byte to write
     * @return offset after the last byte written
     */
    public static int outputInt(final int v, final byte[] b, final int off) {
        return outputLong(v, b, off);
    }

    /**
     * Writes the decimal representation of an int.
     *
     * @param v
     *            value to write
     * @param b
     *            destination buffer, with room for at least 11 chars
     * @param off
     *            offset of the first char to write
     * @return offset after the last char written
     */
    public static int outputInt(final int v, final char[] b, final int off) {
        if (v == Integer.MIN_VALUE) {
            System.arraycopy(MIN_INT_CHARS, 0, b, off, MIN_INT_CHARS.length);
            return off + MIN_INT_CHARS.length;
        }
        return outputLong(v, b, off);
    }

    public static int outputLong(long v, final byte[] b, int off) {
        if (v == Long.MIN_VALUE) {
            for (final char c : MIN_LONG_CHARS) {
                b[off++] = (byte) c;
            }
            return off;
        }
        if (v < 0) {
            b[off++] = '-';
            v = -v;
        }
        final int end = off + digitCount(v);
        int pos = end;
        while (v >= 100) {
            final int pair = (int) (v % 100) << 1;
            v /= 100;
            b[--pos] = DIGIT_PAIRS[pair + 1];
            b[--pos] = DIGIT_PAIRS[pair];
        }
        final int pair = (int) v << 1;
        b[--pos] = DIGIT_PAIRS[pair + 1];
        if (v >= 10) {
            b[--pos] = DIGIT_PAIRS[pair];
        }
        return end;
    }

    public static int outputLong(long v, final char[] b, int off) {
        if (v == Long.MIN_VALUE) {
            System.arraycopy(MIN_LONG_CHARS, 0, b, off, MIN_LONG_CHARS.length);
            return off + MIN_LONG_CHARS.length;
        }
        if (v < 0) {
            b[off++] = '-';
            v = -v;
        }
        final int end = off + digitCount(v);
        int pos = end;
        while (v >= 100) {
            final int pair = (int) (v % 100) << 1;
            v /= 100;
            b[--pos] = (char) DIGIT_PAIRS[pair + 1];
            b[--pos] = (char) DIGIT_PAIRS[pair];
        }
        final int pair = (int) v << 1;
        b[--pos] = (char) DIGIT_PAIRS[pair + 1];
        if (v >= 10) {
            b[--pos] = (char) DIGIT_PAIRS[pair];
        }
        return end;
    }

    /**
     * Returns the shortest decimal String that parses back to the given value.
     *
     * @param v
     *            value to convert
     * @param useFastWriter
     *            true to use the Schubfach writer instead of {@link Double#toString(double)}
     * @return decimal representation
     */
    public static String toString(final double v, final boolean useFastWriter) {
        return useFastWriter ? DoubleToDecimal.toString(v) : Double.toString(v);
    }

    public static String toString(final float v, final boolean useFastWriter) {
        return useFastWriter ? FloatToDecimal.toString(v) : Float.toString(v);
    }

    private static int digitCount(final long v) {
        // v is non-negative
        long p = 10;
        for (int i = 1; i < 19; i++) {
            if (v < p) {
                return i;
            }
            p *= 10;
        }
        return 19;
    }

    private NumberOutput() {
        // utility class
    }
}
