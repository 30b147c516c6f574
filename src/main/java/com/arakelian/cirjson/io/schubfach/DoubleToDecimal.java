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

package com.arakelian.cirjson.io.schubfach;

import static com.arakelian.cirjson.io.schubfach.MathUtils.flog10pow2;
import static com.arakelian.cirjson.io.schubfach.MathUtils.flog10threeQuartersPow2;
import static com.arakelian.cirjson.io.schubfach.MathUtils.flog2pow10;
import static com.arakelian.cirjson.io.schubfach.MathUtils.g0;
import static com.arakelian.cirjson.io.schubfach.MathUtils.g1;
import static com.arakelian.cirjson.io.schubfach.MathUtils.pow10;
import static java.lang.Double.doubleToRawLongBits;
import static java.lang.Long.numberOfLeadingZeros;
import static java.lang.Math.multiplyHigh;

import java.nio.charset.StandardCharsets;

/**
 * Renders a double as the shortest decimal that rounds back to the same value, using the
 * Schubfach algorithm. Output uses the same syntax as {@link Double#toString(double)}.
 */
public final class DoubleToDecimal {
    /** Precision in bits, including the hidden bit **/
    static final int P = 53;

    /** Exponent width in bits **/
    private static final int W = Double.SIZE - 1 - (P - 1);

    /** Minimum binary exponent: -1074 **/
    static final int Q_MIN = (-1 << W - 1) - P + 3;

    /** Maximum binary exponent: 971 **/
    static final int Q_MAX = (1 << W - 1) - P;

    /** Maximum number of significant digits **/
    static final int H = 17;

    /** Subnormal significands below this get one extra digit of precision **/
    static final long C_TINY = 3;

    /** Maximum length of a rendered value, for example -2.2250738585072014E-308 **/
    public static final int MAX_CHARS = H + 7;

    private static final long C_MIN = 1L << P - 1;

    private static final int BQ_MASK = (1 << W) - 1;

    private static final long T_MASK = (1L << P - 1) - 1;

    private static final long MASK_63 = (1L << 63) - 1;

    private static final int MASK_28 = (1 << 28) - 1;

    private static final int NON_SPECIAL = 0;

    private static final int PLUS_ZERO = 1;

    private static final int MINUS_ZERO = 2;

    private static final int PLUS_INF = 3;

    private static final int MINUS_INF = 4;

    private static final int NAN = 5;

    /**
     * Computes rop(cp g 2^-127), where g = g1 2^63 + g0, rounding to odd.
     */
    private static long rop(final long g1, final long g0, final long cp) {
        final long x1 = multiplyHigh(g0, cp);
        final long y0 = g1 * cp;
        final long y1 = multiplyHigh(g1, cp);
        final long z = (y0 >>> 1) + x1;
        final long vbp = y1 + (z >>> 63);
        return vbp | (z & MASK_63) + MASK_63 >>> 63;
    }

    /**
     * Returns the shortest decimal representation of the given value.
     *
     * @param v
     *            value to render
     * @return decimal string, or one of <code>NaN</code>, <code>Infinity</code>,
     *         <code>-Infinity</code>
     */
    public static String toString(final double v) {
        return new DoubleToDecimal().toDecimalString(v);
    }

    private final byte[] bytes = new byte[MAX_CHARS];

    /** Index of the last character written **/
    private int index;

    private DoubleToDecimal() {
    }

    private void append(final int c) {
        bytes[++index] = (byte) c;
    }

    private void append8Digits(final int m) {
        int y = y(m);
        for (int i = 0; i < 8; ++i) {
            final int t = 10 * y;
            appendDigit(t >>> 28);
            y = t & MASK_28;
        }
    }

    private void appendDigit(final int d) {
        bytes[++index] = (byte) ('0' + d);
    }

    private String charsToString() {
        return new String(bytes, 0, index + 1, StandardCharsets.ISO_8859_1);
    }

    private void exponent(int e) {
        append('E');
        if (e < 0) {
            append('-');
            e = -e;
        }
        if (e < 10) {
            appendDigit(e);
            return;
        }
        int d;
        if (e >= 100) {
            // floor(e / 100) = floor(1311 e / 2^17)
            d = e * 1311 >>> 17;
            appendDigit(d);
            e -= 100 * d;
        }
        // floor(e / 10) = floor(103 e / 2^10)
        d = e * 103 >>> 10;
        appendDigit(d);
        appendDigit(e - 10 * d);
    }

    private void lowDigits(final int l) {
        if (l != 0) {
            append8Digits(l);
        }
        removeTrailingZeroes();
    }

    private void removeTrailingZeroes() {
        while (bytes[index] == '0') {
            --index;
        }
        // keep one digit after the point
        if (bytes[index] == '.') {
            ++index;
        }
    }

    /**
     * Formats f 10^e.
     */
    private int toChars(long f, int e) {
        // 10^(len-1) <= f < 10^len
        int len = flog10pow2(Long.SIZE - numberOfLeadingZeros(f));
        if (f >= pow10(len)) {
            len += 1;
        }

        // scale so that 10^(H-1) <= f < 10^H
        f *= pow10(H - len);
        e += len;

        // split into h (1 digit), m (8 digits), l (8 digits); floor(f / 10^8) = floor(floor(f c / 2^64) / 2^20)
        final long hm = multiplyHigh(f, 193_428_131_138_340_668L) >>> 20;
        final int l = (int) (f - 100_000_000L * hm);
        final int h = (int) (hm * 1_441_151_881L >>> 57);
        final int m = (int) (hm - 100_000_000 * h);

        if (0 < e && e <= 7) {
            return toChars1(h, m, l, e);
        }
        if (-3 < e && e <= 0) {
            return toChars2(h, m, l, e);
        }
        return toChars3(h, m, l, e);
    }

    /** Plain format without leading zeroes **/
    private int toChars1(final int h, final int m, final int l, final int e) {
        appendDigit(h);
        int y = y(m);
        int t;
        int i = 1;
        for (; i < e; ++i) {
            t = 10 * y;
            appendDigit(t >>> 28);
            y = t & MASK_28;
        }
        append('.');
        for (; i <= 8; ++i) {
            t = 10 * y;
            appendDigit(t >>> 28);
            y = t & MASK_28;
        }
        lowDigits(l);
        return NON_SPECIAL;
    }

    /** Plain format with leading zeroes **/
    private int toChars2(final int h, final int m, final int l, int e) {
        appendDigit(0);
        append('.');
        for (; e < 0; ++e) {
            appendDigit(0);
        }
        appendDigit(h);
        append8Digits(m);
        lowDigits(l);
        return NON_SPECIAL;
    }

    /** Scientific notation **/
    private int toChars3(final int h, final int m, final int l, final int e) {
        appendDigit(h);
        append('.');
        append8Digits(m);
        lowDigits(l);
        exponent(e - 1);
        return NON_SPECIAL;
    }

    private int toDecimal(final double v) {
        final long bits = doubleToRawLongBits(v);
        final long t = bits & T_MASK;
        final int bq = (int) (bits >>> P - 1) & BQ_MASK;
        if (bq < BQ_MASK) {
            index = -1;
            if (bits < 0) {
                append('-');
            }
            if (bq != 0) {
                // normal value, mq = -q
                final int mq = -Q_MIN + 1 - bq;
                final long c = C_MIN | t;
                // integers below 2^53 render directly
                if (0 < mq & mq < P) {
                    final long f = c >> mq;
                    if (f << mq == c) {
                        return toChars(f, 0);
                    }
                }
                return toDecimal(-mq, c, 0);
            }
            if (t != 0) {
                // subnormal value
                return t < C_TINY ? toDecimal(Q_MIN, 10 * t, -1) : toDecimal(Q_MIN, t, 0);
            }
            return bits == 0 ? PLUS_ZERO : MINUS_ZERO;
        }
        if (t != 0) {
            return NAN;
        }
        return bits > 0 ? PLUS_INF : MINUS_INF;
    }

    private int toDecimal(final int q, final long c, final int dk) {
        final int out = (int) c & 0x1;
        final long cb = c << 2;
        final long cbr = cb + 2;
        final long cbl;
        final int k;
        // the rounding interval is asymmetric only at powers of 2
        if (c != C_MIN | q == Q_MIN) {
            cbl = cb - 2;
            k = flog10pow2(q);
        } else {
            cbl = cb - 1;
            k = flog10threeQuartersPow2(q);
        }
        final int h = q + flog2pow10(-k) + 2;

        final long g1 = g1(k);
        final long g0 = g0(k);

        final long vb = rop(g1, g0, cb << h);
        final long vbl = rop(g1, g0, cbl << h);
        final long vbr = rop(g1, g0, cbr << h);

        final long s = vb >> 2;
        if (s >= 100) {
            // s' = floor(s / 10) = floor(s 115_292_150_460_684_698 / 2^60)
            final long sp10 = 10 * multiplyHigh(s, 115_292_150_460_684_698L << 4);
            final long tp10 = sp10 + 10;
            final boolean upin = vbl + out <= sp10 << 2;
            final boolean wpin = (tp10 << 2) + out <= vbr;
            if (upin != wpin) {
                return toChars(upin ? sp10 : tp10, k);
            }
        }

        final long t = s + 1;
        final boolean uin = vbl + out <= s << 2;
        final boolean win = (t << 2) + out <= vbr;
        if (uin != win) {
            return toChars(uin ? s : t, k + dk);
        }

        // both in the rounding interval, pick the closest, ties to even
        final long cmp = vb - (s + t << 1);
        return toChars(cmp < 0 || cmp == 0 && (s & 0x1) == 0 ? s : t, k + dk);
    }

    private String toDecimalString(final double v) {
        switch (toDecimal(v)) {
        case NON_SPECIAL:
            return charsToString();
        case PLUS_ZERO:
            return "0.0";
        case MINUS_ZERO:
            return "-0.0";
        case PLUS_INF:
            return "Infinity";
        case MINUS_INF:
            return "-Infinity";
        default:
            return "NaN";
        }
    }

    /**
     * Computes floor((a + 1) 2^28 / 10^8) - 1 for left-to-right digit extraction.
     */
    private int y(final int a) {
        return (int) (multiplyHigh((long) (a + 1) << 28, 193_428_131_138_340_668L) >>> 20) - 1;
    }
}
