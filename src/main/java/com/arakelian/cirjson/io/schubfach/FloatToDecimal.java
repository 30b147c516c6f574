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
import static com.arakelian.cirjson.io.schubfach.MathUtils.g1;
import static com.arakelian.cirjson.io.schubfach.MathUtils.pow10;
import static java.lang.Float.floatToRawIntBits;
import static java.lang.Integer.numberOfLeadingZeros;
import static java.lang.Math.multiplyHigh;

import java.nio.charset.StandardCharsets;

/**
 * Renders a float as the shortest decimal that rounds back to the same value, using the
 * Schubfach algorithm. Output uses the same syntax as {@link Float#toString(float)}.
 */
public final class FloatToDecimal {
    /** Precision in bits, including the hidden bit **/
    static final int P = 24;

    private static final int W = Float.SIZE - 1 - (P - 1);

    /** Minimum binary exponent: -149 **/
    static final int Q_MIN = (-1 << W - 1) - P + 3;

    /** Maximum binary exponent: 104 **/
    static final int Q_MAX = (1 << W - 1) - P;

    /** Maximum number of significant digits **/
    static final int H = 9;

    static final int C_TINY = 8;

    /** Maximum length of a rendered value, for example -1.17549435E-38 **/
    public static final int MAX_CHARS = H + 6;

    private static final int C_MIN = 1 << P - 1;

    private static final int BQ_MASK = (1 << W) - 1;

    private static final int T_MASK = (1 << P - 1) - 1;

    private static final long MASK_32 = (1L << 32) - 1;

    private static final int MASK_28 = (1 << 28) - 1;

    private static final int NON_SPECIAL = 0;

    private static final int PLUS_ZERO = 1;

    private static final int MINUS_ZERO = 2;

    private static final int PLUS_INF = 3;

    private static final int MINUS_INF = 4;

    private static final int NAN = 5;

    /**
     * Computes rop(cp g 2^-95), rounding to odd.
     */
    private static int rop(final long g, final long cp) {
        final long x1 = multiplyHigh(g, cp);
        final long vbp = x1 >>> 31;
        return (int) (vbp | (x1 & MASK_32) + MASK_32 >>> 32);
    }

    /**
     * Returns the shortest decimal representation of the given value.
     *
     * @param v
     *            value to render
     * @return decimal string, or one of <code>NaN</code>, <code>Infinity</code>,
     *         <code>-Infinity</code>
     */
    public static String toString(final float v) {
        return new FloatToDecimal().toDecimalString(v);
    }

    private final byte[] bytes = new byte[MAX_CHARS];

    private int index;

    private FloatToDecimal() {
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
        // floor(e / 10) = floor(103 e / 2^10)
        final int d = e * 103 >>> 10;
        appendDigit(d);
        appendDigit(e - 10 * d);
    }

    private void removeTrailingZeroes() {
        while (bytes[index] == '0') {
            --index;
        }
        if (bytes[index] == '.') {
            ++index;
        }
    }

    private int toChars(int f, int e) {
        int len = flog10pow2(Integer.SIZE - numberOfLeadingZeros(f));
        if (f >= pow10(len)) {
            len += 1;
        }

        // scale so that 10^(H-1) <= f < 10^H
        f *= (int) pow10(H - len);
        e += len;

        // floor(f / 10^8) = floor(1_441_151_881 f / 2^57)
        final int h = (int) (f * 1_441_151_881L >>> 57);
        final int l = f - 100_000_000 * h;

        if (0 < e && e <= 7) {
            return toChars1(h, l, e);
        }
        if (-3 < e && e <= 0) {
            return toChars2(h, l, e);
        }
        return toChars3(h, l, e);
    }

    private int toChars1(final int h, final int l, final int e) {
        appendDigit(h);
        int y = y(l);
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
        removeTrailingZeroes();
        return NON_SPECIAL;
    }

    private int toChars2(final int h, final int l, int e) {
        appendDigit(0);
        append('.');
        for (; e < 0; ++e) {
            appendDigit(0);
        }
        appendDigit(h);
        append8Digits(l);
        removeTrailingZeroes();
        return NON_SPECIAL;
    }

    private int toChars3(final int h, final int l, final int e) {
        appendDigit(h);
        append('.');
        append8Digits(l);
        removeTrailingZeroes();
        exponent(e - 1);
        return NON_SPECIAL;
    }

    private int toDecimal(final float v) {
        final int bits = floatToRawIntBits(v);
        final int t = bits & T_MASK;
        final int bq = bits >>> P - 1 & BQ_MASK;
        if (bq < BQ_MASK) {
            index = -1;
            if (bits < 0) {
                append('-');
            }
            if (bq != 0) {
                final int mq = -Q_MIN + 1 - bq;
                final int c = C_MIN | t;
                if (0 < mq & mq < P) {
                    final int f = c >> mq;
                    if (f << mq == c) {
                        return toChars(f, 0);
                    }
                }
                return toDecimal(-mq, c, 0);
            }
            if (t != 0) {
                return t < C_TINY ? toDecimal(Q_MIN, 10 * t, -1) : toDecimal(Q_MIN, t, 0);
            }
            return bits == 0 ? PLUS_ZERO : MINUS_ZERO;
        }
        if (t != 0) {
            return NAN;
        }
        return bits > 0 ? PLUS_INF : MINUS_INF;
    }

    private int toDecimal(final int q, final int c, final int dk) {
        final int out = c & 0x1;
        final long cb = (long) c << 2;
        final long cbr = cb + 2;
        final long cbl;
        final int k;
        if (c != C_MIN | q == Q_MIN) {
            cbl = cb - 2;
            k = flog10pow2(q);
        } else {
            cbl = cb - 1;
            k = flog10threeQuartersPow2(q);
        }
        final int h = q + flog2pow10(-k) + 33;

        // upper 64 bits of the double table entry are enough for floats
        final long g = g1(k) + 1;

        final int vb = rop(g, cb << h);
        final int vbl = rop(g, cbl << h);
        final int vbr = rop(g, cbr << h);

        final int s = vb >> 2;
        if (s >= 100) {
            // s' = floor(s / 10) = floor(s 1_717_986_919 / 2^34)
            final int sp10 = 10 * (int) (s * 1_717_986_919L >>> 34);
            final int tp10 = sp10 + 10;
            final boolean upin = vbl + out <= sp10 << 2;
            final boolean wpin = (tp10 << 2) + out <= vbr;
            if (upin != wpin) {
                return toChars(upin ? sp10 : tp10, k);
            }
        }

        final int t = s + 1;
        final boolean uin = vbl + out <= s << 2;
        final boolean win = (t << 2) + out <= vbr;
        if (uin != win) {
            return toChars(uin ? s : t, k + dk);
        }
        final int cmp = vb - (s + t << 1);
        return toChars(cmp < 0 || cmp == 0 && (s & 0x1) == 0 ? s : t, k + dk);
    }

    private String toDecimalString(final float v) {
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

    private int y(final int a) {
        return (int) (multiplyHigh((long) (a + 1) << 28, 193_428_131_138_340_668L) >>> 20) - 1;
    }
}
