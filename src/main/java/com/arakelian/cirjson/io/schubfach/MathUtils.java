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

import java.math.BigInteger;

/**
 * Arithmetic helpers for the Schubfach float and double formatting algorithm, following Raffaello
 * Giulietti, "The Schubfach way to render doubles".
 */
final class MathUtils {
    /** Smallest power of 10 exponent covered by the g table **/
    static final int K_MIN = -324;

    /** Largest power of 10 exponent covered by the g table **/
    static final int K_MAX = 292;

    /** Maximum number of significant digits of a double **/
    static final int H = 17;

    private static final long MASK_63 = (1L << 63) - 1;

    private static final long[] POW10 = new long[H + 1];

    /**
     * For each k in [K_MIN, K_MAX], g = floor(10^-k 2^-r) + 1 where r = flog2pow10(-k) - 125, so
     * that 2^125 &lt;= g &lt; 2^126. Stored as pairs (g1, g0) with g = g1 2^63 + g0.
     */
    private static final long[] G = new long[2 * (K_MAX - K_MIN + 1)];

    static {
        long p = 1L;
        for (int i = 0; i <= H; i++) {
            POW10[i] = p;
            p *= 10L;
        }

        final BigInteger mask63 = BigInteger.valueOf(MASK_63);
        for (int k = K_MIN; k <= K_MAX; k++) {
            final int r = flog2pow10(-k) - 125;
            BigInteger g;
            if (k <= 0) {
                final BigInteger pow = BigInteger.TEN.pow(-k);
                g = r >= 0 ? pow.shiftRight(r) : pow.shiftLeft(-r);
            } else {
                // r is always negative here
                g = BigInteger.ONE.shiftLeft(-r).divide(BigInteger.TEN.pow(k));
            }
            g = g.add(BigInteger.ONE);
            final int ix = k - K_MIN << 1;
            G[ix] = g.shiftRight(63).longValueExact();
            G[ix | 1] = g.and(mask63).longValue();
        }
    }

    /**
     * Returns floor(log10(3/4 2^e)), valid for |e| &lt;= 5_456_721.
     *
     * @param e
     *            binary exponent
     * @return the floor of the decimal logarithm
     */
    static int flog10threeQuartersPow2(final int e) {
        return (int) (e * 661_971_961_083L + -274_743_187_321L >> 41);
    }

    /**
     * Returns floor(log10(2^e)), valid for |e| &lt;= 5_456_721.
     *
     * @param e
     *            binary exponent
     * @return the floor of the decimal logarithm
     */
    static int flog10pow2(final int e) {
        return (int) (e * 661_971_961_083L >> 41);
    }

    /**
     * Returns floor(log2(10^e)), valid for |e| &lt;= 1_838_394.
     *
     * @param e
     *            decimal exponent
     * @return the floor of the binary logarithm
     */
    static int flog2pow10(final int e) {
        return (int) (e * 913_124_641_741L >> 38);
    }

    static long g0(final int k) {
        return G[k - K_MIN << 1 | 1];
    }

    static long g1(final int k) {
        return G[k - K_MIN << 1];
    }

    static long pow10(final int e) {
        return POW10[e];
    }

    private MathUtils() {
        // utility class
    }
}
