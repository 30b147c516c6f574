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

package com.arakelian.cirjson.sym;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * {@link PropertyNameMatcher} that can also match UTF-8 encoded names by their quads, using the
 * same packing as {@link ByteQuadsCanonicalizer}.
 */
public final class BinaryNameMatcher extends PropertyNameMatcher {
    /**
     * Creates a case-sensitive matcher.
     *
     * @param names
     *            expected names; the index of each is its ordinal, and null entries are skipped
     * @return new matcher
     */
    public static BinaryNameMatcher construct(final List<String> names) {
        return new BinaryNameMatcher(null, null, names);
    }

    /**
     * Creates a matcher that falls back to a lower-case comparison when the exact match fails.
     * Quad matching is not supported for such matchers.
     *
     * @param locale
     *            locale used for lower-casing
     * @param names
     *            expected names
     * @return new matcher
     */
    public static BinaryNameMatcher constructCaseInsensitive(final Locale locale, final List<String> names) {
        final SimpleNameMatcher backup = SimpleNameMatcher.construct(locale, lowercase(locale, names));
        return new BinaryNameMatcher(locale, backup, names);
    }

    /**
     * Packs the UTF-8 bytes of a name into padded big-endian quads.
     *
     * @param name
     *            name to pack
     * @return quads, possibly empty
     */
    public static int[] quads(final String name) {
        final byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        final int qlen = (bytes.length + 3) >> 2;
        final int[] result = new int[qlen];
        for (int i = 0; i < qlen; i++) {
            final int off = i << 2;
            final int n = Math.min(4, bytes.length - off);
            int q = 0;
            for (int j = 0; j < n; j++) {
                q = q << 8 | bytes[off + j] & 0xFF;
            }
            result[i] = ByteQuadsCanonicalizer.pad(q, n);
        }
        return result;
    }

    private final int mask;

    private final int[][] slotQuads;

    private final int[] slotOrdinals;

    private final SimpleNameMatcher stringMatcher;

    private BinaryNameMatcher(final Locale locale, final SimpleNameMatcher backup, final List<String> names) {
        super(locale, backup, names.toArray(new String[names.size()]));
        this.stringMatcher = SimpleNameMatcher.construct(locale, names);

        final int size = findSize(names.size()) << 1;
        this.mask = size - 1;
        this.slotQuads = new int[size][];
        this.slotOrdinals = new int[size];
        for (int i = 0, n = names.size(); i < n; i++) {
            final String name = names.get(i);
            if (name == null || stringMatcher.matchName(name) != i) {
                // null or duplicate
                continue;
            }
            final int[] q = quads(name);
            int ix = hash(q, q.length) & mask;
            while (slotQuads[ix] != null) {
                ix = ix + 1 & mask;
            }
            slotQuads[ix] = q;
            slotOrdinals[ix] = i;
        }
    }

    private int hash(final int[] q, final int qlen) {
        int h = qlen;
        for (int i = 0; i < qlen; i++) {
            h = h * 31 + q[i];
        }
        return h ^ h >>> 16;
    }

    @Override
    public int matchByQuad(final int q1) {
        return matchByQuad(new int[] { q1 }, 1);
    }

    @Override
    public int matchByQuad(final int q1, final int q2) {
        return matchByQuad(new int[] { q1, q2 }, 2);
    }

    @Override
    public int matchByQuad(final int q1, final int q2, final int q3) {
        return matchByQuad(new int[] { q1, q2, q3 }, 3);
    }

    @Override
    public int matchByQuad(final int[] q, final int qlen) {
        for (int ix = hash(q, qlen) & mask;; ix = ix + 1 & mask) {
            final int[] stored = slotQuads[ix];
            if (stored == null) {
                return MATCH_UNKNOWN_NAME;
            }
            if (stored.length == qlen && Arrays.equals(stored, 0, qlen, q, 0, qlen)) {
                return slotOrdinals[ix];
            }
        }
    }

    @Override
    public int matchName(final String name) {
        final int ix = stringMatcher.matchName(name);
        if (ix >= 0) {
            return ix;
        }
        return matchSecondary(name);
    }

    @Override
    public boolean supportsQuadMatching() {
        return backupMatcher == null;
    }
}
